package com.litigation.pipeline.scoring;

/**
 * Tunables for {@link ConfidenceScorer}.
 *
 * @param foundationalBoost  flat boost added once to entities from a foundational source
 * @param decayHorizonYears  age at which the recency decay reaches zero
 */
public record ScoringConfig(double foundationalBoost, double decayHorizonYears) {

    public ScoringConfig {
        if (foundationalBoost < 0.0 || foundationalBoost > 1.0) {
            throw new IllegalArgumentException("foundationalBoost must be between 0.0 and 1.0");
        }
        if (decayHorizonYears <= 0.0) {
            throw new IllegalArgumentException("decayHorizonYears must be > 0");
        }
    }

    /**
     * Default configuration: +0.2 foundational boost, linear decay to zero over 10 years.
     */
    public static ScoringConfig defaults() {
        return new ScoringConfig(0.2, 10.0);
    }
}
