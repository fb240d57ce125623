package com.litigation.pipeline.scoring;

/**
 * Computes bounded confidence values from weighted factors.
 *
 * <p>Formula:</p>
 * <pre>
 * score = 0.4 * sourceCredibility
 *       + 0.3 * min(evidenceCount / 5, 1)
 *       + 0.2 * recencyDecay(recencyYears)
 *       + 0.1 * (jurisdictionMatch ? 1 : 0)
 * </pre>
 *
 * <p>The result is clamped to [0.0, 1.0]. The scorer holds no mutable state and is
 * safe to share between threads.</p>
 */
public class ConfidenceScorer {

    static final double CREDIBILITY_WEIGHT = 0.4;
    static final double EVIDENCE_WEIGHT = 0.3;
    static final double RECENCY_WEIGHT = 0.2;
    static final double JURISDICTION_WEIGHT = 0.1;
    static final int EVIDENCE_SATURATION = 5;

    private final ScoringConfig config;

    public ConfidenceScorer() {
        this(ScoringConfig.defaults());
    }

    public ConfidenceScorer(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Scores the given factors.
     *
     * @return a confidence value in [0.0, 1.0]
     */
    public double score(ConfidenceFactors factors) {
        double evidence = Math.min((double) factors.evidenceCount() / EVIDENCE_SATURATION, 1.0);
        double raw = CREDIBILITY_WEIGHT * factors.sourceCredibility()
                + EVIDENCE_WEIGHT * evidence
                + RECENCY_WEIGHT * recencyDecay(factors.recencyYears())
                + (factors.jurisdictionMatch() ? JURISDICTION_WEIGHT : 0.0);
        return clamp(raw);
    }

    /**
     * Linear decay from 1.0 at age zero to 0.0 at the configured horizon.
     * Monotonically non-increasing in age and never negative.
     */
    public double recencyDecay(double ageYears) {
        if (ageYears <= 0.0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - ageYears / config.decayHorizonYears());
    }

    /**
     * Adds the foundational boost to an already computed score and clamps the result.
     */
    public double applyFoundationalBoost(double score) {
        return clamp(score + config.foundationalBoost());
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
