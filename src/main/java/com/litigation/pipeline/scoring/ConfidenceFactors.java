package com.litigation.pipeline.scoring;

/**
 * Inputs to {@link ConfidenceScorer#score(ConfidenceFactors)}.
 *
 * @param sourceCredibility how far the source is trusted, 0.0 to 1.0
 * @param evidenceCount     number of independent corroborating pieces of evidence
 * @param recencyYears      age of the observation in years
 * @param jurisdictionMatch whether the observation belongs to the jurisdiction of interest
 */
public record ConfidenceFactors(double sourceCredibility, int evidenceCount,
                                double recencyYears, boolean jurisdictionMatch) {

    public ConfidenceFactors {
        if (Double.isNaN(sourceCredibility) || sourceCredibility < 0.0 || sourceCredibility > 1.0) {
            throw new IllegalArgumentException("sourceCredibility must be between 0.0 and 1.0, got " + sourceCredibility);
        }
        if (evidenceCount < 0) {
            throw new IllegalArgumentException("evidenceCount must be >= 0");
        }
        if (Double.isNaN(recencyYears) || recencyYears < 0.0) {
            throw new IllegalArgumentException("recencyYears must be >= 0");
        }
    }

    /**
     * Factors for a fresh observation from a single source of the given credibility.
     */
    public static ConfidenceFactors of(double sourceCredibility, boolean jurisdictionMatch) {
        return new ConfidenceFactors(sourceCredibility, 1, 0.0, jurisdictionMatch);
    }
}
