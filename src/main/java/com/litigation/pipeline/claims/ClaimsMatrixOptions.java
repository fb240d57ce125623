package com.litigation.pipeline.claims;

/**
 * Thresholds for {@link ClaimsMatrixEngine}.
 *
 * @param minConfidence         causes below this confidence are left out of the result
 * @param satisfactionThreshold attachment strength at which an element counts as satisfied
 */
public record ClaimsMatrixOptions(double minConfidence, double satisfactionThreshold) {

    public ClaimsMatrixOptions {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        if (satisfactionThreshold <= 0.0 || satisfactionThreshold > 1.0) {
            throw new IllegalArgumentException("satisfactionThreshold must be in (0.0, 1.0]");
        }
    }

    /**
     * Default options: causes below 0.25 are omitted, elements are satisfied at strength 0.5.
     */
    public static ClaimsMatrixOptions defaults() {
        return new ClaimsMatrixOptions(0.25, 0.5);
    }
}
