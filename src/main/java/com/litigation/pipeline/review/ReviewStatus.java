package com.litigation.pipeline.review;

/**
 * Status of a review item.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
