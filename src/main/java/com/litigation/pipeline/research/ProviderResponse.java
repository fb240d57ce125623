package com.litigation.pipeline.research;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one provider search.
 *
 * @param remainingQuota calls the provider says are left in its current window, or -1 if unreported
 */
public record ProviderResponse(Status status, List<RawCitation> citations, int remainingQuota, String message) {

    public enum Status { SUCCESS, RATE_LIMITED, ERROR }

    public ProviderResponse {
        Objects.requireNonNull(status, "status is required");
        citations = citations != null ? List.copyOf(citations) : List.of();
    }

    public static ProviderResponse success(List<RawCitation> citations) {
        return new ProviderResponse(Status.SUCCESS, citations, -1, null);
    }

    public static ProviderResponse success(List<RawCitation> citations, int remainingQuota) {
        return new ProviderResponse(Status.SUCCESS, citations, remainingQuota, null);
    }

    public static ProviderResponse rateLimited(String message) {
        return new ProviderResponse(Status.RATE_LIMITED, List.of(), 0, message);
    }

    public static ProviderResponse error(String message) {
        return new ProviderResponse(Status.ERROR, List.of(), -1, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean reportsQuota() {
        return remainingQuota >= 0;
    }
}
