package com.litigation.pipeline.jurisdiction;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One row of the authority hierarchy.
 *
 * @param jurisdictionId  jurisdiction code, e.g. {@code US} or {@code CA}
 * @param precedenceRank  lower rank wins when no preemption applies
 * @param preemptionScope jurisdiction ids and legal areas this authority preempts
 */
public record JurisdictionAuthority(String jurisdictionId, int precedenceRank, Set<String> preemptionScope) {

    public JurisdictionAuthority {
        Objects.requireNonNull(jurisdictionId, "jurisdictionId is required");
        if (jurisdictionId.isBlank()) {
            throw new IllegalArgumentException("jurisdictionId must not be blank");
        }
        if (precedenceRank < 1) {
            throw new IllegalArgumentException("precedenceRank must be >= 1");
        }
        preemptionScope = preemptionScope == null ? Set.of()
                : preemptionScope.stream()
                        .map(s -> s.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    public static JurisdictionAuthority of(String jurisdictionId, int precedenceRank, String... preempts) {
        return new JurisdictionAuthority(jurisdictionId, precedenceRank, Set.of(preempts));
    }

    /**
     * Whether this authority declares the given jurisdiction or legal area within its
     * preemption scope. Comparison ignores case.
     */
    public boolean preempts(String domain) {
        return domain != null && preemptionScope.contains(domain.toLowerCase(Locale.ROOT));
    }

    public boolean preempts(JurisdictionAuthority other) {
        return !other.jurisdictionId.equalsIgnoreCase(jurisdictionId) && preempts(other.jurisdictionId);
    }
}
