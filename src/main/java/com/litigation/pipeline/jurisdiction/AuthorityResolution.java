package com.litigation.pipeline.jurisdiction;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving competing authorities.
 *
 * @param winner the controlling authority, {@code null} when the conflict is unresolved
 * @param method how the winner was chosen
 * @param reason human readable explanation
 * @param tied   authorities sharing the best rank when unresolved, otherwise empty
 */
public record AuthorityResolution(JurisdictionAuthority winner, ResolutionMethod method,
                                  String reason, List<JurisdictionAuthority> tied) {

    public AuthorityResolution {
        Objects.requireNonNull(method, "method is required");
        tied = tied != null ? List.copyOf(tied) : List.of();
        if (method != ResolutionMethod.UNRESOLVED_CONFLICT && winner == null) {
            throw new IllegalArgumentException("winner is required for " + method);
        }
    }

    public static AuthorityResolution preemption(JurisdictionAuthority winner, String reason) {
        return new AuthorityResolution(winner, ResolutionMethod.PREEMPTION, reason, List.of());
    }

    public static AuthorityResolution precedence(JurisdictionAuthority winner, String reason) {
        return new AuthorityResolution(winner, ResolutionMethod.PRECEDENCE, reason, List.of());
    }

    public static AuthorityResolution unresolved(List<JurisdictionAuthority> tied, String reason) {
        return new AuthorityResolution(null, ResolutionMethod.UNRESOLVED_CONFLICT, reason, tied);
    }

    public boolean isUnresolvedConflict() {
        return method == ResolutionMethod.UNRESOLVED_CONFLICT;
    }

    public Optional<JurisdictionAuthority> winnerIfResolved() {
        return Optional.ofNullable(winner);
    }
}
