package com.litigation.pipeline.jurisdiction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Resolves precedence and preemption among competing authorities.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li>An authority that preempts another candidate (or, when a legal area is given,
 *       names that area in its scope) wins regardless of rank, provided no other
 *       candidate preempts it.</li>
 *   <li>Otherwise the lowest precedence rank wins.</li>
 *   <li>A tie on the best rank is reported as an unresolved conflict. Ties are never
 *       broken silently.</li>
 * </ol>
 */
public class JurisdictionAuthorityResolver {
    private static final Logger log = LoggerFactory.getLogger(JurisdictionAuthorityResolver.class);

    private final AuthorityHierarchy hierarchy;

    public JurisdictionAuthorityResolver() {
        this(AuthorityHierarchy.defaults());
    }

    public JurisdictionAuthorityResolver(AuthorityHierarchy hierarchy) {
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy is required");
    }

    public AuthorityHierarchy getHierarchy() {
        return hierarchy;
    }

    public AuthorityResolution resolve(Collection<JurisdictionAuthority> candidates) {
        return resolve(candidates, null);
    }

    /**
     * Resolves the controlling authority among the candidates.
     *
     * @param candidates competing authorities, at least one
     * @param legalArea  optional legal area; an authority whose scope names it preempts the others
     */
    public AuthorityResolution resolve(Collection<JurisdictionAuthority> candidates, String legalArea) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate authority is required");
        }
        List<JurisdictionAuthority> distinct = distinct(candidates);
        if (distinct.size() == 1) {
            JurisdictionAuthority only = distinct.get(0);
            return AuthorityResolution.precedence(only, "Single candidate " + only.jurisdictionId());
        }

        List<JurisdictionAuthority> preemptors = distinct.stream()
                .filter(a -> preemptsAny(a, distinct, legalArea))
                .filter(a -> distinct.stream().noneMatch(other -> other.preempts(a)))
                .collect(Collectors.toList());

        if (!preemptors.isEmpty()) {
            AuthorityResolution byRank = lowestRank(preemptors);
            if (byRank.isUnresolvedConflict()) {
                log.info("authority.conflict.unresolved candidates={} reason=tied preemptors",
                        ids(byRank.tied()));
                return byRank;
            }
            JurisdictionAuthority winner = byRank.winner();
            String reason = legalArea != null && winner.preempts(legalArea)
                    ? winner.jurisdictionId() + " preempts the area " + legalArea
                    : winner.jurisdictionId() + " preempts " + ids(preempted(winner, distinct));
            return AuthorityResolution.preemption(winner, reason);
        }

        AuthorityResolution byRank = lowestRank(distinct);
        if (byRank.isUnresolvedConflict()) {
            log.info("authority.conflict.unresolved candidates={} reason=tied precedence", ids(byRank.tied()));
        }
        return byRank;
    }

    /**
     * Resolves by jurisdiction id, looking each id up in the hierarchy.
     */
    public AuthorityResolution resolveJurisdictions(Collection<String> jurisdictionIds, String legalArea) {
        List<JurisdictionAuthority> candidates = jurisdictionIds.stream()
                .map(hierarchy::lookup)
                .collect(Collectors.toList());
        return resolve(candidates, legalArea);
    }

    /**
     * Whether a citation from {@code citationJurisdiction} applies to a query about
     * {@code queryJurisdiction}: the two match, or the citation's jurisdiction preempts
     * the query's.
     */
    public boolean isCompatible(String citationJurisdiction, String queryJurisdiction) {
        if (citationJurisdiction == null || queryJurisdiction == null) {
            return false;
        }
        if (citationJurisdiction.equalsIgnoreCase(queryJurisdiction)) {
            return true;
        }
        return hierarchy.find(citationJurisdiction)
                .map(a -> a.preempts(queryJurisdiction))
                .orElse(false);
    }

    private static boolean preemptsAny(JurisdictionAuthority authority, List<JurisdictionAuthority> all,
                                       String legalArea) {
        if (legalArea != null && authority.preempts(legalArea)) {
            return true;
        }
        return all.stream().anyMatch(authority::preempts);
    }

    private static List<JurisdictionAuthority> preempted(JurisdictionAuthority winner,
                                                         List<JurisdictionAuthority> all) {
        return all.stream().filter(winner::preempts).collect(Collectors.toList());
    }

    private static AuthorityResolution lowestRank(List<JurisdictionAuthority> candidates) {
        int best = candidates.stream()
                .mapToInt(JurisdictionAuthority::precedenceRank)
                .min()
                .orElseThrow();
        List<JurisdictionAuthority> atBest = candidates.stream()
                .filter(a -> a.precedenceRank() == best)
                .sorted(Comparator.comparing(JurisdictionAuthority::jurisdictionId))
                .collect(Collectors.toList());
        if (atBest.size() > 1) {
            return AuthorityResolution.unresolved(atBest,
                    "Tied precedence rank " + best + " between " + ids(atBest));
        }
        JurisdictionAuthority winner = atBest.get(0);
        return AuthorityResolution.precedence(winner,
                winner.jurisdictionId() + " has the lowest precedence rank " + best);
    }

    private static List<JurisdictionAuthority> distinct(Collection<JurisdictionAuthority> candidates) {
        Map<String, JurisdictionAuthority> byId = new LinkedHashMap<>();
        for (JurisdictionAuthority candidate : candidates) {
            byId.putIfAbsent(candidate.jurisdictionId().toUpperCase(Locale.ROOT), candidate);
        }
        return new ArrayList<>(byId.values());
    }

    private static String ids(List<JurisdictionAuthority> authorities) {
        return authorities.stream().map(JurisdictionAuthority::jurisdictionId).collect(Collectors.joining(","));
    }
}
