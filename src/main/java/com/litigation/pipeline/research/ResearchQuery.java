package com.litigation.pipeline.research;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Research query built from graph contents.
 *
 * @param text            free text sent to providers
 * @param legalIssues     issues the research must cover
 * @param jurisdictionId  jurisdiction the research is for
 * @param terms           normalized terms used for relevance scoring
 * @param recencyMatters  whether a lack of recent authority is a gap
 * @param anchorEntityIds graph entities the results are cited for
 */
public record ResearchQuery(String text, List<String> legalIssues, String jurisdictionId, List<String> terms,
                            boolean recencyMatters, List<String> anchorEntityIds) {

    public ResearchQuery {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(jurisdictionId, "jurisdictionId is required");
        legalIssues = legalIssues != null ? List.copyOf(legalIssues) : List.of();
        terms = terms != null ? List.copyOf(terms) : List.of();
        anchorEntityIds = anchorEntityIds != null ? List.copyOf(anchorEntityIds) : List.of();
    }

    public static ResearchQuery of(String text, String jurisdictionId, List<String> legalIssues) {
        return new ResearchQuery(text, legalIssues, jurisdictionId, QueryFormulator.tokenize(text), true, List.of());
    }

    /**
     * Canonical fingerprint: SHA-256 over the normalized text, the jurisdiction and the
     * sorted issue set. Equivalent queries share a fingerprint and therefore a cache entry.
     */
    public String fingerprint() {
        String normalizedText = text.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        TreeSet<String> issues = new TreeSet<>();
        legalIssues.forEach(issue -> issues.add(issue.toLowerCase(Locale.ROOT).trim()));
        String canonical = normalizedText + '|' + jurisdictionId.toUpperCase(Locale.ROOT) + '|'
                + String.join(",", issues);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
