package com.litigation.pipeline.research;

import com.litigation.pipeline.jurisdiction.JurisdictionAuthorityResolver;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds coverage weaknesses in ranked citations and computes overall research confidence.
 */
public class GapAnalyzer {

    static final int TOP_CITATIONS = 5;
    static final int QUANTITY_SATURATION = 20;

    private final JurisdictionAuthorityResolver resolver;
    private final int recencyHorizonYears;
    private final Clock clock;

    public GapAnalyzer(JurisdictionAuthorityResolver resolver, int recencyHorizonYears, Clock clock) {
        this.resolver = resolver;
        this.recencyHorizonYears = recencyHorizonYears;
        this.clock = clock;
    }

    public List<ResearchGap> analyze(ResearchQuery query, List<Citation> citations) {
        List<ResearchGap> gaps = new ArrayList<>();
        String jurisdiction = query.jurisdictionId();

        if (citations.stream().noneMatch(c -> resolver.isCompatible(c.jurisdictionId(), jurisdiction))) {
            gaps.add(new ResearchGap(ResearchGap.Type.MISSING_JURISDICTION,
                    "No citation applies to jurisdiction " + jurisdiction,
                    "Search " + jurisdiction + " sources or authority binding on " + jurisdiction));
        }
        if (query.recencyMatters() && citations.stream().noneMatch(this::isRecent)) {
            gaps.add(new ResearchGap(ResearchGap.Type.INSUFFICIENT_RECENCY,
                    "No citation decided within the last " + recencyHorizonYears + " years",
                    "Check for recent decisions that confirm or modify the cited authority"));
        }
        if (citations.stream().noneMatch(c -> c.authorityLevel() <= 2)) {
            gaps.add(new ResearchGap(ResearchGap.Type.AUTHORITY_THIN,
                    "No apex or appellate authority found",
                    "Look for supreme or appellate court decisions on the issues"));
        }
        for (String issue : query.legalIssues()) {
            boolean covered = citations.stream().anyMatch(c -> mentions(c, issue));
            if (!covered) {
                gaps.add(new ResearchGap(ResearchGap.Type.UNCOVERED_ISSUE,
                        "No citation addresses " + issue,
                        "Research authority specific to " + issue));
            }
        }
        return gaps;
    }

    /**
     * 0.4 × authority of the top citations + 0.3 × issue coverage + 0.2 × recency of the
     * top citations + 0.1 × quantity. Zero when there are no citations.
     */
    public double confidence(ResearchQuery query, List<Citation> citations) {
        if (citations.isEmpty()) {
            return 0.0;
        }
        List<Citation> top = citations.subList(0, Math.min(TOP_CITATIONS, citations.size()));
        double meanLevel = top.stream().mapToInt(Citation::authorityLevel).average().orElse(5.0);
        double authority = (5.0 - meanLevel) / 4.0;

        double coverage = 1.0;
        if (!query.legalIssues().isEmpty()) {
            long covered = query.legalIssues().stream()
                    .filter(issue -> citations.stream().anyMatch(c -> mentions(c, issue)))
                    .count();
            coverage = (double) covered / query.legalIssues().size();
        }
        double recency = (double) top.stream().filter(this::isRecent).count() / TOP_CITATIONS;
        double quantity = Math.min((double) citations.size() / QUANTITY_SATURATION, 1.0);

        double raw = 0.4 * authority + 0.3 * coverage + 0.2 * recency + 0.1 * quantity;
        return Math.max(0.0, Math.min(1.0, raw));
    }

    private static boolean mentions(Citation citation, String issue) {
        return CitationRanker.mentionsIssue((citation.title() + " " + citation.snippet()).toLowerCase(Locale.ROOT),
                issue);
    }

    private boolean isRecent(Citation citation) {
        return CitationRanker.ageYears(citation.decisionDate(), clock) <= recencyHorizonYears;
    }
}
