package com.litigation.pipeline.research;

import com.litigation.pipeline.jurisdiction.JurisdictionAuthorityResolver;
import com.litigation.pipeline.scoring.ConfidenceScorer;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores raw citations against a query and orders them.
 *
 * <p>Relevance = 0.5 × share of query terms found in the citation + 0.2 per legal issue
 * the citation mentions (at most 0.4) + 0.2 if the citation's jurisdiction applies to the
 * query + 0.1 × recency decay of the decision date, clamped to [0, 1]. Ranking is by
 * authority level ascending, then relevance descending, then source id.</p>
 */
public class CitationRanker {

    static final double TERM_WEIGHT = 0.5;
    static final double ISSUE_WEIGHT = 0.2;
    static final double ISSUE_CAP = 0.4;
    static final double JURISDICTION_WEIGHT = 0.2;
    static final double RECENCY_WEIGHT = 0.1;

    static final Comparator<Citation> RANK_ORDER = Comparator.comparingInt(Citation::authorityLevel)
            .thenComparing(Comparator.comparingDouble(Citation::relevanceScore).reversed())
            .thenComparing(Citation::sourceId);

    private final ConfidenceScorer scorer;
    private final JurisdictionAuthorityResolver resolver;
    private final Clock clock;

    public CitationRanker(ConfidenceScorer scorer, JurisdictionAuthorityResolver resolver, Clock clock) {
        this.scorer = scorer;
        this.resolver = resolver;
        this.clock = clock;
    }

    public List<Citation> rank(List<RawCitation> raw, String providerName, ResearchQuery query, int limit) {
        return raw.stream()
                .map(citation -> Citation.from(citation, providerName, relevance(citation, query)))
                .sorted(RANK_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public double relevance(RawCitation citation, ResearchQuery query) {
        String text = citationText(citation);
        Set<String> tokens = new HashSet<>(QueryFormulator.tokenize(text));

        double termShare = 0.0;
        if (!query.terms().isEmpty()) {
            long found = query.terms().stream().filter(tokens::contains).count();
            termShare = (double) found / query.terms().size();
        }
        long issuesMatched = query.legalIssues().stream().filter(issue -> mentionsIssue(text, issue)).count();
        double issueScore = Math.min(issuesMatched * ISSUE_WEIGHT, ISSUE_CAP);
        double jurisdiction = resolver.isCompatible(citation.jurisdictionId(), query.jurisdictionId())
                ? JURISDICTION_WEIGHT : 0.0;
        double recency = RECENCY_WEIGHT * scorer.recencyDecay(ageYears(citation.decisionDate(), clock));

        return ConfidenceScorer.clamp(TERM_WEIGHT * termShare + issueScore + jurisdiction + recency);
    }

    static String citationText(RawCitation citation) {
        return (citation.title() + " " + citation.snippet()).toLowerCase(Locale.ROOT);
    }

    /**
     * An issue is mentioned when every one of its tokens occurs in the text.
     */
    static boolean mentionsIssue(String lowerText, String issue) {
        List<String> issueTokens = QueryFormulator.tokenize(issue);
        if (issueTokens.isEmpty()) {
            return false;
        }
        Set<String> tokens = new HashSet<>(QueryFormulator.tokenize(lowerText));
        return tokens.containsAll(issueTokens);
    }

    /**
     * Age of a decision in years; unknown dates count as infinitely old.
     */
    static double ageYears(LocalDate decisionDate, Clock clock) {
        if (decisionDate == null) {
            return Double.MAX_VALUE;
        }
        long days = ChronoUnit.DAYS.between(decisionDate, LocalDate.now(clock));
        return Math.max(0.0, days / 365.25);
    }
}
