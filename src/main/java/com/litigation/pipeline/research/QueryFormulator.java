package com.litigation.pipeline.research;

import com.litigation.pipeline.core.model.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds research queries from graph entities. Pure: the same entities, issues and
 * jurisdiction always produce the same query, and nothing leaves the process.
 */
public class QueryFormulator {

    static final int DEFAULT_MAX_TERMS = 12;

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "from", "that", "this", "was", "were", "are", "has", "have",
            "had", "not", "but", "its", "into", "our", "their", "his", "her", "any", "all", "per", "via");

    private final int maxTerms;
    private final boolean recencyMatters;

    public QueryFormulator() {
        this(DEFAULT_MAX_TERMS, true);
    }

    public QueryFormulator(int maxTerms, boolean recencyMatters) {
        if (maxTerms <= 0) {
            throw new IllegalArgumentException("maxTerms must be > 0");
        }
        this.maxTerms = maxTerms;
        this.recencyMatters = recencyMatters;
    }

    /**
     * Issue terms come first, then entity terms by frequency (ties alphabetical), up to
     * the term limit. Entity ids become the query's anchors.
     */
    public ResearchQuery formulateQuery(Collection<Entity> entities, List<String> legalIssues, String jurisdictionId) {
        Objects.requireNonNull(jurisdictionId, "jurisdictionId is required");
        List<String> issues = legalIssues != null ? legalIssues : List.of();
        List<Entity> ordered = entities == null ? List.of() : entities.stream()
                .sorted(Comparator.comparing(Entity::getId))
                .collect(Collectors.toList());

        LinkedHashSet<String> terms = new LinkedHashSet<>();
        for (String issue : issues) {
            terms.addAll(tokenize(issue));
        }

        Map<String, Integer> frequency = new HashMap<>();
        for (Entity entity : ordered) {
            for (String token : tokenize(entity.searchableText())) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        frequency.entrySet().stream()
                .filter(e -> !terms.contains(e.getKey()))
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .forEach(terms::add);

        List<String> selected = terms.stream().limit(maxTerms).collect(Collectors.toList());
        List<String> anchors = ordered.stream().map(Entity::getId).collect(Collectors.toList());
        return new ResearchQuery(String.join(" ", selected), issues, jurisdictionId, selected,
                recencyMatters, anchors);
    }

    /**
     * Lowercase alphabetic tokens of three or more characters, stopwords removed,
     * in order of first appearance.
     */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        LinkedHashSet<String> tokens = new LinkedHashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 3 && !STOPWORDS.contains(token) && !token.chars().allMatch(Character::isDigit)) {
                tokens.add(token);
            }
        }
        return new ArrayList<>(tokens);
    }
}
