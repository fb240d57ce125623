package com.litigation.pipeline.claims;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * A provable question under a legal element. A fact answers the question when any of
 * its keyword patterns occurs in the fact's searchable text.
 *
 * @param weight contribution of this question to an attachment's strength
 */
public record QuestionTemplate(String id, String text, List<String> keywordPatterns, double weight) {

    public QuestionTemplate {
        if (id == null || id.isBlank()) {
            throw new TemplateConfigurationException("Question id is required");
        }
        if (keywordPatterns == null || keywordPatterns.isEmpty()) {
            throw new TemplateConfigurationException("Question '" + id + "' has no keyword patterns");
        }
        if (Double.isNaN(weight) || weight <= 0.0 || weight > 1.0) {
            throw new TemplateConfigurationException("Question '" + id + "' weight must be in (0, 1], got " + weight);
        }
        keywordPatterns = List.copyOf(keywordPatterns);
        for (String pattern : keywordPatterns) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new TemplateConfigurationException("Question '" + id + "' has an invalid pattern: " + pattern, e);
            }
        }
    }

    public static QuestionTemplate of(String id, String text, double weight, String... patterns) {
        return new QuestionTemplate(id, text, List.of(patterns), weight);
    }

    List<Pattern> compiledPatterns() {
        return keywordPatterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .collect(Collectors.toList());
    }
}
