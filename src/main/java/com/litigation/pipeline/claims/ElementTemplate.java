package com.litigation.pipeline.claims;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A required element of a legal theory with the questions that prove it.
 */
public record ElementTemplate(String id, String definition, List<QuestionTemplate> questions) {

    public ElementTemplate {
        if (id == null || id.isBlank()) {
            throw new TemplateConfigurationException("Element id is required");
        }
        if (questions == null || questions.isEmpty()) {
            throw new TemplateConfigurationException("Element '" + id + "' has no questions");
        }
        questions = List.copyOf(questions);
        Set<String> seen = new HashSet<>();
        for (QuestionTemplate question : questions) {
            if (!seen.add(question.id())) {
                throw new TemplateConfigurationException(
                        "Element '" + id + "' declares question '" + question.id() + "' twice");
            }
        }
    }

    public static ElementTemplate of(String id, String definition, QuestionTemplate... questions) {
        return new ElementTemplate(id, definition, List.of(questions));
    }
}
