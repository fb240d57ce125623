package com.litigation.pipeline.claims;

import java.util.List;

/**
 * A provable question of a derived element, with the facts that answer it.
 */
public record ElementQuestion(String id, String text, double weight, List<String> answeringFactIds) {

    public ElementQuestion {
        answeringFactIds = answeringFactIds != null ? List.copyOf(answeringFactIds) : List.of();
    }

    public boolean isAnswered() {
        return !answeringFactIds.isEmpty();
    }
}
