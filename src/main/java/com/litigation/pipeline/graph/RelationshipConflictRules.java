package com.litigation.pipeline.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pairs of relationship types that contradict each other when both hold between the
 * same two entities.
 */
public final class RelationshipConflictRules {

    private final Map<String, Set<String>> conflicts;

    private RelationshipConflictRules(Map<String, Set<String>> conflicts) {
        this.conflicts = conflicts;
    }

    /**
     * SUPPORTS contradicts CONTRADICTS, CAUSED contradicts PREVENTED.
     */
    public static RelationshipConflictRules defaults() {
        return builder()
                .conflict("SUPPORTS", "CONTRADICTS")
                .conflict("CAUSED", "PREVENTED")
                .build();
    }

    public static RelationshipConflictRules none() {
        return builder().build();
    }

    public boolean conflicts(String typeA, String typeB) {
        Set<String> opposed = conflicts.get(typeA.toUpperCase(Locale.ROOT));
        return opposed != null && opposed.contains(typeB.toUpperCase(Locale.ROOT));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Set<String>> conflicts = new HashMap<>();

        public Builder conflict(String typeA, String typeB) {
            String a = typeA.toUpperCase(Locale.ROOT);
            String b = typeB.toUpperCase(Locale.ROOT);
            conflicts.computeIfAbsent(a, k -> new HashSet<>()).add(b);
            conflicts.computeIfAbsent(b, k -> new HashSet<>()).add(a);
            return this;
        }

        public RelationshipConflictRules build() {
            Map<String, Set<String>> copy = new HashMap<>();
            conflicts.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
            return new RelationshipConflictRules(Map.copyOf(copy));
        }
    }
}
