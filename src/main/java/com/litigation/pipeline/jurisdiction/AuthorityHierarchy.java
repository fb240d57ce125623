package com.litigation.pipeline.jurisdiction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, versioned table of jurisdiction authorities.
 *
 * <p>Preemption declarations between jurisdictions must form a directed acyclic graph.
 * A cycle (including an authority preempting itself) is rejected at construction with
 * an {@link AuthorityConfigurationException}. Legal areas named in a preemption scope
 * are leaves and never take part in a cycle.</p>
 */
public final class AuthorityHierarchy {

    private final long version;
    private final Map<String, JurisdictionAuthority> authorities;

    public AuthorityHierarchy(long version, Collection<JurisdictionAuthority> authorities) {
        if (version < 1) {
            throw new AuthorityConfigurationException("version must be >= 1, got " + version);
        }
        Map<String, JurisdictionAuthority> byId = new LinkedHashMap<>();
        for (JurisdictionAuthority authority : authorities) {
            String key = authority.jurisdictionId().toUpperCase(Locale.ROOT);
            if (byId.putIfAbsent(key, authority) != null) {
                throw new AuthorityConfigurationException("Duplicate jurisdiction: " + authority.jurisdictionId());
            }
        }
        this.version = version;
        this.authorities = Map.copyOf(byId);
        detectCycles(byId);
    }

    /**
     * Federal authority over the four largest state jurisdictions and the exclusively
     * federal legal areas.
     */
    public static AuthorityHierarchy defaults() {
        return new AuthorityHierarchy(1, List.of(
                JurisdictionAuthority.of("US", 1, "CA", "NY", "TX", "FL",
                        "bankruptcy", "patent", "copyright", "securities", "interstate_commerce"),
                JurisdictionAuthority.of("CA", 2),
                JurisdictionAuthority.of("NY", 2),
                JurisdictionAuthority.of("TX", 2),
                JurisdictionAuthority.of("FL", 2)
        ));
    }

    public long getVersion() {
        return version;
    }

    public Optional<JurisdictionAuthority> find(String jurisdictionId) {
        if (jurisdictionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(authorities.get(jurisdictionId.toUpperCase(Locale.ROOT)));
    }

    /**
     * Returns the authority for the given id, or an ad-hoc lowest-precedence authority
     * with no preemption scope when the id is not in the table.
     */
    public JurisdictionAuthority lookup(String jurisdictionId) {
        return find(jurisdictionId)
                .orElseGet(() -> new JurisdictionAuthority(jurisdictionId, Integer.MAX_VALUE, Set.of()));
    }

    public Collection<JurisdictionAuthority> getAuthorities() {
        return authorities.values();
    }

    public int size() {
        return authorities.size();
    }

    /**
     * Returns a copy of this hierarchy with the given authority added or replaced and
     * the version incremented.
     */
    public AuthorityHierarchy withAuthority(JurisdictionAuthority authority) {
        Map<String, JurisdictionAuthority> copy = new LinkedHashMap<>(authorities);
        copy.put(authority.jurisdictionId().toUpperCase(Locale.ROOT), authority);
        return new AuthorityHierarchy(version + 1, copy.values());
    }

    private static void detectCycles(Map<String, JurisdictionAuthority> byId) {
        Map<String, List<String>> edges = new HashMap<>();
        for (Map.Entry<String, JurisdictionAuthority> entry : byId.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (String scoped : entry.getValue().preemptionScope()) {
                String target = scoped.toUpperCase(Locale.ROOT);
                if (byId.containsKey(target)) {
                    targets.add(target);
                }
            }
            edges.put(entry.getKey(), targets);
        }

        Set<String> done = new HashSet<>();
        for (String start : edges.keySet()) {
            if (done.contains(start)) {
                continue;
            }
            // iterative DFS; a node on the current path seen again closes a cycle
            Set<String> onPath = new HashSet<>();
            Deque<PathFrame> stack = new ArrayDeque<>();
            stack.push(new PathFrame(start, edges.get(start)));
            onPath.add(start);
            while (!stack.isEmpty()) {
                PathFrame top = stack.peek();
                if (top.index < top.targets.size()) {
                    String next = top.targets.get(top.index++);
                    if (onPath.contains(next)) {
                        throw new AuthorityConfigurationException(
                                "Cyclic preemption declared between " + top.node + " and " + next);
                    }
                    if (!done.contains(next)) {
                        onPath.add(next);
                        stack.push(new PathFrame(next, edges.get(next)));
                    }
                } else {
                    stack.pop();
                    onPath.remove(top.node);
                    done.add(top.node);
                }
            }
        }
    }

    private static final class PathFrame {
        private final String node;
        private final List<String> targets;
        private int index;

        PathFrame(String node, List<String> targets) {
            this.node = node;
            this.targets = targets;
        }
    }
}
