package com.litigation.pipeline.jurisdiction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published {@link AuthorityHierarchy}.
 *
 * <p>Published versions must increase. Callers that need a stable view for the length
 * of a run (a workflow session, for example) read {@link #current()} once and keep the
 * returned instance; later publications do not affect it.</p>
 */
public class AuthorityHierarchyRegistry {
    private static final Logger log = LoggerFactory.getLogger(AuthorityHierarchyRegistry.class);

    private final AtomicReference<AuthorityHierarchy> current;

    public AuthorityHierarchyRegistry() {
        this(AuthorityHierarchy.defaults());
    }

    public AuthorityHierarchyRegistry(AuthorityHierarchy initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial hierarchy is required"));
    }

    public AuthorityHierarchy current() {
        return current.get();
    }

    /**
     * Publishes a new hierarchy version.
     *
     * @throws AuthorityConfigurationException if the version does not exceed the current one
     */
    public void publish(AuthorityHierarchy hierarchy) {
        Objects.requireNonNull(hierarchy, "hierarchy is required");
        AuthorityHierarchy previous = current.getAndUpdate(existing ->
                hierarchy.getVersion() > existing.getVersion() ? hierarchy : existing);
        if (previous.getVersion() >= hierarchy.getVersion()) {
            throw new AuthorityConfigurationException("Hierarchy version " + hierarchy.getVersion()
                    + " is not newer than current version " + previous.getVersion());
        }
        log.info("authority.hierarchy.published version={} authorities={}",
                hierarchy.getVersion(), hierarchy.size());
    }
}
