package com.litigation.pipeline.claims;

import com.litigation.pipeline.jurisdiction.AuthorityResolution;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A legal theory derived from the current fact set.
 *
 * <p>Derived causes are recomputed from the graph whenever facts change, never patched.
 * When the controlling authority cannot be resolved, {@code unresolvedConflict} is set
 * and the cause carries the tied candidates in its {@code authority}.</p>
 *
 * @param causeType  id of the template the cause was derived from
 * @param confidence satisfied elements divided by total elements
 */
public record CauseOfAction(String id, String causeType, String name, String jurisdictionId,
                            List<LegalElement> elements, double confidence,
                            AuthorityResolution authority, boolean unresolvedConflict) {

    public CauseOfAction {
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public int satisfiedCount() {
        return (int) elements.stream().filter(LegalElement::satisfied).count();
    }

    public int totalCount() {
        return elements.size();
    }

    /**
     * Ids of all facts attached to any element, in element order.
     */
    public Set<String> supportingFactIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (LegalElement element : elements) {
            element.attachments().forEach(a -> ids.add(a.factEntityId()));
        }
        return ids;
    }
}
