package com.litigation.pipeline.claims;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A legal theory broken down into required elements.
 *
 * @param legalArea     area of law used when resolving the controlling authority
 * @param jurisdictions jurisdictions the theory is recognized in; empty means everywhere
 */
public record CauseTemplate(String id, String name, String legalArea, Set<String> jurisdictions,
                            List<ElementTemplate> elements) {

    public CauseTemplate {
        if (id == null || id.isBlank()) {
            throw new TemplateConfigurationException("Cause template id is required");
        }
        if (elements == null || elements.isEmpty()) {
            throw new TemplateConfigurationException("Cause template '" + id + "' has no elements");
        }
        elements = List.copyOf(elements);
        jurisdictions = jurisdictions == null ? Set.of()
                : jurisdictions.stream().map(j -> j.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        Set<String> seen = new HashSet<>();
        for (ElementTemplate element : elements) {
            if (!seen.add(element.id())) {
                throw new TemplateConfigurationException(
                        "Cause template '" + id + "' declares element '" + element.id() + "' twice");
            }
        }
    }

    public boolean appliesTo(String jurisdictionId) {
        return jurisdictions.isEmpty()
                || (jurisdictionId != null && jurisdictions.contains(jurisdictionId.toUpperCase(Locale.ROOT)));
    }
}
