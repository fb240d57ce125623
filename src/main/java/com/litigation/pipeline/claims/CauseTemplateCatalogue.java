package com.litigation.pipeline.claims;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed catalogue of cause templates, validated when built.
 */
public final class CauseTemplateCatalogue {

    private final Map<String, CauseTemplate> templates;

    private CauseTemplateCatalogue(Map<String, CauseTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    public static CauseTemplateCatalogue of(List<CauseTemplate> templates) {
        if (templates == null || templates.isEmpty()) {
            throw new TemplateConfigurationException("Catalogue must contain at least one cause template");
        }
        Map<String, CauseTemplate> byId = new LinkedHashMap<>();
        for (CauseTemplate template : templates) {
            if (byId.putIfAbsent(template.id(), template) != null) {
                throw new TemplateConfigurationException("Duplicate cause template: " + template.id());
            }
        }
        return new CauseTemplateCatalogue(byId);
    }

    public static CauseTemplateCatalogue defaults() {
        return of(DefaultCauseTemplates.all());
    }

    public Collection<CauseTemplate> getTemplates() {
        return templates.values();
    }

    public Optional<CauseTemplate> find(String id) {
        return Optional.ofNullable(templates.get(id));
    }

    public int size() {
        return templates.size();
    }
}
