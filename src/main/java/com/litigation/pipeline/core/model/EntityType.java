package com.litigation.pipeline.core.model;

/**
 * Categories of nodes held in the case knowledge graph.
 */
public enum EntityType {
    PARTY("Party"),
    FACT("Fact"),
    EVENT("Event"),
    EVIDENCE("Evidence"),
    AUTHORITY("Authority"),
    CLAIM("Claim"),
    DOCUMENT("Document"),
    ORGANIZATION("Organization"),
    LOCATION("Location");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Entity types that carry case facts for claims analysis.
     */
    public boolean isFactual() {
        return this == FACT || this == EVENT || this == EVIDENCE;
    }
}
