package com.litigation.pipeline.claims;

import java.util.List;

/**
 * A derived element of a cause of action.
 *
 * @param satisfied whether at least one attachment reaches the satisfaction threshold
 */
public record LegalElement(String id, String name, String definition, List<ElementQuestion> questions,
                           List<FactElementAttachment> attachments, boolean satisfied) {

    public LegalElement {
        questions = questions != null ? List.copyOf(questions) : List.of();
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
    }

    /**
     * Strength of the best supporting fact, 0.0 when unsupported.
     */
    public double maxStrength() {
        return attachments.stream().mapToDouble(FactElementAttachment::strength).max().orElse(0.0);
    }
}
