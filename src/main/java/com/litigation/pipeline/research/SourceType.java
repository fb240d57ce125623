package com.litigation.pipeline.research;

import java.util.Locale;

/**
 * Kind of authority a citation comes from. The authority level is fixed by the source
 * type: 1 is binding apex authority, 5 is persuasive secondary material.
 */
public enum SourceType {
    APEX_COURT(1),
    APPELLATE_COURT(2),
    TRIAL_COURT(3),
    ADMINISTRATIVE(4),
    SECONDARY(5);

    private final int authorityLevel;

    SourceType(int authorityLevel) {
        this.authorityLevel = authorityLevel;
    }

    public int getAuthorityLevel() {
        return authorityLevel;
    }

    /**
     * Classifies a court by name. Unknown courts are treated as trial courts.
     */
    public static SourceType fromCourtName(String court) {
        if (court == null || court.isBlank()) {
            return TRIAL_COURT;
        }
        String lower = court.toLowerCase(Locale.ROOT);
        if (lower.contains("supreme")) {
            return APEX_COURT;
        }
        if (lower.contains("appeal") || lower.contains("appellate") || lower.contains("circuit")) {
            return APPELLATE_COURT;
        }
        if (lower.contains("district") || lower.contains("superior") || lower.contains("trial")) {
            return TRIAL_COURT;
        }
        if (lower.contains("administrative") || lower.contains("agency")) {
            return ADMINISTRATIVE;
        }
        return TRIAL_COURT;
    }
}
