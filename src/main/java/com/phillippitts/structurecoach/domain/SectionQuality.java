package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Quality judgment for one section, with its contribution to the quality sub-score.
 */
public enum SectionQuality {
    GOOD(100),
    PARTIAL(50),
    MISSING(0);

    private final int score;

    SectionQuality(int score) {
        this.score = score;
    }

    /** Quality points on a 0-100 scale. */
    public int score() {
        return score;
    }

    public SectionStatus toStatus() {
        return switch (this) {
            case GOOD -> SectionStatus.COMPLETE;
            case PARTIAL -> SectionStatus.PARTIAL;
            case MISSING -> SectionStatus.MISSING;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for collaborator output; unrecognised values map to {@link #PARTIAL}.
     */
    public static SectionQuality parse(String value) {
        if (value == null) {
            return PARTIAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "good", "complete", "completed", "strong" -> GOOD;
            case "missing", "absent", "none" -> MISSING;
            default -> PARTIAL;
        };
    }
}
