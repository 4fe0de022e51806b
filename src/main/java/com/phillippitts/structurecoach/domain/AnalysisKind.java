package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Independent analysis dimensions that can be requested for an answer.
 */
public enum AnalysisKind {
    CONTENT_QUALITY("content_quality"),
    STRUCTURAL_COMPLETENESS("structural_completeness"),
    PACING("pacing"),
    PAUSE_PATTERN("pause_pattern");

    private final String wireName;

    AnalysisKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(AnalysisKind::wireName).toList();
    }

    /**
     * Resolves a wire name (case-insensitive; hyphens accepted in place of underscores).
     *
     * @throws InvalidAnalysisRequestException if the name is not a supported kind
     */
    public static AnalysisKind fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (AnalysisKind k : values()) {
                if (k.wireName.equals(normalized)) {
                    return k;
                }
            }
        }
        throw new InvalidAnalysisRequestException("analysis_types",
                "unsupported analysis type '" + value + "'", wireNames());
    }
}
