package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Settled state of one analysis dimension.
 */
public enum AnalysisStatus {
    OK,
    FAILED,
    TIMEOUT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AnalysisStatus fromWireName(String value) {
        return AnalysisStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
