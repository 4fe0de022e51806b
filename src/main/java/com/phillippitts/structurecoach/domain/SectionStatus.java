package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Display status of a framework section. Sections never submitted are always {@link #MISSING}.
 */
public enum SectionStatus {
    COMPLETE,
    PARTIAL,
    MISSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SectionStatus fromWireName(String value) {
        return SectionStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
