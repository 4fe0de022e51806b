package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a practice session.
 */
public enum PracticeStatus {
    ACTIVE,
    COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PracticeStatus fromWireName(String value) {
        return PracticeStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
