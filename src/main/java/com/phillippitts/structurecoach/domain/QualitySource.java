package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where per-section quality judgments came from.
 */
public enum QualitySource {
    /** The generative quality collaborator. */
    MODEL,
    /** The deterministic word-count heuristic. */
    HEURISTIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QualitySource fromWireName(String value) {
        return QualitySource.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
