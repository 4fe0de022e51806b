package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * Per-section outcome of an analysis run.
 *
 * @param sectionName      framework section
 * @param submitted        whether an answer exists for the section
 * @param quality          quality judgment (always {@code MISSING} when not submitted)
 * @param status           display status derived from {@code quality}
 * @param timeSpentSeconds recorded seconds, 0 when not submitted
 */
public record SectionJudgment(
        String sectionName,
        boolean submitted,
        SectionQuality quality,
        SectionStatus status,
        int timeSpentSeconds
) {

    public SectionJudgment {
        Objects.requireNonNull(sectionName, "Section name must not be null");
        Objects.requireNonNull(quality, "Quality must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        if (!submitted && quality != SectionQuality.MISSING) {
            throw new IllegalArgumentException("Unsubmitted section '" + sectionName + "' must be missing");
        }
    }

    public static SectionJudgment missing(String sectionName) {
        return new SectionJudgment(sectionName, false, SectionQuality.MISSING, SectionStatus.MISSING, 0);
    }

    public static SectionJudgment of(String sectionName, SectionQuality quality, int timeSpentSeconds) {
        SectionQuality q = quality == SectionQuality.MISSING ? SectionQuality.PARTIAL : quality;
        return new SectionJudgment(sectionName, true, q, q.toStatus(), timeSpentSeconds);
    }
}
