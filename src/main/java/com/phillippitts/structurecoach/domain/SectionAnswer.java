package com.phillippitts.structurecoach.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * The stored answer for one section of one question. Unique per
 * {@code (practiceId, questionIndex, sectionName)}; a resubmission replaces the record.
 *
 * @param id               storage identifier (stable across resubmissions)
 * @param practiceId       practice session
 * @param questionIndex    zero-based question index
 * @param sectionName      framework section
 * @param answerText       transcribed or typed answer
 * @param timeSpentSeconds recorded time for this section
 * @param submittedAt      time of the latest submission
 */
public record SectionAnswer(
        long id,
        long practiceId,
        int questionIndex,
        String sectionName,
        String answerText,
        int timeSpentSeconds,
        Instant submittedAt
) {

    public SectionAnswer {
        Objects.requireNonNull(sectionName, "Section name must not be null");
        Objects.requireNonNull(answerText, "Answer text must not be null");
        if (timeSpentSeconds < 0) {
            throw new IllegalArgumentException("Time spent must be >= 0, got: " + timeSpentSeconds);
        }
        Objects.requireNonNull(submittedAt, "Submitted-at must not be null");
    }

    public int wordCount() {
        String trimmed = answerText.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
