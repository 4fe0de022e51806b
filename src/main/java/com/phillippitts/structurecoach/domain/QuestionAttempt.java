package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * A question of an interview paired with its latest aggregate analysis, if any.
 *
 * @param questionIndex zero-based position within the interview
 * @param questionText  question text
 * @param framework     framework name used when practicing, or null when never practiced
 * @param analysis      latest aggregate analysis, or null when unattempted
 */
public record QuestionAttempt(
        int questionIndex,
        String questionText,
        String framework,
        AggregateAnalysis analysis
) {

    public QuestionAttempt {
        Objects.requireNonNull(questionText, "Question text must not be null");
    }

    public boolean attempted() {
        return analysis != null;
    }
}
