package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * A question within a practice session. Immutable after creation; the framework is
 * assigned once and never changes.
 *
 * @param practiceId    owning practice session
 * @param questionIndex stable zero-based position within the session
 * @param text          question text
 * @param structureHint structural description the framework was detected from
 * @param framework     assigned framework
 */
public record PracticeQuestion(
        long practiceId,
        int questionIndex,
        String text,
        String structureHint,
        Framework framework
) {

    public PracticeQuestion {
        if (questionIndex < 0) {
            throw new IllegalArgumentException("Question index must be >= 0, got: " + questionIndex);
        }
        Objects.requireNonNull(text, "Question text must not be null");
        Objects.requireNonNull(framework, "Framework must not be null");
    }
}
