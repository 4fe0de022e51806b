package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * A question as supplied by the (external) question-selection step.
 *
 * @param text          question text shown to the candidate
 * @param structureHint free-text description of how the answer should be structured;
 *                      used to detect the framework. May be blank.
 */
public record QuestionSpec(String text, String structureHint) {

    public QuestionSpec {
        Objects.requireNonNull(text, "Question text must not be null");
        structureHint = structureHint == null ? "" : structureHint;
    }
}
