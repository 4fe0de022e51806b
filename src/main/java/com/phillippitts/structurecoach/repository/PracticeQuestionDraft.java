package com.phillippitts.structurecoach.repository;

import java.util.Objects;

/**
 * A question about to be stored in a new practice session, with its detected framework.
 */
public record PracticeQuestionDraft(String text, String structureHint, String frameworkName) {

    public PracticeQuestionDraft {
        Objects.requireNonNull(text, "text");
        structureHint = structureHint == null ? "" : structureHint;
        Objects.requireNonNull(frameworkName, "frameworkName");
    }
}
