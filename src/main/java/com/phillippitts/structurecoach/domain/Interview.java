package com.phillippitts.structurecoach.domain;

import java.util.List;
import java.util.Objects;

/**
 * An interview: the question set a report is synthesized over.
 */
public record Interview(long id, String track, List<QuestionSpec> questions) {

    public Interview {
        Objects.requireNonNull(track, "Track must not be null");
        questions = List.copyOf(questions);
    }
}
