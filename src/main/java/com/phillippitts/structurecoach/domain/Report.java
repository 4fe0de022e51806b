package com.phillippitts.structurecoach.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Whole-interview scored report. One per interview; regenerating replaces it.
 *
 * <p>{@code perQuestionFeedback} has one entry per interview question, in order; entries
 * for unattempted questions are null.
 */
public record Report(
        String reportId,
        long interviewId,
        ScoreSummary scoreSummary,
        OverallFeedback overallFeedback,
        List<QuestionFeedback> perQuestionFeedback,
        Instant createdAt
) {

    public Report {
        Objects.requireNonNull(reportId, "Report id must not be null");
        Objects.requireNonNull(scoreSummary, "Score summary must not be null");
        Objects.requireNonNull(overallFeedback, "Overall feedback must not be null");
        // List.copyOf rejects null elements, which are meaningful here
        perQuestionFeedback = Collections.unmodifiableList(new ArrayList<>(perQuestionFeedback));
        Objects.requireNonNull(createdAt, "Created-at must not be null");
    }
}
