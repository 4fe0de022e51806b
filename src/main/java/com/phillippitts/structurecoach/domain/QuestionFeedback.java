package com.phillippitts.structurecoach.domain;

import java.util.List;

/**
 * Feedback for one attempted question of a report.
 */
public record QuestionFeedback(
        int questionIndex,
        String questionText,
        double compositeScore,
        List<String> strengths,
        List<String> areasOfImprovement
) {

    public QuestionFeedback {
        strengths = List.copyOf(strengths);
        areasOfImprovement = List.copyOf(areasOfImprovement);
    }
}
