package com.phillippitts.structurecoach.domain;

import java.util.List;

/**
 * Interview-level feedback.
 */
public record OverallFeedback(
        List<String> strengths,
        List<String> areasOfImprovement,
        List<String> actionableSteps
) {

    public OverallFeedback {
        strengths = List.copyOf(strengths);
        areasOfImprovement = List.copyOf(areasOfImprovement);
        actionableSteps = List.copyOf(actionableSteps);
    }
}
