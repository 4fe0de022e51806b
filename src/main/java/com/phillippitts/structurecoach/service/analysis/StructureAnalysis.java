package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;

import java.util.Objects;

/**
 * Outcome of analyzing one practice question.
 *
 * @param practiceId analyzed practice
 * @param questionIndex analyzed question
 * @param analysis the persisted aggregate
 * @param progress section progress at analysis time
 * @param progressMessage headline derived from the composite score
 */
public record StructureAnalysis(
        long practiceId,
        int questionIndex,
        AggregateAnalysis analysis,
        ProgressSnapshot progress,
        String progressMessage
) {
    public StructureAnalysis {
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(progress, "progress");
    }
}
