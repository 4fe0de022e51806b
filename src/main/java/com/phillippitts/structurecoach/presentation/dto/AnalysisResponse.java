package com.phillippitts.structurecoach.presentation.dto;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.service.analysis.StructureAnalysis;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated structure analysis for one question.
 *
 * <p>{@code partialFailure} is true when some dimensions succeeded and others failed or
 * timed out; the response is still a 200.
 */
public record AnalysisResponse(
        long practiceId,
        int questionIndex,
        String framework,
        double compositeScore,
        String progressMessage,
        String keyInsight,
        QualitySource qualitySource,
        List<SectionJudgment> sections,
        List<AnalysisKind> requestedKinds,
        List<AnalysisKind> succeededKinds,
        List<AnalysisKind> failedKinds,
        boolean partialFailure,
        List<AnalysisResult> dimensions,
        ProgressSnapshot progress,
        Instant computedAt
) {

    public static AnalysisResponse from(StructureAnalysis result) {
        AggregateAnalysis a = result.analysis();
        return new AnalysisResponse(result.practiceId(), result.questionIndex(), result.progress().framework(),
                a.compositeScore(), result.progressMessage(), a.keyInsight(), a.qualitySource(), a.sections(),
                a.requestedKinds(), a.succeededKinds(), a.failedKinds(), a.partialFailure(), a.perDimension(),
                result.progress(), a.computedAt());
    }
}
