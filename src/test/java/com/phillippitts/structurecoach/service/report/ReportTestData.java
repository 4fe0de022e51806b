package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.domain.SectionQuality;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ReportTestData {

    static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private ReportTestData() {}

    /**
     * STAR analysis with the first {@code submitted} sections good and the rest missing.
     */
    static AggregateAnalysis starAnalysis(int submitted, double composite, AnalysisResult... dimensions) {
        List<String> sections = List.of("Situation", "Task", "Action", "Result");
        List<SectionJudgment> judgments = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            judgments.add(i < submitted
                    ? SectionJudgment.of(sections.get(i), SectionQuality.GOOD, 30)
                    : SectionJudgment.missing(sections.get(i)));
        }
        List<AnalysisResult> results = List.of(dimensions);
        List<AnalysisKind> kinds = results.stream().map(AnalysisResult::kind).toList();
        List<AnalysisKind> ok = results.stream().filter(AnalysisResult::isOk).map(AnalysisResult::kind).toList();
        List<AnalysisKind> failed = results.stream().filter(r -> !r.isOk()).map(AnalysisResult::kind).toList();
        return new AggregateAnalysis(results, kinds, ok, failed, judgments, QualitySource.HEURISTIC,
                "", composite, T0);
    }

    static AnalysisResult pacing(double score, String category) {
        return AnalysisResult.ok(AnalysisKind.PACING, Map.of("score", score, "category", category), 5);
    }

    static AnalysisResult pausePattern(int score) {
        return AnalysisResult.ok(AnalysisKind.PAUSE_PATTERN, Map.of("score", score), 5);
    }
}
