package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.QuestionAttempt;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic scorer built only from analyses already computed: each criterion level is
 * {@code round(composite / 20)}, except that fluency and pacing use the pause-pattern and
 * pacing scores when those dimensions succeeded.
 */
@Component
public class HeuristicInterviewScorer implements InterviewScorer {

    public static final String SOURCE = "heuristic";

    @Override
    public List<QuestionScores> score(List<QuestionAttempt> attempted) {
        List<QuestionScores> out = new ArrayList<>(attempted.size());
        for (QuestionAttempt attempt : attempted) {
            AggregateAnalysis analysis = attempt.analysis();
            if (analysis == null) {
                continue;
            }
            int level = level(analysis.compositeScore());

            Map<String, Integer> knowledge = new LinkedHashMap<>();
            QuestionScores.KNOWLEDGE_CRITERIA.forEach(c -> knowledge.put(c, level));

            Map<String, Integer> speech = new LinkedHashMap<>();
            speech.put("fluency", dimensionLevel(analysis, AnalysisKind.PAUSE_PATTERN, level));
            speech.put("structure", level);
            speech.put("pacing", dimensionLevel(analysis, AnalysisKind.PACING, level));
            speech.put("grammar", level);

            out.add(new QuestionScores(attempt.questionIndex(), knowledge, speech));
        }
        return out;
    }

    @Override
    public String source() {
        return SOURCE;
    }

    static int level(double compositeScore) {
        double clamped = Math.max(0.0, Math.min(100.0, compositeScore));
        return (int) Math.round(clamped / 20.0);
    }

    /** Uses a dimension's 0..5 {@code score} when it ran successfully, else the fallback. */
    private static int dimensionLevel(AggregateAnalysis analysis, AnalysisKind kind, int fallback) {
        return analysis.result(kind)
                .filter(AnalysisResult::isOk)
                .map(r -> r.payload().get("score"))
                .filter(Number.class::isInstance)
                .map(n -> (int) Math.round(((Number) n).doubleValue()))
                .orElse(fallback);
    }
}
