package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.OverallFeedback;
import com.phillippitts.structurecoach.domain.QuestionAttempt;
import com.phillippitts.structurecoach.domain.QuestionFeedback;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.domain.SectionStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds report feedback text from stored analyses.
 */
final class FeedbackBuilder {

    private FeedbackBuilder() {}

    /**
     * @return feedback for an attempted question, or {@code null} for an unattempted one
     */
    static QuestionFeedback forQuestion(QuestionAttempt attempt) {
        if (!attempt.attempted()) {
            return null;
        }
        AggregateAnalysis a = attempt.analysis();
        List<String> strengths = new ArrayList<>();
        List<String> improvements = new ArrayList<>();

        List<String> complete = sectionsWith(a, SectionStatus.COMPLETE);
        List<String> partial = sectionsWith(a, SectionStatus.PARTIAL);
        List<String> missing = sectionsWith(a, SectionStatus.MISSING);

        if (missing.isEmpty()) {
            strengths.add("Covered every section of the " + attempt.framework() + " framework");
        }
        if (!complete.isEmpty()) {
            strengths.add("Well-developed " + String.join(", ", complete));
        }
        if (!partial.isEmpty()) {
            improvements.add("Develop " + String.join(", ", partial) + " with more specific detail");
        }
        if (!missing.isEmpty()) {
            improvements.add("Add the missing " + String.join(", ", missing) + " section" + (missing.size() > 1 ? "s" : ""));
        }
        dimensionFeedback(a, AnalysisKind.PACING).ifPresent(improvements::add);
        if (!a.keyInsight().isBlank()) {
            improvements.add(a.keyInsight());
        }
        return new QuestionFeedback(attempt.questionIndex(), attempt.questionText(), a.compositeScore(),
                strengths, improvements);
    }

    static OverallFeedback overall(List<QuestionAttempt> attempts) {
        Set<String> strengths = new LinkedHashSet<>();
        Set<String> improvements = new LinkedHashSet<>();
        Map<String, Integer> missingCounts = new LinkedHashMap<>();
        int attempted = 0;
        double compositeSum = 0;

        for (QuestionAttempt attempt : attempts) {
            if (!attempt.attempted()) {
                continue;
            }
            attempted++;
            compositeSum += attempt.analysis().compositeScore();
            sectionsWith(attempt.analysis(), SectionStatus.MISSING)
                    .forEach(s -> missingCounts.merge(s, 1, Integer::sum));
            if (sectionsWith(attempt.analysis(), SectionStatus.MISSING).isEmpty()) {
                strengths.add("Complete " + attempt.framework() + " structure on question " + (attempt.questionIndex() + 1));
            }
        }

        double avg = attempted == 0 ? 0 : compositeSum / attempted;
        if (avg >= 80) {
            strengths.add("Consistently well-structured answers");
        } else if (avg < 40) {
            improvements.add("Answers are often incomplete; cover each section before moving on");
        }
        missingCounts.forEach((section, count) ->
                improvements.add(section + " was missing in " + count + " answer" + (count > 1 ? "s" : "")));

        List<String> steps = new ArrayList<>();
        missingCounts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .ifPresent(e -> steps.add("Practice opening and closing the " + e.getKey()
                        + " section explicitly before moving to the next one"));
        int skipped = attempts.size() - attempted;
        if (skipped > 0) {
            steps.add("Attempt the remaining " + skipped + " question" + (skipped > 1 ? "s" : "")
                    + "; skipped questions lower both scores");
        }
        if (steps.isEmpty()) {
            steps.add("Re-record your weakest section with a concrete, measurable example");
        }
        return new OverallFeedback(List.copyOf(strengths), List.copyOf(improvements), steps);
    }

    private static List<String> sectionsWith(AggregateAnalysis a, SectionStatus status) {
        return a.sections().stream()
                .filter(s -> s.status() == status)
                .map(SectionJudgment::sectionName)
                .toList();
    }

    private static Optional<String> dimensionFeedback(AggregateAnalysis a, AnalysisKind kind) {
        return a.result(kind)
                .filter(AnalysisResult::isOk)
                .map(r -> r.payload().get("category"))
                .filter(c -> !"ideal".equals(c))
                .map(c -> "Pace was " + c.toString().replace('_', ' ') + "; aim for 120-150 words per minute");
    }
}
