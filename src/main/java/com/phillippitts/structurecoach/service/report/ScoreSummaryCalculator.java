package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.ScoreBand;
import com.phillippitts.structurecoach.domain.ScoreSummary;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * Turns per-question criterion levels into the two report bands.
 *
 * <p>A band's score is the average per-question total over attempted questions, scaled by
 * {@code attempted / total} so skipped questions cost points, then rounded. The rounded score
 * is split back over the criteria in proportion to their sums (largest remainder), so the
 * criteria always add up to the score.
 */
public final class ScoreSummaryCalculator {

    public static final int KNOWLEDGE_MAX = 25;
    public static final int SPEECH_MAX = 20;

    private ScoreSummaryCalculator() {}

    public static ScoreSummary summarize(List<QuestionScores> scores, int totalQuestions, String source) {
        return new ScoreSummary(
                band(scores, totalQuestions, QuestionScores.KNOWLEDGE_CRITERIA, QuestionScores::knowledge, KNOWLEDGE_MAX),
                band(scores, totalQuestions, QuestionScores.SPEECH_CRITERIA, QuestionScores::speech, SPEECH_MAX),
                source);
    }

    static ScoreBand band(List<QuestionScores> scores, int totalQuestions, List<String> criteria,
                          Function<QuestionScores, Map<String, Integer>> levels, int maxScore) {
        int attempted = scores.size();
        Map<String, Integer> sums = new LinkedHashMap<>();
        criteria.forEach(c -> sums.put(c, 0));
        for (QuestionScores qs : scores) {
            levels.apply(qs).forEach((c, v) -> sums.merge(c, v, Integer::sum));
        }
        int totalFromAttempted = sums.values().stream().mapToInt(Integer::intValue).sum();

        int score = 0;
        if (attempted > 0 && totalQuestions > 0) {
            double avgPerQuestion = totalFromAttempted / (double) attempted;
            double completionRatio = Math.min(1.0, attempted / (double) totalQuestions);
            score = Math.min(maxScore, (int) Math.round(avgPerQuestion * completionRatio));
        }

        Map<String, Integer> distributed = distribute(score, sums, totalFromAttempted);
        double average = Math.round(score / (double) criteria.size() * 100.0) / 100.0;
        int percentage = (int) (score * 100.0 / maxScore);
        return new ScoreBand(score, maxScore, average, QuestionScores.MAX_LEVEL, percentage, distributed);
    }

    static Map<String, Integer> distribute(int score, Map<String, Integer> sums, int total) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (total <= 0 || score <= 0) {
            sums.keySet().forEach(c -> out.put(c, 0));
            return out;
        }
        List<String> names = List.copyOf(sums.keySet());
        double[] exact = new double[names.size()];
        int assigned = 0;
        for (int i = 0; i < names.size(); i++) {
            exact[i] = score * (sums.get(names.get(i)) / (double) total);
            int floor = (int) Math.floor(exact[i]);
            out.put(names.get(i), floor);
            assigned += floor;
        }
        List<Integer> byRemainder = IntStream.range(0, names.size()).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> exact[i] - Math.floor(exact[i])).reversed())
                .toList();
        for (int k = 0; k < score - assigned; k++) {
            out.merge(names.get(byRemainder.get(k % names.size())), 1, Integer::sum);
        }
        return out;
    }
}
