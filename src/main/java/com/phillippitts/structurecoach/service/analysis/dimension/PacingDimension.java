package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import com.phillippitts.structurecoach.service.analysis.AnalysisContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Speaking pace from word counts and the recorded time of each section.
 *
 * <p>Score (0..5): up to 40 points for the average pace sitting in the recommended
 * 120-150 WPM band (minus 2 per WPM outside it) plus up to 60 points for the share of
 * speaking time inside the ideal 105-170 WPM window, divided by 20.
 */
@Component
public class PacingDimension implements AnalysisDimension {

    static final double TOO_SLOW_BELOW = 105.0;
    static final double TOO_FAST_ABOVE = 170.0;
    static final double RECOMMENDED_MIN = 120.0;
    static final double RECOMMENDED_MAX = 150.0;

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.PACING;
    }

    @Override
    public Map<String, Object> analyze(AnalysisContext context) {
        List<Map<String, Object>> perSection = new ArrayList<>();
        int totalWords = 0;
        int totalSeconds = 0;
        double idealSeconds = 0;
        double slowSeconds = 0;
        double fastSeconds = 0;

        for (SectionAnswer a : context.answers()) {
            int seconds = a.timeSpentSeconds();
            if (seconds <= 0) {
                continue;
            }
            int words = a.wordCount();
            double wpm = words * 60.0 / seconds;
            String category = categorize(wpm);
            switch (category) {
                case "too_slow" -> slowSeconds += seconds;
                case "too_fast" -> fastSeconds += seconds;
                default -> idealSeconds += seconds;
            }
            totalWords += words;
            totalSeconds += seconds;

            Map<String, Object> s = new LinkedHashMap<>();
            s.put("section", a.sectionName());
            s.put("wpm", round1(wpm));
            s.put("category", category);
            perSection.add(s);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        if (totalSeconds == 0) {
            payload.put("measurable", false);
            payload.put("feedback", "No recorded time for the submitted sections; pace cannot be measured.");
            return payload;
        }

        double avgWpm = totalWords * 60.0 / totalSeconds;
        double idealPct = idealSeconds * 100.0 / totalSeconds;
        payload.put("measurable", true);
        payload.put("avg_wpm", round1(avgWpm));
        payload.put("category", categorize(avgWpm));
        payload.put("too_slow_pct", round1(slowSeconds * 100.0 / totalSeconds));
        payload.put("ideal_pct", round1(idealPct));
        payload.put("too_fast_pct", round1(fastSeconds * 100.0 / totalSeconds));
        payload.put("per_section", perSection);
        payload.put("score", score(avgWpm, idealPct));
        payload.put("feedback", feedback(avgWpm));
        return payload;
    }

    static String categorize(double wpm) {
        if (wpm < TOO_SLOW_BELOW) {
            return "too_slow";
        }
        return wpm > TOO_FAST_ABOVE ? "too_fast" : "ideal";
    }

    static double score(double avgWpm, double idealPct) {
        double consistency = idealPct * 0.6;
        double accuracy;
        if (avgWpm >= RECOMMENDED_MIN && avgWpm <= RECOMMENDED_MAX) {
            accuracy = 40.0;
        } else {
            double deviation = avgWpm < RECOMMENDED_MIN ? RECOMMENDED_MIN - avgWpm : avgWpm - RECOMMENDED_MAX;
            accuracy = Math.max(0.0, 40.0 - 2.0 * deviation);
        }
        double total = Math.max(0.0, Math.min(100.0, consistency + accuracy));
        return round1(total / 20.0);
    }

    private static String feedback(double avgWpm) {
        String pace = "Average pace " + round1(avgWpm) + " WPM; aim for 120-150 WPM in interviews.";
        if (avgWpm < TOO_SLOW_BELOW) {
            return pace + " Try to speak a little faster and cut long hesitations.";
        }
        if (avgWpm > TOO_FAST_ABOVE) {
            return pace + " Slow down so key points land.";
        }
        return pace;
    }

    static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
