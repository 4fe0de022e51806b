package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.service.analysis.AnalysisContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hesitation and rhythm signals read from the transcript text: filler words per hundred
 * words and average sentence length. Scored 1..5.
 */
@Component
public class PausePatternDimension implements AnalysisDimension {

    static final List<String> FILLERS = List.of(
            "um", "uh", "erm", "hmm", "like", "you know", "i mean", "basically",
            "actually", "kind of", "sort of", "literally");

    private static final Pattern FILLER_PATTERN = Pattern.compile(
            "\\b(" + String.join("|", FILLERS).replace(" ", "\\s+") + ")\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");

    /** Sentences longer than this read as run-ons when spoken. */
    static final double RUN_ON_WORDS = 35.0;

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.PAUSE_PATTERN;
    }

    @Override
    public Map<String, Object> analyze(AnalysisContext context) {
        int words = 0;
        int sentences = 0;
        Map<String, Integer> fillerCounts = new LinkedHashMap<>();

        for (String text : context.sectionTexts().values()) {
            String trimmed = text.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            words += trimmed.split("\\s+").length;
            for (String sentence : SENTENCE_SPLIT.split(trimmed)) {
                if (!sentence.isBlank()) {
                    sentences++;
                }
            }
            Matcher m = FILLER_PATTERN.matcher(trimmed);
            while (m.find()) {
                String filler = m.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
                fillerCounts.merge(filler, 1, Integer::sum);
            }
        }

        int fillerTotal = fillerCounts.values().stream().mapToInt(Integer::intValue).sum();
        double fillerRate = words == 0 ? 0.0 : fillerTotal * 100.0 / words;
        double avgSentence = sentences == 0 ? words : (double) words / sentences;
        int score = score(fillerRate, avgSentence);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("word_count", words);
        payload.put("filler_count", fillerTotal);
        payload.put("filler_rate_per_100_words", PacingDimension.round1(fillerRate));
        payload.put("fillers", fillerCounts);
        payload.put("sentence_count", sentences);
        payload.put("avg_sentence_words", PacingDimension.round1(avgSentence));
        payload.put("score", score);
        payload.put("feedback", feedback(fillerRate, avgSentence));
        return payload;
    }

    static int score(double fillerRatePer100, double avgSentenceWords) {
        int score;
        if (fillerRatePer100 < 1.0) {
            score = 5;
        } else if (fillerRatePer100 < 3.0) {
            score = 4;
        } else if (fillerRatePer100 < 5.0) {
            score = 3;
        } else if (fillerRatePer100 < 8.0) {
            score = 2;
        } else {
            score = 1;
        }
        if (avgSentenceWords > RUN_ON_WORDS) {
            score--;
        }
        return Math.max(1, score);
    }

    private static String feedback(double fillerRate, double avgSentence) {
        StringBuilder sb = new StringBuilder();
        if (fillerRate >= 3.0) {
            sb.append("Frequent filler words; replace them with a short silent pause.");
        } else {
            sb.append("Filler words are under control.");
        }
        if (avgSentence > RUN_ON_WORDS) {
            sb.append(" Break long sentences into shorter thoughts and pause between them.");
        }
        return sb.toString();
    }
}
