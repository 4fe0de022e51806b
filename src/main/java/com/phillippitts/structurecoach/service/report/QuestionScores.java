package com.phillippitts.structurecoach.service.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Criterion levels (0..5) for one attempted question.
 *
 * @param questionIndex question the levels belong to
 * @param knowledge levels for {@link #KNOWLEDGE_CRITERIA}
 * @param speech levels for {@link #SPEECH_CRITERIA}
 */
public record QuestionScores(int questionIndex, Map<String, Integer> knowledge, Map<String, Integer> speech) {

    public static final List<String> KNOWLEDGE_CRITERIA =
            List.of("accuracy", "depth", "relevance", "examples", "terminology");
    public static final List<String> SPEECH_CRITERIA =
            List.of("fluency", "structure", "pacing", "grammar");

    public static final int MAX_LEVEL = 5;

    public QuestionScores {
        knowledge = normalize(knowledge, KNOWLEDGE_CRITERIA);
        speech = normalize(speech, SPEECH_CRITERIA);
    }

    /** Keeps only known criteria, in canonical order, clamped to 0..5; absent ones are 0. */
    private static Map<String, Integer> normalize(Map<String, Integer> levels, List<String> criteria) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String c : criteria) {
            Integer v = levels == null ? null : levels.get(c);
            out.put(c, v == null ? 0 : Math.max(0, Math.min(MAX_LEVEL, v)));
        }
        return Collections.unmodifiableMap(out);
    }
}
