package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.SectionAnswer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds analysis contexts for dimension and aggregator tests.
 */
public final class AnalysisTestData {

    public static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private AnalysisTestData() {}

    /** Triples of section name, answer text and seconds. */
    public static AnalysisContext context(Framework framework, String... sectionTextAndSeconds) {
        List<SectionAnswer> answers = new ArrayList<>();
        for (int i = 0; i + 2 < sectionTextAndSeconds.length; i += 3) {
            answers.add(new SectionAnswer(i + 1L, 1L, 0, sectionTextAndSeconds[i], sectionTextAndSeconds[i + 1],
                    Integer.parseInt(sectionTextAndSeconds[i + 2]), T0.plusSeconds(i)));
        }
        return new AnalysisContext(1L, 0, "Tell me about a time you resolved a conflict", framework, answers);
    }

    public static String words(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append("word").append(i);
        }
        return sb.append('.').toString();
    }
}
