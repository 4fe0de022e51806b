package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import com.phillippitts.structurecoach.service.quality.QualityRequest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable input shared by every analysis dimension of one aggregate run.
 *
 * <p>{@code answers} holds the submitted section answers in framework order; answers for
 * sections outside the framework are dropped on construction.
 */
public record AnalysisContext(
        long practiceId,
        int questionIndex,
        String questionText,
        Framework framework,
        List<SectionAnswer> answers
) {
    public AnalysisContext {
        Objects.requireNonNull(framework, "framework");
        questionText = questionText == null ? "" : questionText;
        List<SectionAnswer> ordered = new ArrayList<>();
        for (String section : framework.sections()) {
            answers.stream()
                    .filter(a -> a.sectionName().equals(section))
                    .max(Comparator.comparing(SectionAnswer::submittedAt).thenComparingLong(SectionAnswer::id))
                    .ifPresent(ordered::add);
        }
        answers = List.copyOf(ordered);
    }

    public boolean isEmpty() {
        return answers.isEmpty();
    }

    /**
     * Submitted sections joined as {@code [Section]\ntext} blocks separated by blank lines.
     */
    public String combinedText() {
        StringBuilder sb = new StringBuilder();
        for (SectionAnswer a : answers) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append('[').append(a.sectionName()).append("]\n").append(a.answerText());
        }
        return sb.toString();
    }

    public Map<String, String> sectionTexts() {
        Map<String, String> out = new LinkedHashMap<>();
        answers.forEach(a -> out.put(a.sectionName(), a.answerText()));
        return out;
    }

    public Map<String, Integer> sectionTimes() {
        Map<String, Integer> out = new LinkedHashMap<>();
        answers.forEach(a -> out.put(a.sectionName(), a.timeSpentSeconds()));
        return out;
    }

    public QualityRequest toQualityRequest() {
        return new QualityRequest(questionText, framework, sectionTexts(), sectionTimes(), combinedText());
    }
}
