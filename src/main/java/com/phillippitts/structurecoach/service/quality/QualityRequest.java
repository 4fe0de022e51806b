package com.phillippitts.structurecoach.service.quality;

import com.phillippitts.structurecoach.domain.Framework;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Input to a {@link QualityJudge}.
 *
 * @param questionText the question being answered
 * @param framework the question's framework
 * @param sectionTexts submitted section name to answer text, in framework order
 * @param sectionTimes submitted section name to recorded seconds
 * @param combinedText all submitted sections as {@code [Section]} blocks
 */
public record QualityRequest(
        String questionText,
        Framework framework,
        Map<String, String> sectionTexts,
        Map<String, Integer> sectionTimes,
        String combinedText
) {
    public QualityRequest {
        Objects.requireNonNull(framework, "framework");
        sectionTexts = Collections.unmodifiableMap(new LinkedHashMap<>(sectionTexts));
        sectionTimes = Collections.unmodifiableMap(new LinkedHashMap<>(sectionTimes));
        questionText = questionText == null ? "" : questionText;
        combinedText = combinedText == null ? "" : combinedText;
    }
}
