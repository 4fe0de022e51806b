package com.phillippitts.structurecoach.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Structured output of the quality collaborator for one answer.
 *
 * @param sectionQuality quality per submitted section
 * @param keyInsight     free-text insight on strengths and gaps
 * @param source         model or heuristic
 */
public record QualityJudgment(
        Map<String, SectionQuality> sectionQuality,
        String keyInsight,
        QualitySource source
) {

    public QualityJudgment {
        sectionQuality = Map.copyOf(sectionQuality);
        keyInsight = keyInsight == null ? "" : keyInsight;
        Objects.requireNonNull(source, "Source must not be null");
    }
}
