package com.phillippitts.structurecoach.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived, never-cached view of a question's section progress.
 *
 * <p>Invariant: {@code complete} is true exactly when {@code sectionsSubmitted} covers every
 * framework section; {@code nextSection} is then null.
 *
 * @param framework             framework name
 * @param sectionsSubmitted     submitted sections, in framework order
 * @param sectionsCompleteCount number of submitted sections
 * @param totalSections         number of framework sections
 * @param nextSection           first framework section not yet submitted, or null
 * @param nextHint              progress-aware hint for {@code nextSection}, or null
 * @param complete              whether every section has been submitted
 * @param sectionTimes          latest recorded seconds per submitted section
 * @param message               short progress or completion message
 */
public record ProgressSnapshot(
        String framework,
        List<String> sectionsSubmitted,
        int sectionsCompleteCount,
        int totalSections,
        String nextSection,
        String nextHint,
        @JsonProperty("is_complete") boolean complete,
        Map<String, Integer> sectionTimes,
        String message
) {

    public ProgressSnapshot {
        sectionsSubmitted = List.copyOf(sectionsSubmitted);
        sectionTimes = Collections.unmodifiableMap(new LinkedHashMap<>(sectionTimes));
    }
}
