package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * Whole-interview scores.
 *
 * @param knowledgeCompetence knowledge/content band, max 25
 * @param speechAndStructure  speech/structure band, max 20
 * @param source              "scorer" when the scoring collaborator produced the levels,
 *                            "heuristic" when derived from composite scores
 */
public record ScoreSummary(ScoreBand knowledgeCompetence, ScoreBand speechAndStructure, String source) {

    public ScoreSummary {
        Objects.requireNonNull(knowledgeCompetence, "Knowledge band must not be null");
        Objects.requireNonNull(speechAndStructure, "Speech band must not be null");
        Objects.requireNonNull(source, "Source must not be null");
    }
}
