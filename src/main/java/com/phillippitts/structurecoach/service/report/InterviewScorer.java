package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.QuestionAttempt;

import java.util.List;

/**
 * Scores the attempted questions of an interview on the knowledge and speech criteria.
 */
public interface InterviewScorer {

    /**
     * @param attempted attempted questions only, in question order
     * @return one entry per attempted question
     * @throws com.phillippitts.structurecoach.exception.CollaboratorUnavailableException
     *         if the scorer cannot produce scores
     */
    List<QuestionScores> score(List<QuestionAttempt> attempted);

    /** Recorded as the report's score source. */
    String source();
}
