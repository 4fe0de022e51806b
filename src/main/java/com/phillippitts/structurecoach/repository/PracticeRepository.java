package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.Interview;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.PracticeStatus;
import com.phillippitts.structurecoach.domain.QuestionSpec;

import java.util.List;
import java.util.Optional;

/**
 * Storage for interviews and practice sessions with their questions.
 */
public interface PracticeRepository {

    Interview createInterview(String track, List<QuestionSpec> questions);

    Optional<Interview> findInterview(long interviewId);

    PracticeSession createPractice(long interviewId, String track, List<PracticeQuestionDraft> questions);

    Optional<PracticeSession> findPractice(long practiceId);

    /**
     * Practice sessions of an interview, oldest first.
     */
    List<PracticeSession> findPracticesByInterview(long interviewId);

    void updateStatus(long practiceId, PracticeStatus status);
}
