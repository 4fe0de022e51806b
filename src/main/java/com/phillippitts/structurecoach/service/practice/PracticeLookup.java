package com.phillippitts.structurecoach.service.practice;

import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.exception.QuestionIndexOutOfRangeException;
import com.phillippitts.structurecoach.exception.ResourceNotFoundException;
import com.phillippitts.structurecoach.repository.PracticeRepository;
import org.springframework.stereotype.Component;

/**
 * Resolves practice sessions and their questions, failing with the validation errors the
 * API surfaces.
 */
@Component
public class PracticeLookup {

    private final PracticeRepository practiceRepository;

    public PracticeLookup(PracticeRepository practiceRepository) {
        this.practiceRepository = practiceRepository;
    }

    public PracticeSession requirePractice(long practiceId) {
        return practiceRepository.findPractice(practiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Practice", practiceId));
    }

    public PracticeQuestion requireQuestion(long practiceId, int questionIndex) {
        return requireQuestion(requirePractice(practiceId), questionIndex);
    }

    public static PracticeQuestion requireQuestion(PracticeSession practice, int questionIndex) {
        if (questionIndex < 0 || questionIndex >= practice.questionCount()) {
            throw new QuestionIndexOutOfRangeException(questionIndex, practice.questionCount());
        }
        return practice.questions().get(questionIndex);
    }
}
