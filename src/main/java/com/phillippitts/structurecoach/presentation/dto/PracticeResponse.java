package com.phillippitts.structurecoach.presentation.dto;

import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.PracticeStatus;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A practice session with each question's framework and current progress.
 */
public record PracticeResponse(
        long practiceId,
        long interviewId,
        String track,
        PracticeStatus status,
        Instant createdAt,
        List<QuestionView> questions
) {

    public record QuestionView(
            int questionIndex,
            String text,
            String structureHint,
            String framework,
            List<String> sections,
            ProgressSnapshot progress
    ) {
    }

    /**
     * @param progress one snapshot per question, in question order; empty for a fresh practice
     */
    public static PracticeResponse from(PracticeSession practice, List<ProgressSnapshot> progress) {
        List<QuestionView> views = new ArrayList<>(practice.questionCount());
        for (PracticeQuestion q : practice.questions()) {
            ProgressSnapshot snapshot = q.questionIndex() < progress.size() ? progress.get(q.questionIndex()) : null;
            views.add(new QuestionView(q.questionIndex(), q.text(), q.structureHint(),
                    q.framework().name(), q.framework().sections(), snapshot));
        }
        return new PracticeResponse(practice.id(), practice.interviewId(), practice.track(),
                practice.status(), practice.createdAt(), views);
    }
}
