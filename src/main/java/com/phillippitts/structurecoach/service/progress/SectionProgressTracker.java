package com.phillippitts.structurecoach.service.progress;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidSectionException;
import com.phillippitts.structurecoach.exception.InvalidTimeSpentException;
import com.phillippitts.structurecoach.repository.SectionAnswerStore;
import com.phillippitts.structurecoach.service.events.SectionSubmittedEvent;
import com.phillippitts.structurecoach.service.practice.PracticeLookup;
import com.phillippitts.structurecoach.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-question section state.
 *
 * <p>Sections may be submitted in any order and resubmitted any number of times; a
 * resubmission replaces the stored answer for that section. Snapshots are always rebuilt
 * from storage so concurrent submissions for different sections of one question each see
 * the full persisted set.
 */
@Service
public class SectionProgressTracker {

    private static final Logger LOG = LogManager.getLogger(SectionProgressTracker.class);

    private final PracticeLookup practiceLookup;
    private final SectionAnswerStore answerStore;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SectionProgressTracker(PracticeLookup practiceLookup,
                                  SectionAnswerStore answerStore,
                                  ApplicationEventPublisher publisher,
                                  Clock clock) {
        this.practiceLookup = practiceLookup;
        this.answerStore = answerStore;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Checks that the practice and question exist and that the section belongs to the
     * question's framework. Performs no writes.
     *
     * @return the validated question
     */
    public PracticeQuestion validateSection(long practiceId, int questionIndex, String sectionName) {
        PracticeQuestion question = practiceLookup.requireQuestion(practiceId, questionIndex);
        Framework framework = question.framework();
        if (!framework.hasSection(sectionName)) {
            throw new InvalidSectionException(sectionName, framework.name(), framework.sections());
        }
        return question;
    }

    /**
     * Stores (or replaces) the answer for one section and returns the snapshot computed right
     * after the write.
     */
    public ProgressSnapshot submitSection(long practiceId, int questionIndex, String sectionName,
                                          String answerText, int timeSpentSeconds) {
        PracticeQuestion question = validateSection(practiceId, questionIndex, sectionName);
        if (answerText == null || answerText.isBlank()) {
            throw new EmptyAnswerException(practiceId, questionIndex,
                    "Answer text for section '" + sectionName + "' is empty");
        }
        if (timeSpentSeconds < 0) {
            throw new InvalidTimeSpentException(timeSpentSeconds);
        }

        Instant now = clock.instant();
        answerStore.upsert(practiceId, questionIndex, sectionName, answerText.trim(), timeSpentSeconds, now);
        ProgressSnapshot snapshot = snapshotOf(question);

        LOG.info("Section stored: question={}, section={}, time={}s, progress={}/{}, text='{}'",
                questionIndex, sectionName, timeSpentSeconds,
                snapshot.sectionsCompleteCount(), snapshot.totalSections(),
                LogSanitizer.preview(answerText));

        publisher.publishEvent(new SectionSubmittedEvent(practiceId, questionIndex, sectionName,
                snapshot.complete(), now));
        return snapshot;
    }

    public ProgressSnapshot getSnapshot(long practiceId, int questionIndex) {
        return snapshotOf(practiceLookup.requireQuestion(practiceId, questionIndex));
    }

    ProgressSnapshot snapshotOf(PracticeQuestion question) {
        return ProgressCalculator.snapshot(question.framework(),
                answerStore.findByQuestion(question.practiceId(), question.questionIndex()));
    }
}
