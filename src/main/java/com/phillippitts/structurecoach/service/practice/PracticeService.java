package com.phillippitts.structurecoach.service.practice;

import com.phillippitts.structurecoach.domain.Interview;
import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.PracticeStatus;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.QuestionSpec;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;
import com.phillippitts.structurecoach.exception.ResourceNotFoundException;
import com.phillippitts.structurecoach.repository.PracticeQuestionDraft;
import com.phillippitts.structurecoach.repository.PracticeRepository;
import com.phillippitts.structurecoach.service.framework.FrameworkRegistry;
import com.phillippitts.structurecoach.service.progress.SectionProgressTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Creates and reads practice sessions.
 *
 * <p>Question selection happens upstream; callers hand in the questions (or an existing
 * interview whose questions are reused). Each question gets its framework here, once.
 */
@Service
public class PracticeService {

    private static final Logger LOG = LogManager.getLogger(PracticeService.class);

    private final PracticeRepository practiceRepository;
    private final PracticeLookup practiceLookup;
    private final FrameworkRegistry frameworkRegistry;
    private final SectionProgressTracker tracker;

    public PracticeService(PracticeRepository practiceRepository,
                           PracticeLookup practiceLookup,
                           FrameworkRegistry frameworkRegistry,
                           SectionProgressTracker tracker) {
        this.practiceRepository = practiceRepository;
        this.practiceLookup = practiceLookup;
        this.frameworkRegistry = frameworkRegistry;
        this.tracker = tracker;
    }

    /**
     * A practice session with the current snapshot of each of its questions, in question order.
     */
    public record PracticeOverview(PracticeSession practice, List<ProgressSnapshot> progress) {
        public PracticeOverview {
            Objects.requireNonNull(practice, "practice");
            progress = List.copyOf(progress);
        }
    }

    /**
     * Creates a practice session.
     *
     * @param interviewId existing interview to practice, or {@code null} to create one
     * @param track interview track; may be {@code null} when an interview is given
     * @param questions questions to practice; must be empty when an interview is given
     */
    public PracticeSession createPractice(Long interviewId, String track, List<QuestionSpec> questions) {
        List<QuestionSpec> requested = questions == null ? List.of() : questions;
        Interview interview;
        if (interviewId != null) {
            interview = practiceRepository.findInterview(interviewId)
                    .orElseThrow(() -> new ResourceNotFoundException("Interview", interviewId));
            if (!requested.isEmpty()) {
                throw new InvalidAnalysisRequestException("questions",
                        "must be omitted when interview_id is given; the interview's questions are reused",
                        List.of());
            }
        } else {
            if (requested.isEmpty()) {
                throw new InvalidAnalysisRequestException("questions", "at least one question is required", List.of());
            }
            if (track == null || track.isBlank()) {
                throw new InvalidAnalysisRequestException("track", "must not be blank", List.of());
            }
            interview = practiceRepository.createInterview(track.trim(), requested);
        }
        if (interview.questions().isEmpty()) {
            throw new InvalidAnalysisRequestException("questions",
                    "interview " + interview.id() + " has no questions", List.of());
        }

        List<PracticeQuestionDraft> drafts = interview.questions().stream()
                .map(q -> new PracticeQuestionDraft(q.text(), q.structureHint(),
                        frameworkRegistry.detectFramework(q.structureHint()).name()))
                .toList();
        String practiceTrack = track == null || track.isBlank() ? interview.track() : track.trim();
        PracticeSession practice = practiceRepository.createPractice(interview.id(), practiceTrack, drafts);

        LOG.info("Created practice {} for interview {} with {} question(s), frameworks={}",
                practice.id(), interview.id(), practice.questionCount(),
                drafts.stream().map(PracticeQuestionDraft::frameworkName).toList());
        return practice;
    }

    public PracticeOverview getPractice(long practiceId) {
        PracticeSession practice = practiceLookup.requirePractice(practiceId);
        List<ProgressSnapshot> progress = practice.questions().stream()
                .map(q -> tracker.getSnapshot(practiceId, q.questionIndex()))
                .toList();
        return new PracticeOverview(practice, progress);
    }

    /**
     * Marks the practice {@code completed} when every question has all of its sections.
     *
     * @return {@code true} if the practice is completed after the call
     */
    public boolean markCompletedIfDone(long practiceId) {
        PracticeSession practice = practiceLookup.requirePractice(practiceId);
        if (practice.status() == PracticeStatus.COMPLETED) {
            return true;
        }
        for (PracticeQuestion q : practice.questions()) {
            if (!tracker.getSnapshot(practiceId, q.questionIndex()).complete()) {
                return false;
            }
        }
        practiceRepository.updateStatus(practiceId, PracticeStatus.COMPLETED);
        LOG.info("Practice {} completed", practiceId);
        return true;
    }
}
