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
import com.phillippitts.structurecoach.service.framework.Frameworks;
import com.phillippitts.structurecoach.service.progress.SectionProgressTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PracticeServiceTest {

    private PracticeRepository repository;
    private SectionProgressTracker tracker;
    private PracticeService service;

    @BeforeEach
    void setUp() {
        repository = mock(PracticeRepository.class);
        tracker = mock(SectionProgressTracker.class);
        service = new PracticeService(repository, new PracticeLookup(repository),
                FrameworkRegistry.withBuiltIns(), tracker);
    }

    private static PracticeSession session(PracticeStatus status) {
        return new PracticeSession(3L, 1L, "Backend", status, List.of(
                new PracticeQuestion(3L, 0, "Outage story", "STAR", Frameworks.star()),
                new PracticeQuestion(3L, 1, "Design a cache", "goal and constraints", Frameworks.gcdio())),
                Instant.parse("2026-03-01T10:00:00Z"));
    }

    private static ProgressSnapshot snapshot(boolean complete) {
        return new ProgressSnapshot("STAR", List.of(), 0, 4, complete ? null : "Situation", null,
                complete, Map.of(), "msg");
    }

    @Test
    @SuppressWarnings("unchecked")
    void createsInterviewAndAssignsFrameworksPerQuestion() {
        List<QuestionSpec> questions = List.of(
                new QuestionSpec("Outage story", "Use the STAR method"),
                new QuestionSpec("Design a cache", "Walk through goal and constraints"),
                new QuestionSpec("Explain CAP", "Cover the theory and trade-offs"));
        when(repository.createInterview("Backend", questions)).thenReturn(new Interview(1L, "Backend", questions));
        when(repository.createPractice(eq(1L), eq("Backend"), any())).thenReturn(session(PracticeStatus.ACTIVE));

        service.createPractice(null, " Backend ", questions);

        ArgumentCaptor<List<PracticeQuestionDraft>> drafts = ArgumentCaptor.forClass(List.class);
        verify(repository).createPractice(eq(1L), eq("Backend"), drafts.capture());
        assertThat(drafts.getValue()).extracting(PracticeQuestionDraft::frameworkName)
                .containsExactly(Frameworks.STAR, Frameworks.GCDIO, Frameworks.CTETD);
    }

    @Test
    void reusesExistingInterviewQuestions() {
        List<QuestionSpec> questions = List.of(new QuestionSpec("Outage story", ""));
        when(repository.findInterview(1L)).thenReturn(Optional.of(new Interview(1L, "Backend", questions)));
        when(repository.createPractice(eq(1L), eq("Backend"), any())).thenReturn(session(PracticeStatus.ACTIVE));

        assertThat(service.createPractice(1L, null, null).interviewId()).isEqualTo(1L);
        verify(repository, never()).createInterview(any(), any());
    }

    @Test
    void rejectsQuestionsTogetherWithInterviewId() {
        when(repository.findInterview(1L)).thenReturn(
                Optional.of(new Interview(1L, "Backend", List.of(new QuestionSpec("q", "")))));

        assertThatThrownBy(() -> service.createPractice(1L, null, List.of(new QuestionSpec("other", ""))))
                .isInstanceOfSatisfying(InvalidAnalysisRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("questions"));
    }

    @Test
    void rejectsUnknownInterview() {
        when(repository.findInterview(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createPractice(9L, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void newInterviewNeedsTrackAndQuestions() {
        assertThatThrownBy(() -> service.createPractice(null, "Backend", List.of()))
                .isInstanceOfSatisfying(InvalidAnalysisRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("questions"));
        assertThatThrownBy(() -> service.createPractice(null, " ", List.of(new QuestionSpec("q", ""))))
                .isInstanceOfSatisfying(InvalidAnalysisRequestException.class,
                        e -> assertThat(e.getField()).isEqualTo("track"));
    }

    @Test
    void overviewHasOneSnapshotPerQuestion() {
        when(repository.findPractice(3L)).thenReturn(Optional.of(session(PracticeStatus.ACTIVE)));
        when(tracker.getSnapshot(eq(3L), anyInt())).thenReturn(snapshot(false));

        PracticeService.PracticeOverview overview = service.getPractice(3L);

        assertThat(overview.progress()).hasSize(2);
    }

    @Test
    void marksCompletedOnlyWhenEveryQuestionIsComplete() {
        when(repository.findPractice(3L)).thenReturn(Optional.of(session(PracticeStatus.ACTIVE)));
        when(tracker.getSnapshot(3L, 0)).thenReturn(snapshot(true));
        when(tracker.getSnapshot(3L, 1)).thenReturn(snapshot(false));

        assertThat(service.markCompletedIfDone(3L)).isFalse();
        verify(repository, never()).updateStatus(anyLong(), any());

        when(tracker.getSnapshot(3L, 1)).thenReturn(snapshot(true));
        assertThat(service.markCompletedIfDone(3L)).isTrue();
        verify(repository).updateStatus(3L, PracticeStatus.COMPLETED);
    }
}
