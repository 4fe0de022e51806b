package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.config.DomainConfig;
import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.Interview;
import com.phillippitts.structurecoach.domain.OverallFeedback;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.PracticeStatus;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.QuestionFeedback;
import com.phillippitts.structurecoach.domain.QuestionSpec;
import com.phillippitts.structurecoach.domain.Report;
import com.phillippitts.structurecoach.domain.ScoreBand;
import com.phillippitts.structurecoach.domain.ScoreSummary;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.service.framework.Frameworks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@JdbcTest
@Import({DomainConfig.class, JdbcPracticeRepository.class, JdbcSectionAnswerStore.class, JdbcReportRepository.class})
class JdbcRepositoriesTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private JdbcPracticeRepository practices;

    @Autowired
    private JdbcSectionAnswerStore answers;

    @Autowired
    private JdbcReportRepository reports;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Interview interview;
    private PracticeSession practice;

    @BeforeEach
    void setUp() {
        interview = practices.createInterview("Backend", List.of(
                new QuestionSpec("Outage story", "Use STAR"),
                new QuestionSpec("Design a cache", "goal and constraints")));
        practice = practices.createPractice(interview.id(), "Backend", List.of(
                new PracticeQuestionDraft("Outage story", "Use STAR", Frameworks.STAR),
                new PracticeQuestionDraft("Design a cache", "goal and constraints", Frameworks.GCDIO)));
    }

    private static AggregateAnalysis aggregate(double composite, Instant at) {
        return new AggregateAnalysis(
                List.of(AnalysisResult.ok(AnalysisKind.PACING, Map.of("score", 80, "category", "good"), 4),
                        AnalysisResult.timeout(AnalysisKind.CONTENT_QUALITY, "timed out after 20s", 20000)),
                List.of(AnalysisKind.PACING, AnalysisKind.CONTENT_QUALITY),
                List.of(AnalysisKind.PACING), List.of(AnalysisKind.CONTENT_QUALITY),
                List.of(SectionJudgment.missing("Situation")), QualitySource.HEURISTIC,
                "Lead with the outcome.", composite, at);
    }

    private int countRows(String sql, Object... args) {
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, args);
        return n == null ? 0 : n;
    }

    @Test
    void practiceRoundTripsWithFrameworks() {
        PracticeSession loaded = practices.findPractice(practice.id()).orElseThrow();

        assertThat(loaded.status()).isEqualTo(PracticeStatus.ACTIVE);
        assertThat(loaded.questions()).extracting(q -> q.framework().name())
                .containsExactly(Frameworks.STAR, Frameworks.GCDIO);
        assertThat(practices.findInterview(interview.id()).orElseThrow().questions()).hasSize(2);
        assertThat(practices.findPracticesByInterview(interview.id())).hasSize(1);

        practices.updateStatus(practice.id(), PracticeStatus.COMPLETED);
        assertThat(practices.findPractice(practice.id()).orElseThrow().status()).isEqualTo(PracticeStatus.COMPLETED);
    }

    @Test
    void resubmissionKeepsOneRowWithLatestContent() {
        SectionAnswer first = answers.upsert(practice.id(), 0, "Situation", "First take.", 30, T0);
        SectionAnswer second = answers.upsert(practice.id(), 0, "Situation", "Second take.", 45, T0.plusSeconds(60));

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(answers.findByQuestion(practice.id(), 0)).singleElement()
                .satisfies(a -> {
                    assertThat(a.answerText()).isEqualTo("Second take.");
                    assertThat(a.timeSpentSeconds()).isEqualTo(45);
                    assertThat(a.submittedAt()).isEqualTo(T0.plusSeconds(60));
                });
    }

    @Test
    void answersAreOrderedBySubmissionTime() {
        answers.upsert(practice.id(), 0, "Action", "Did things.", 60, T0.plusSeconds(10));
        answers.upsert(practice.id(), 0, "Situation", "Context.", 30, T0);

        assertThat(answers.findByQuestion(practice.id(), 0)).extracting(SectionAnswer::sectionName)
                .containsExactly("Situation", "Action");
        assertThat(answers.findByQuestion(practice.id(), 1)).isEmpty();
    }

    @Test
    void analysisLivesOnLatestAnswerOnly() {
        answers.upsert(practice.id(), 0, "Situation", "Context.", 30, T0);
        SectionAnswer task = answers.upsert(practice.id(), 0, "Task", "My job.", 20, T0.plusSeconds(5));
        answers.saveAnalysis(practice.id(), 0, aggregate(40.0, T0.plusSeconds(6)));

        SectionAnswer action = answers.upsert(practice.id(), 0, "Action", "Steps.", 50, T0.plusSeconds(10));
        long attachedTo = answers.saveAnalysis(practice.id(), 0, aggregate(55.0, T0.plusSeconds(11)));

        assertThat(attachedTo).isEqualTo(action.id()).isNotEqualTo(task.id());
        assertThat(countRows("SELECT COUNT(*) FROM section_answer WHERE practice_id=? AND analysis_json IS NOT NULL",
                practice.id())).isEqualTo(1);

        AggregateAnalysis stored = answers.findLatestAnalysis(practice.id(), 0).orElseThrow();
        assertThat(stored.compositeScore()).isEqualTo(55.0);
        assertThat(stored.failedKinds()).containsExactly(AnalysisKind.CONTENT_QUALITY);
        assertThat(stored.result(AnalysisKind.PACING).orElseThrow().payload()).containsEntry("category", "good");
        assertThat(stored.keyInsight()).isEqualTo("Lead with the outcome.");
    }

    @Test
    void savingAnalysisWithoutAnswersFails() {
        assertThatThrownBy(() -> answers.saveAnalysis(practice.id(), 1, aggregate(0.0, T0)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(answers.findLatestAnalysis(practice.id(), 1)).isEmpty();
    }

    @Test
    void latestAnalysisPerQuestionWinsAcrossPractices() {
        PracticeSession retry = practices.createPractice(interview.id(), "Backend", List.of(
                new PracticeQuestionDraft("Outage story", "Use STAR", Frameworks.STAR)));

        answers.upsert(practice.id(), 0, "Situation", "Old.", 30, T0);
        answers.saveAnalysis(practice.id(), 0, aggregate(20.0, T0.plusSeconds(1)));
        answers.upsert(retry.id(), 0, "Situation", "New.", 30, T0.plusSeconds(100));
        answers.saveAnalysis(retry.id(), 0, aggregate(70.0, T0.plusSeconds(101)));
        answers.upsert(practice.id(), 1, "Goal", "Fast reads.", 25, T0.plusSeconds(2));
        answers.saveAnalysis(practice.id(), 1, aggregate(35.0, T0.plusSeconds(3)));

        Map<Integer, AggregateAnalysis> latest =
                answers.findLatestAnalysesByQuestion(List.of(practice.id(), retry.id()));

        assertThat(latest).containsOnlyKeys(0, 1);
        assertThat(latest.get(0).compositeScore()).isEqualTo(70.0);
        assertThat(latest.get(1).compositeScore()).isEqualTo(35.0);
        assertThat(answers.findLatestAnalysesByQuestion(List.of())).isEmpty();
    }

    @Test
    void reportUpsertKeepsOneRowPerInterview() {
        ScoreBand knowledge = new ScoreBand(15, 25, 3.0, 5.0, 60,
                Map.of("accuracy", 3, "depth", 3, "coverage", 3, "relevance", 3, "examples", 3));
        ScoreBand speech = new ScoreBand(12, 20, 3.0, 5.0, 60,
                Map.of("clarity", 3, "language", 3, "confidence", 3, "structure", 3));
        ScoreSummary summary = new ScoreSummary(knowledge, speech, "heuristic");
        OverallFeedback overall = new OverallFeedback(List.of("Clear context"), List.of("Quantify results"),
                List.of("Practice the Result section"));
        QuestionFeedback q0 = new QuestionFeedback(0, "Outage story", 55.0, List.of("Good setup"), List.of());

        reports.upsert(new Report("r-1", interview.id(), summary, overall, Arrays.asList(q0, null), T0));
        reports.upsert(new Report("r-2", interview.id(), summary, overall, Arrays.asList(q0, null), T0.plusSeconds(5)));

        assertThat(countRows("SELECT COUNT(*) FROM report WHERE interview_id=?", interview.id())).isEqualTo(1);
        Report stored = reports.findByInterviewId(interview.id()).orElseThrow();
        assertThat(stored.reportId()).isEqualTo("r-2");
        assertThat(stored.createdAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(stored.perQuestionFeedback()).hasSize(2);
        assertThat(stored.perQuestionFeedback().get(1)).isNull();
        assertThat(stored.scoreSummary().knowledgeCompetence().criteria()).containsEntry("depth", 3);
    }
}
