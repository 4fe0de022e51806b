package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.Interview;
import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.QuestionAttempt;
import com.phillippitts.structurecoach.domain.QuestionFeedback;
import com.phillippitts.structurecoach.domain.QuestionSpec;
import com.phillippitts.structurecoach.domain.Report;
import com.phillippitts.structurecoach.domain.ScoreSummary;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import com.phillippitts.structurecoach.exception.ReportSynthesisException;
import com.phillippitts.structurecoach.exception.ResourceNotFoundException;
import com.phillippitts.structurecoach.repository.PracticeRepository;
import com.phillippitts.structurecoach.repository.ReportRepository;
import com.phillippitts.structurecoach.repository.SectionAnswerStore;
import com.phillippitts.structurecoach.service.framework.FrameworkRegistry;
import com.phillippitts.structurecoach.service.metrics.AnalysisMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Combines the latest analysis of every interview question into one scored report.
 *
 * <p>Scores come from the model scorer when one is configured; if it is absent or fails, the
 * {@link HeuristicInterviewScorer} derives them from the stored composite scores. Reports are
 * upserted on the interview id, so synthesizing again replaces the previous report.
 */
@Service
public class ReportSynthesizer {

    private static final Logger LOG = LogManager.getLogger(ReportSynthesizer.class);

    private final PracticeRepository practiceRepository;
    private final SectionAnswerStore answerStore;
    private final ReportRepository reportRepository;
    private final FrameworkRegistry frameworkRegistry;
    private final ObjectProvider<ModelInterviewScorer> modelScorer;
    private final HeuristicInterviewScorer heuristicScorer;
    private final AnalysisMetrics metrics;
    private final Clock clock;

    public ReportSynthesizer(PracticeRepository practiceRepository,
                             SectionAnswerStore answerStore,
                             ReportRepository reportRepository,
                             FrameworkRegistry frameworkRegistry,
                             ObjectProvider<ModelInterviewScorer> modelScorer,
                             HeuristicInterviewScorer heuristicScorer,
                             AnalysisMetrics metrics,
                             Clock clock) {
        this.practiceRepository = practiceRepository;
        this.answerStore = answerStore;
        this.reportRepository = reportRepository;
        this.frameworkRegistry = frameworkRegistry;
        this.modelScorer = modelScorer;
        this.heuristicScorer = heuristicScorer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Report synthesize(long interviewId) {
        Interview interview = practiceRepository.findInterview(interviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Interview", interviewId));
        List<QuestionAttempt> attempts = collectAttempts(interview);
        List<QuestionAttempt> attempted = attempts.stream().filter(QuestionAttempt::attempted).toList();
        if (attempted.isEmpty()) {
            throw new ReportSynthesisException(interviewId, "no question has been analyzed yet");
        }

        ScoreSummary summary = score(attempted, attempts.size());

        List<QuestionFeedback> perQuestion = new ArrayList<>(attempts.size());
        attempts.forEach(a -> perQuestion.add(FeedbackBuilder.forQuestion(a)));

        Report report = new Report(UUID.randomUUID().toString(), interviewId, summary,
                FeedbackBuilder.overall(attempts), perQuestion, clock.instant());
        reportRepository.upsert(report);

        LOG.info("Report {} stored for interview {}: attempted={}/{}, knowledge={}/{}, speech={}/{}, source={}",
                report.reportId(), interviewId, attempted.size(), attempts.size(),
                summary.knowledgeCompetence().score(), summary.knowledgeCompetence().maxScore(),
                summary.speechAndStructure().score(), summary.speechAndStructure().maxScore(),
                summary.source());
        return report;
    }

    public Report getReport(long interviewId) {
        return reportRepository.findByInterviewId(interviewId)
                .orElseThrow(() -> new ResourceNotFoundException("Report", interviewId));
    }

    private ScoreSummary score(List<QuestionAttempt> attempted, int totalQuestions) {
        ModelInterviewScorer scorer = modelScorer.getIfAvailable();
        if (scorer != null) {
            try {
                return ScoreSummaryCalculator.summarize(scorer.score(attempted), totalQuestions, scorer.source());
            } catch (CollaboratorUnavailableException e) {
                LOG.warn("Interview scorer failed, using heuristic scores: {}", e.getMessage());
                metrics.incrementReportFallback("error");
            }
        } else {
            metrics.incrementReportFallback("disabled");
        }
        return ScoreSummaryCalculator.summarize(heuristicScorer.score(attempted), totalQuestions,
                heuristicScorer.source());
    }

    /**
     * One attempt per interview question, in question order, carrying the newest analysis
     * across all of the interview's practice sessions.
     */
    List<QuestionAttempt> collectAttempts(Interview interview) {
        List<PracticeSession> practices = practiceRepository.findPracticesByInterview(interview.id());
        Map<Integer, AggregateAnalysis> latest =
                answerStore.findLatestAnalysesByQuestion(practices.stream().map(PracticeSession::id).toList());

        Map<Integer, String> frameworkByIndex = new HashMap<>();
        for (PracticeSession p : practices) {
            for (PracticeQuestion q : p.questions()) {
                frameworkByIndex.putIfAbsent(q.questionIndex(), q.framework().name());
            }
        }

        List<QuestionAttempt> attempts = new ArrayList<>(interview.questions().size());
        for (int i = 0; i < interview.questions().size(); i++) {
            QuestionSpec spec = interview.questions().get(i);
            String framework = frameworkByIndex.computeIfAbsent(i,
                    k -> frameworkRegistry.detectFramework(spec.structureHint()).name());
            attempts.add(new QuestionAttempt(i, spec.text(), framework, latest.get(i)));
        }
        return attempts;
    }
}
