package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;
import com.phillippitts.structurecoach.repository.SectionAnswerStore;
import com.phillippitts.structurecoach.service.events.AnalysisCompletedEvent;
import com.phillippitts.structurecoach.service.practice.PracticeLookup;
import com.phillippitts.structurecoach.service.progress.ProgressCalculator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Analyzes the submitted sections of one practice question and stores the result.
 *
 * <p>The aggregate is written onto the most recently submitted section answer; any earlier
 * aggregate for the question is cleared. Resubmitting a section afterwards leaves the stored
 * aggregate as it is until the next analyze call.
 */
@Service
public class StructureAnalysisService {

    private static final Logger LOG = LogManager.getLogger(StructureAnalysisService.class);

    private final PracticeLookup practiceLookup;
    private final SectionAnswerStore answerStore;
    private final AnalysisAggregator aggregator;
    private final ApplicationEventPublisher publisher;

    public StructureAnalysisService(PracticeLookup practiceLookup,
                                    SectionAnswerStore answerStore,
                                    AnalysisAggregator aggregator,
                                    ApplicationEventPublisher publisher) {
        this.practiceLookup = practiceLookup;
        this.answerStore = answerStore;
        this.aggregator = aggregator;
        this.publisher = publisher;
    }

    /**
     * @param kindNames requested analysis kinds by wire name; {@code null} means all kinds
     */
    public StructureAnalysis analyze(long practiceId, int questionIndex, Collection<String> kindNames) {
        Set<AnalysisKind> kinds = parseKinds(kindNames);
        PracticeQuestion question = practiceLookup.requireQuestion(practiceId, questionIndex);

        List<SectionAnswer> answers = answerStore.findByQuestion(practiceId, questionIndex);
        if (answers.isEmpty()) {
            throw new EmptyAnswerException(practiceId, questionIndex);
        }

        AnalysisContext context = new AnalysisContext(practiceId, questionIndex, question.text(),
                question.framework(), answers);
        AggregateAnalysis analysis = aggregator.aggregate(context, kinds);
        long answerId = answerStore.saveAnalysis(practiceId, questionIndex, analysis);
        LOG.debug("Analysis for question {} attached to section answer {}", questionIndex, answerId);

        ProgressSnapshot progress = ProgressCalculator.snapshot(question.framework(), answers);
        publisher.publishEvent(new AnalysisCompletedEvent(practiceId, questionIndex,
                analysis.compositeScore(), analysis.failedKinds(), analysis.computedAt()));

        return new StructureAnalysis(practiceId, questionIndex, analysis, progress,
                CompositeScoreCalculator.progressMessage(analysis.compositeScore()));
    }

    static Set<AnalysisKind> parseKinds(Collection<String> kindNames) {
        if (kindNames == null) {
            return EnumSet.allOf(AnalysisKind.class);
        }
        if (kindNames.isEmpty()) {
            throw new InvalidAnalysisRequestException("analysis_types", "at least one analysis type is required",
                    AnalysisKind.wireNames());
        }
        Set<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
        for (String name : kindNames) {
            kinds.add(AnalysisKind.fromWireName(name));
        }
        return kinds;
    }
}
