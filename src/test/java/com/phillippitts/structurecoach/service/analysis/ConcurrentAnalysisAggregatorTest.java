package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.AnalysisStatus;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;
import com.phillippitts.structurecoach.service.analysis.AnalysisTestDoubles.FailingDimension;
import com.phillippitts.structurecoach.service.analysis.AnalysisTestDoubles.FixedDimension;
import com.phillippitts.structurecoach.service.analysis.AnalysisTestDoubles.SlowDimension;
import com.phillippitts.structurecoach.service.analysis.dimension.AnalysisDimension;
import com.phillippitts.structurecoach.service.analysis.dimension.ContentQualityDimension;
import com.phillippitts.structurecoach.service.framework.Frameworks;
import com.phillippitts.structurecoach.service.metrics.AnalysisMetrics;
import com.phillippitts.structurecoach.service.quality.HeuristicQualityJudge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.structurecoach.service.analysis.AnalysisTestData.T0;
import static com.phillippitts.structurecoach.service.analysis.AnalysisTestData.context;
import static com.phillippitts.structurecoach.service.analysis.AnalysisTestData.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConcurrentAnalysisAggregatorTest {

    private static final Set<AnalysisKind> ALL = EnumSet.allOf(AnalysisKind.class);

    private ThreadPoolTaskExecutor executor;
    private AnalysisMetrics metrics;
    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final AnalysisContext fullStar = context(Frameworks.star(),
            "Situation", words(30), "30",
            "Task", words(10), "20",
            "Action", words(40), "40",
            "Result", words(30), "30");

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(8);
        executor.setThreadNamePrefix("analysis-test-");
        executor.initialize();
        metrics = new AnalysisMetrics(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private ConcurrentAnalysisAggregator aggregator(List<AnalysisDimension> dimensions, Duration timeout) {
        return new ConcurrentAnalysisAggregator(dimensions, executor, kind -> timeout,
                new HeuristicQualityJudge(25), metrics, clock);
    }

    private static FixedDimension modelQuality(SectionQuality quality) {
        Map<String, SectionQuality> sections = Map.of(
                "Situation", quality, "Task", quality, "Action", quality, "Result", quality);
        return new FixedDimension(AnalysisKind.CONTENT_QUALITY,
                ContentQualityDimension.toPayload(new QualityJudgment(sections, "Strong answer", QualitySource.MODEL)));
    }

    @Test
    void shouldReturnOneEntryPerKindInRequestOrder() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(
                new FixedDimension(AnalysisKind.PAUSE_PATTERN),
                new FixedDimension(AnalysisKind.PACING),
                modelQuality(SectionQuality.GOOD),
                new FixedDimension(AnalysisKind.STRUCTURAL_COMPLETENESS)), Duration.ofSeconds(5));

        AggregateAnalysis result = agg.aggregate(fullStar, ALL);

        assertThat(result.perDimension()).extracting(AnalysisResult::kind).containsExactly(
                AnalysisKind.CONTENT_QUALITY, AnalysisKind.STRUCTURAL_COMPLETENESS,
                AnalysisKind.PACING, AnalysisKind.PAUSE_PATTERN);
        assertThat(result.perDimension()).allMatch(AnalysisResult::isOk);
        assertThat(result.failedKinds()).isEmpty();
        assertThat(result.partialFailure()).isFalse();
        assertThat(result.qualitySource()).isEqualTo(QualitySource.MODEL);
        assertThat(result.keyInsight()).isEqualTo("Strong answer");
        assertThat(result.compositeScore()).isEqualTo(100.0);
        assertThat(result.computedAt()).isEqualTo(T0);
    }

    @Test
    void shouldMarkSlowDimensionAsTimeoutAndKeepOthers() {
        SlowDimension slow = new SlowDimension(AnalysisKind.PAUSE_PATTERN, 10_000);
        ConcurrentAnalysisAggregator agg = aggregator(List.of(
                modelQuality(SectionQuality.GOOD),
                new FixedDimension(AnalysisKind.STRUCTURAL_COMPLETENESS),
                new FixedDimension(AnalysisKind.PACING),
                slow), Duration.ofMillis(300));

        long start = System.nanoTime();
        AggregateAnalysis result = agg.aggregate(fullStar, ALL);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.perDimension()).hasSize(4);
        assertThat(result.result(AnalysisKind.PAUSE_PATTERN)).get()
                .extracting(AnalysisResult::status).isEqualTo(AnalysisStatus.TIMEOUT);
        assertThat(result.result(AnalysisKind.PAUSE_PATTERN).get().payload()).isEmpty();
        assertThat(result.result(AnalysisKind.PAUSE_PATTERN).get().error()).contains("pause_pattern");
        assertThat(result.failedKinds()).containsExactly(AnalysisKind.PAUSE_PATTERN);
        assertThat(result.succeededKinds()).hasSize(3);
        assertThat(result.partialFailure()).isTrue();
        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    void shouldCancelTimedOutWork() {
        SlowDimension slow = new SlowDimension(AnalysisKind.PACING, 10_000);
        ConcurrentAnalysisAggregator agg = aggregator(List.of(slow), Duration.ofMillis(200));

        AggregateAnalysis result = agg.aggregate(fullStar, EnumSet.of(AnalysisKind.PACING));

        assertThat(result.perDimension().get(0).status()).isEqualTo(AnalysisStatus.TIMEOUT);
        await().atMost(2, TimeUnit.SECONDS).untilTrue(slow.interrupted);
    }

    @Test
    void shouldIsolateFailureAndFallBackToHeuristicQuality() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(
                new FailingDimension(AnalysisKind.CONTENT_QUALITY),
                new FixedDimension(AnalysisKind.STRUCTURAL_COMPLETENESS),
                new FixedDimension(AnalysisKind.PACING),
                new FixedDimension(AnalysisKind.PAUSE_PATTERN)), Duration.ofSeconds(5));

        AggregateAnalysis result = agg.aggregate(fullStar, ALL);

        AnalysisResult quality = result.result(AnalysisKind.CONTENT_QUALITY).orElseThrow();
        assertThat(quality.status()).isEqualTo(AnalysisStatus.FAILED);
        assertThat(quality.error()).contains("collaborator exploded");
        assertThat(result.succeededKinds()).containsExactly(
                AnalysisKind.STRUCTURAL_COMPLETENESS, AnalysisKind.PACING, AnalysisKind.PAUSE_PATTERN);
        assertThat(result.qualitySource()).isEqualTo(QualitySource.HEURISTIC);
        // Task has 10 words -> partial; the rest reach 25 words -> good
        assertThat(result.compositeScore()).isEqualTo(93.75);
    }

    @Test
    void shouldRunOnlyRequestedKinds() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(
                modelQuality(SectionQuality.PARTIAL),
                new FixedDimension(AnalysisKind.PACING)), Duration.ofSeconds(5));

        AggregateAnalysis result = agg.aggregate(fullStar, EnumSet.of(AnalysisKind.PACING));

        assertThat(result.requestedKinds()).containsExactly(AnalysisKind.PACING);
        assertThat(result.perDimension()).hasSize(1);
        assertThat(result.qualitySource()).isEqualTo(QualitySource.HEURISTIC);
    }

    @Test
    void shouldFailKindWithoutRegisteredDimension() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(new FixedDimension(AnalysisKind.PACING)),
                Duration.ofSeconds(5));

        AggregateAnalysis result = agg.aggregate(fullStar,
                EnumSet.of(AnalysisKind.PACING, AnalysisKind.PAUSE_PATTERN));

        assertThat(result.result(AnalysisKind.PAUSE_PATTERN).orElseThrow().status())
                .isEqualTo(AnalysisStatus.FAILED);
        assertThat(result.result(AnalysisKind.PACING).orElseThrow().isOk()).isTrue();
    }

    @Test
    void shouldFailRejectedTasksWhenPoolIsSaturated() {
        ThreadPoolTaskExecutor tiny = new ThreadPoolTaskExecutor();
        tiny.setCorePoolSize(1);
        tiny.setMaxPoolSize(1);
        tiny.setQueueCapacity(0);
        tiny.initialize();
        try {
            SlowDimension slow = new SlowDimension(AnalysisKind.CONTENT_QUALITY, 200);
            ConcurrentAnalysisAggregator agg = new ConcurrentAnalysisAggregator(
                    List.of(slow, new FixedDimension(AnalysisKind.PACING)), tiny, kind -> Duration.ofSeconds(5),
                    new HeuristicQualityJudge(25), metrics, clock);

            AggregateAnalysis result = agg.aggregate(fullStar,
                    EnumSet.of(AnalysisKind.CONTENT_QUALITY, AnalysisKind.PACING));

            assertThat(result.perDimension()).hasSize(2);
            AnalysisResult pacing = result.result(AnalysisKind.PACING).orElseThrow();
            assertThat(pacing.status()).isEqualTo(AnalysisStatus.FAILED);
            assertThat(pacing.error()).contains("saturated");
        } finally {
            tiny.shutdown();
        }
    }

    @Test
    void shouldRejectEmptyKinds() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(), Duration.ofSeconds(1));

        assertThatThrownBy(() -> agg.aggregate(fullStar, Set.of()))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("analysis_types");
    }

    @Test
    void shouldRejectQuestionWithoutAnswers() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(), Duration.ofSeconds(1));

        assertThatThrownBy(() -> agg.aggregate(context(Frameworks.star()), ALL))
                .isInstanceOf(EmptyAnswerException.class);
    }

    @Test
    void shouldRejectDuplicateDimensions() {
        assertThatThrownBy(() -> aggregator(List.of(
                new FixedDimension(AnalysisKind.PACING), new FixedDimension(AnalysisKind.PACING)),
                Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRecordOutcomeMetrics() {
        ConcurrentAnalysisAggregator agg = aggregator(List.of(new FailingDimension(AnalysisKind.CONTENT_QUALITY)),
                Duration.ofSeconds(1));

        agg.aggregate(fullStar, EnumSet.of(AnalysisKind.CONTENT_QUALITY));

        assertThat(metrics.consecutiveQualityFailures()).isEqualTo(1);
    }
}
