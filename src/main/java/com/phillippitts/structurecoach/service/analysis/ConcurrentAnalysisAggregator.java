package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.config.properties.AnalysisProperties;
import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.AnalysisStatus;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.exception.AnalysisFailureException;
import com.phillippitts.structurecoach.exception.AnalysisTimeoutException;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException;
import com.phillippitts.structurecoach.service.analysis.dimension.AnalysisDimension;
import com.phillippitts.structurecoach.service.analysis.dimension.ContentQualityDimension;
import com.phillippitts.structurecoach.service.metrics.AnalysisMetrics;
import com.phillippitts.structurecoach.service.quality.HeuristicQualityJudge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@link AnalysisAggregator} that submits one task per requested kind to the analysis
 * executor and joins them with individual deadlines.
 *
 * <p>Deadlines are measured from the moment the fan-out starts, so the whole call is bounded
 * by the largest per-kind timeout, not their sum. A kind that misses its deadline is
 * cancelled with interruption and recorded as {@code timeout}; a kind that throws is
 * recorded as {@code failed}. Siblings are never affected.
 *
 * <p>Section classification uses the {@code content_quality} result when it succeeded and
 * the heuristic judge otherwise.
 */
@Service
public class ConcurrentAnalysisAggregator implements AnalysisAggregator {

    private static final Logger LOG = LogManager.getLogger(ConcurrentAnalysisAggregator.class);

    private final Map<AnalysisKind, AnalysisDimension> dimensions = new EnumMap<>(AnalysisKind.class);
    private final AsyncTaskExecutor executor;
    private final Function<AnalysisKind, Duration> timeouts;
    private final HeuristicQualityJudge fallbackJudge;
    private final AnalysisMetrics metrics;
    private final Clock clock;

    @Autowired
    public ConcurrentAnalysisAggregator(List<AnalysisDimension> dimensions,
                                        @Qualifier("analysisExecutor") AsyncTaskExecutor executor,
                                        AnalysisProperties properties,
                                        HeuristicQualityJudge fallbackJudge,
                                        AnalysisMetrics metrics,
                                        Clock clock) {
        this(dimensions, executor, properties::timeoutFor, fallbackJudge, metrics, clock);
    }

    public ConcurrentAnalysisAggregator(List<AnalysisDimension> dimensions,
                                        AsyncTaskExecutor executor,
                                        Function<AnalysisKind, Duration> timeouts,
                                        HeuristicQualityJudge fallbackJudge,
                                        AnalysisMetrics metrics,
                                        Clock clock) {
        for (AnalysisDimension d : dimensions) {
            if (this.dimensions.put(d.kind(), d) != null) {
                throw new IllegalArgumentException("Duplicate analysis dimension for kind " + d.kind());
            }
        }
        this.executor = executor;
        this.timeouts = timeouts;
        this.fallbackJudge = fallbackJudge;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public AggregateAnalysis aggregate(AnalysisContext context, Set<AnalysisKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            throw new InvalidAnalysisRequestException("analysis_types", "at least one analysis type is required",
                    AnalysisKind.wireNames());
        }
        if (context.isEmpty()) {
            throw new EmptyAnswerException(context.practiceId(), context.questionIndex());
        }

        Set<AnalysisKind> requested = EnumSet.copyOf(kinds);
        List<AnalysisResult> results = runAll(context, requested);

        List<AnalysisKind> succeeded = new ArrayList<>();
        List<AnalysisKind> failed = new ArrayList<>();
        for (AnalysisResult r : results) {
            (r.isOk() ? succeeded : failed).add(r.kind());
        }

        QualityJudgment judgment = results.stream()
                .filter(r -> r.kind() == AnalysisKind.CONTENT_QUALITY && r.isOk())
                .findFirst()
                .map(r -> ContentQualityDimension.fromPayload(r.payload()))
                .orElseGet(() -> fallbackJudge.judge(context.toQualityRequest()));

        List<SectionJudgment> sections = CompositeScoreCalculator.classify(
                context.framework(), context.sectionTimes(), judgment.sectionQuality());
        double composite = CompositeScoreCalculator.compositeScore(sections);

        LOG.info("Aggregated {} dimension(s) for question {}: ok={}, degraded={}, composite={}, quality={}",
                results.size(), context.questionIndex(), succeeded, failed, composite, judgment.source().wireName());

        return new AggregateAnalysis(results, new ArrayList<>(requested), succeeded, failed, sections,
                judgment.source(), judgment.keyInsight(), composite, clock.instant());
    }

    private List<AnalysisResult> runAll(AnalysisContext context, Set<AnalysisKind> requested) {
        long startNanos = System.nanoTime();
        Map<AnalysisKind, Future<Map<String, Object>>> inFlight = new EnumMap<>(AnalysisKind.class);
        Map<AnalysisKind, AnalysisResult> settled = new EnumMap<>(AnalysisKind.class);

        for (AnalysisKind kind : requested) {
            AnalysisDimension dimension = dimensions.get(kind);
            if (dimension == null) {
                settled.put(kind, failed(kind, new AnalysisFailureException(kind.wireName(), "no analyzer registered"), 0));
                continue;
            }
            try {
                inFlight.put(kind, executor.submit(() -> dimension.analyze(context)));
            } catch (TaskRejectedException e) {
                settled.put(kind, failed(kind, new AnalysisFailureException(kind.wireName(), "analysis pool saturated", e), 0));
            }
        }

        for (Map.Entry<AnalysisKind, Future<Map<String, Object>>> e : inFlight.entrySet()) {
            AnalysisKind kind = e.getKey();
            Future<Map<String, Object>> future = e.getValue();
            Duration timeout = timeouts.apply(kind);
            long remaining = startNanos + timeout.toNanos() - System.nanoTime();
            try {
                Map<String, Object> payload = future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                long latency = elapsedMs(startNanos);
                settled.put(kind, AnalysisResult.ok(kind, payload, latency));
                metrics.recordDimension(kind, settled.get(kind).status(), latency);
            } catch (TimeoutException te) {
                future.cancel(true);
                AnalysisTimeoutException ex = new AnalysisTimeoutException(kind.wireName(), timeout);
                LOG.warn(ex.getMessage());
                long latency = elapsedMs(startNanos);
                settled.put(kind, AnalysisResult.timeout(kind, ex.getMessage(), latency));
                metrics.recordDimension(kind, settled.get(kind).status(), latency);
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
                settled.put(kind, failed(kind, new AnalysisFailureException(kind.wireName(), describe(cause), cause),
                        elapsedMs(startNanos)));
            } catch (CancellationException ce) {
                settled.put(kind, failed(kind, new AnalysisFailureException(kind.wireName(), "cancelled", ce),
                        elapsedMs(startNanos)));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                inFlight.values().forEach(f -> f.cancel(true));
                settled.put(kind, failed(kind, new AnalysisFailureException(kind.wireName(), "interrupted", ie),
                        elapsedMs(startNanos)));
            }
        }

        // requested order, independent of completion order
        List<AnalysisResult> out = new ArrayList<>(requested.size());
        for (AnalysisKind kind : requested) {
            AnalysisResult r = settled.get(kind);
            if (r == null) {
                r = AnalysisResult.failed(kind, "Analysis '" + kind.wireName() + "' failed: interrupted", elapsedMs(startNanos));
            }
            out.add(r);
        }
        return out;
    }

    private AnalysisResult failed(AnalysisKind kind, AnalysisFailureException ex, long latencyMs) {
        LOG.warn(ex.getMessage(), ex.getCause());
        metrics.recordDimension(kind, AnalysisStatus.FAILED, latencyMs);
        return AnalysisResult.failed(kind, ex.getMessage(), latencyMs);
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
