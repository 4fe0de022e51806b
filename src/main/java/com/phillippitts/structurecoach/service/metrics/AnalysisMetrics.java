package com.phillippitts.structurecoach.service.metrics;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for answer analysis and report synthesis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency per analysis kind</li>
 *   <li>Outcome counts per analysis kind (ok, failed, timeout)</li>
 *   <li>Report scorer fallbacks to the heuristic</li>
 *   <li>Transcription failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 */
@Component
public class AnalysisMetrics {

    private static final String METRIC_PREFIX = "structurecoach";

    private final MeterRegistry registry;
    private final AtomicLong consecutiveQualityFailures = new AtomicLong();

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency and outcome of one dimension run.
     */
    public void recordDimension(AnalysisKind kind, AnalysisStatus status, long latencyMs) {
        Timer.builder(METRIC_PREFIX + ".analysis.latency")
                .description("Time taken by one analysis dimension")
                .tag("kind", kind.wireName())
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
        Counter.builder(METRIC_PREFIX + ".analysis.outcome")
                .description("Analysis dimension outcomes")
                .tag("kind", kind.wireName())
                .tag("status", status.wireName())
                .register(registry)
                .increment();
        if (kind == AnalysisKind.CONTENT_QUALITY) {
            if (status == AnalysisStatus.OK) {
                consecutiveQualityFailures.set(0);
            } else {
                consecutiveQualityFailures.incrementAndGet();
            }
        }
    }

    /**
     * Increments the counter of reports scored by the heuristic instead of the scorer.
     *
     * @param reason why the scorer was not used (disabled, error)
     */
    public void incrementReportFallback(String reason) {
        Counter.builder(METRIC_PREFIX + ".report.fallback")
                .description("Reports scored by the heuristic fallback")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementTranscriptionFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Failed section transcriptions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /** Content-quality runs that failed or timed out since the last success. */
    public long consecutiveQualityFailures() {
        return consecutiveQualityFailures.get();
    }
}
