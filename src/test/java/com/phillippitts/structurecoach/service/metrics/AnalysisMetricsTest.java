package com.phillippitts.structurecoach.service.metrics;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final AnalysisMetrics metrics = new AnalysisMetrics(registry);

    @Test
    void recordsLatencyAndOutcomePerKind() {
        metrics.recordDimension(AnalysisKind.PACING, AnalysisStatus.OK, 12);
        metrics.recordDimension(AnalysisKind.PACING, AnalysisStatus.OK, 8);
        metrics.recordDimension(AnalysisKind.PACING, AnalysisStatus.FAILED, 3);

        Timer timer = registry.find("structurecoach.analysis.latency").tag("kind", "pacing").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(3);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(23.0);

        Counter ok = registry.find("structurecoach.analysis.outcome")
                .tags("kind", "pacing", "status", "ok").counter();
        assertThat(ok).isNotNull();
        assertThat(ok.count()).isEqualTo(2.0);
    }

    @Test
    void tracksConsecutiveQualityFailuresOnly() {
        metrics.recordDimension(AnalysisKind.CONTENT_QUALITY, AnalysisStatus.FAILED, 1);
        metrics.recordDimension(AnalysisKind.CONTENT_QUALITY, AnalysisStatus.TIMEOUT, 1);
        metrics.recordDimension(AnalysisKind.PACING, AnalysisStatus.FAILED, 1);
        assertThat(metrics.consecutiveQualityFailures()).isEqualTo(2);

        metrics.recordDimension(AnalysisKind.CONTENT_QUALITY, AnalysisStatus.OK, 1);
        assertThat(metrics.consecutiveQualityFailures()).isZero();
    }

    @Test
    void countsFallbacksAndTranscriptionFailuresByReason() {
        metrics.incrementReportFallback("disabled");
        metrics.incrementReportFallback("disabled");
        metrics.incrementTranscriptionFailure("empty");

        assertThat(registry.find("structurecoach.report.fallback").tag("reason", "disabled").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("structurecoach.transcription.failure").tag("reason", "empty").counter().count())
                .isEqualTo(1.0);
    }
}
