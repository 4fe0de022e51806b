package com.phillippitts.structurecoach.service.health;

import com.phillippitts.structurecoach.service.analysis.dimension.ContentQualityDimension;
import com.phillippitts.structurecoach.service.metrics.AnalysisMetrics;
import com.phillippitts.structurecoach.service.report.ModelInterviewScorer;
import com.phillippitts.structurecoach.service.transcription.SpeechTranscriber;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports which external collaborators are in use.
 *
 * <p>{@code UP} when the transcriber and model-backed judge and scorer are all active and the
 * quality model is not failing repeatedly; {@code DEGRADED} otherwise, with details naming the
 * fallbacks in effect. The service keeps working in either state.
 */
@Component("collaborators")
public class CollaboratorHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED");

    static final long FAILURE_STREAK_LIMIT = 3;

    private final ContentQualityDimension contentQuality;
    private final SpeechTranscriber transcriber;
    private final ObjectProvider<ModelInterviewScorer> scorer;
    private final AnalysisMetrics metrics;

    public CollaboratorHealthIndicator(ContentQualityDimension contentQuality,
                                       SpeechTranscriber transcriber,
                                       ObjectProvider<ModelInterviewScorer> scorer,
                                       AnalysisMetrics metrics) {
        this.contentQuality = contentQuality;
        this.transcriber = transcriber;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    @Override
    public Health health() {
        String judge = contentQuality.judgeName();
        boolean modelJudge = !"heuristic".equals(judge);
        boolean modelScorer = scorer.getIfAvailable() != null;
        long failures = metrics.consecutiveQualityFailures();

        boolean healthy = modelJudge && modelScorer && transcriber.isAvailable() && failures < FAILURE_STREAK_LIMIT;
        return Health.status(healthy ? Status.UP : DEGRADED)
                .withDetail("qualityJudge", judge)
                .withDetail("interviewScorer", modelScorer ? "scorer" : "heuristic")
                .withDetail("transcriber", transcriber.name())
                .withDetail("consecutiveQualityFailures", failures)
                .build();
    }
}
