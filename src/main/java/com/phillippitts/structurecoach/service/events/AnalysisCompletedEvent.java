package com.phillippitts.structurecoach.service.events;

import com.phillippitts.structurecoach.domain.AnalysisKind;

import java.time.Instant;
import java.util.List;

/**
 * Emitted after an aggregate analysis has been persisted.
 *
 * @param practiceId practice that was analyzed
 * @param questionIndex zero-based question index
 * @param compositeScore composite score 0..100
 * @param failedKinds dimensions that failed or timed out
 * @param timestamp when the analysis was stored
 */
public record AnalysisCompletedEvent(
        long practiceId,
        int questionIndex,
        double compositeScore,
        List<AnalysisKind> failedKinds,
        Instant timestamp
) {
    public AnalysisCompletedEvent {
        failedKinds = List.copyOf(failedKinds);
    }
}
