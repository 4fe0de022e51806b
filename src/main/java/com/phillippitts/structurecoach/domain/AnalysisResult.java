package com.phillippitts.structurecoach.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single analysis dimension.
 *
 * @param kind      the dimension
 * @param status    ok, failed, or timeout
 * @param payload   structured dimension output; empty (neutral) unless {@code status == OK}
 * @param error     error message for failed/timeout entries, null otherwise
 * @param latencyMs time from launch until the entry settled
 */
public record AnalysisResult(
        AnalysisKind kind,
        AnalysisStatus status,
        Map<String, Object> payload,
        String error,
        long latencyMs
) {

    public AnalysisResult {
        Objects.requireNonNull(kind, "Kind must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AnalysisResult ok(AnalysisKind kind, Map<String, Object> payload, long latencyMs) {
        return new AnalysisResult(kind, AnalysisStatus.OK, payload, null, latencyMs);
    }

    public static AnalysisResult failed(AnalysisKind kind, String error, long latencyMs) {
        return new AnalysisResult(kind, AnalysisStatus.FAILED, Map.of(), error, latencyMs);
    }

    public static AnalysisResult timeout(AnalysisKind kind, String error, long latencyMs) {
        return new AnalysisResult(kind, AnalysisStatus.TIMEOUT, Map.of(), error, latencyMs);
    }

    public boolean isOk() {
        return status == AnalysisStatus.OK;
    }
}
