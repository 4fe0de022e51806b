package com.phillippitts.structurecoach.exception;

import java.time.Duration;

/**
 * Raised when a single analysis dimension exceeds its time budget. Recovered inside the
 * aggregator and recorded as a {@code timeout} entry; never surfaced to API clients.
 */
public class AnalysisTimeoutException extends StructureCoachException {

    private final String kind;
    private final Duration timeout;

    public AnalysisTimeoutException(String kind, Duration timeout) {
        super("Analysis '" + kind + "' timed out after " + timeout.toMillis() + " ms");
        this.kind = kind;
        this.timeout = timeout;
    }

    public String getKind() {
        return kind;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
