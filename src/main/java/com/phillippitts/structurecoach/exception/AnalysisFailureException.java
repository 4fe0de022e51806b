package com.phillippitts.structurecoach.exception;

/**
 * Raised by an analysis dimension when its own logic fails. Recovered inside the aggregator
 * and recorded as a {@code failed} entry; siblings are unaffected.
 */
public class AnalysisFailureException extends StructureCoachException {

    private final String kind;

    public AnalysisFailureException(String kind, String message) {
        super("Analysis '" + kind + "' failed: " + message);
        this.kind = kind;
    }

    public AnalysisFailureException(String kind, String message, Throwable cause) {
        super("Analysis '" + kind + "' failed: " + message, cause);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
