package com.phillippitts.structurecoach.exception;

/**
 * Thrown when neither the scoring collaborator nor the heuristic fallback can produce a
 * report, e.g. when an interview has no analyzed question attempts at all.
 */
public class ReportSynthesisException extends StructureCoachException {

    private final long interviewId;

    public ReportSynthesisException(long interviewId, String reason) {
        super("Cannot synthesize report for interview " + interviewId + ": " + reason);
        this.interviewId = interviewId;
    }

    public long getInterviewId() {
        return interviewId;
    }
}
