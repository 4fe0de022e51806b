package com.phillippitts.structurecoach.exception;

/**
 * Thrown when a section submission reports a negative time spent. Nothing is stored and no
 * collaborator is called.
 */
public class InvalidTimeSpentException extends StructureCoachException {

    private final int timeSpentSeconds;

    public InvalidTimeSpentException(int timeSpentSeconds) {
        super("time_spent_seconds must be >= 0, got: " + timeSpentSeconds);
        this.timeSpentSeconds = timeSpentSeconds;
    }

    public int getTimeSpentSeconds() {
        return timeSpentSeconds;
    }
}
