package com.phillippitts.structurecoach.exception;

/**
 * Base exception for all structure-coach application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StructureCoachException extends RuntimeException {

    public StructureCoachException(String message) {
        super(message);
    }

    public StructureCoachException(String message, Throwable cause) {
        super(message, cause);
    }

    public StructureCoachException(Throwable cause) {
        super(cause);
    }
}
