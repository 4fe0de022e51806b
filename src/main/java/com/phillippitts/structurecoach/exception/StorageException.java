package com.phillippitts.structurecoach.exception;

/**
 * Wraps persistence failures. Nothing in the core can recover from these, so they propagate
 * to the API boundary as a generic server error.
 */
public class StorageException extends StructureCoachException {

    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("Storage operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
