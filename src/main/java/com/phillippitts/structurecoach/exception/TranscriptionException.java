package com.phillippitts.structurecoach.exception;

/**
 * Thrown when the speech-to-text collaborator fails to turn section audio into text.
 * The section submission fails as a whole; no empty text is substituted.
 */
public class TranscriptionException extends StructureCoachException {

    private final String modelIdentifier;

    public TranscriptionException(String message) {
        super(message);
        this.modelIdentifier = "unknown";
    }

    public TranscriptionException(String message, String modelIdentifier) {
        super(message + " (model: " + modelIdentifier + ")");
        this.modelIdentifier = modelIdentifier;
    }

    public TranscriptionException(String message, String modelIdentifier, Throwable cause) {
        super(message + " (model: " + modelIdentifier + ")", cause);
        this.modelIdentifier = modelIdentifier;
    }

    public String getModelIdentifier() {
        return modelIdentifier;
    }
}
