package com.phillippitts.structurecoach.exception;

/**
 * Thrown when uploaded section audio is empty or larger than the configured limit.
 * The audio is never sent to the transcriber.
 */
public class InvalidAudioException extends StructureCoachException {

    private final long audioSize;
    private final String reason;

    public InvalidAudioException(long audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public long getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
