package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.domain.TranscriptionResult;

/**
 * Contract for the speech-to-text collaborator.
 *
 * <p>Thread Safety: implementations must be safe for concurrent transcriptions.
 */
public interface SpeechTranscriber {

    /**
     * Transcribes one recorded section.
     *
     * @param audio encoded audio as uploaded by the client
     * @param filename original file name, used by the remote service to infer the container
     * @param language ISO-639-1 language hint, or {@code null} to auto-detect
     * @return text, word count, duration, model identifier and latency
     * @throws com.phillippitts.structurecoach.exception.TranscriptionException on any failure
     */
    TranscriptionResult transcribe(byte[] audio, String filename, String language);

    /**
     * Returns the transcriber name for logging and health details.
     */
    String name();

    /**
     * Whether this transcriber can currently produce transcripts at all.
     */
    boolean isAvailable();
}
