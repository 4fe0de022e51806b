package com.phillippitts.structurecoach.domain;

import java.util.Objects;

/**
 * Immutable result returned by the speech-to-text collaborator for one section recording.
 *
 * @param text            transcribed text (never null; may be empty for silence)
 * @param wordCount       number of whitespace-separated words in {@code text}
 * @param durationSeconds audio duration in seconds
 * @param modelIdentifier model that produced the transcript
 * @param latencyMs       collaborator round-trip time
 */
public record TranscriptionResult(
        String text,
        int wordCount,
        double durationSeconds,
        String modelIdentifier,
        long latencyMs
) {

    /**
     * @throws IllegalArgumentException if counts or durations are negative
     * @throws NullPointerException if text or modelIdentifier is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (wordCount < 0) {
            throw new IllegalArgumentException("Word count must be >= 0, got: " + wordCount);
        }
        if (durationSeconds < 0.0) {
            throw new IllegalArgumentException("Duration must be >= 0, got: " + durationSeconds);
        }
        Objects.requireNonNull(modelIdentifier, "Model identifier must not be null");
    }

    /**
     * Creates a result, deriving the word count from the text.
     */
    public static TranscriptionResult of(String text, double durationSeconds, String modelIdentifier, long latencyMs) {
        String trimmed = text == null ? "" : text.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        return new TranscriptionResult(trimmed, words, durationSeconds, modelIdentifier, latencyMs);
    }
}
