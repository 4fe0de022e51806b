package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Wired when {@code transcription.enabled} is off: every call fails, so audio submissions
 * are rejected instead of stored as empty text.
 */
@Component
@ConditionalOnProperty(prefix = "transcription", name = "enabled", havingValue = "false", matchIfMissing = true)
public class DisabledSpeechTranscriber implements SpeechTranscriber {

    @Override
    public TranscriptionResult transcribe(byte[] audio, String filename, String language) {
        throw new TranscriptionException("Transcription is disabled; set transcription.enabled=true", name());
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
