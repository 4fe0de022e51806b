package com.phillippitts.structurecoach.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Speech-to-text collaborator settings ({@code transcription.*}).
 */
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties extends LlmClientProperties {

    /** Uploads larger than this are rejected before transcription. */
    private long maxAudioBytes = 25L * 1024 * 1024;

    public TranscriptionProperties() {
        super("whisper-1");
    }

    public long getMaxAudioBytes() {
        return maxAudioBytes;
    }

    public void setMaxAudioBytes(long maxAudioBytes) {
        this.maxAudioBytes = maxAudioBytes;
    }
}
