package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.config.properties.TranscriptionProperties;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.EmptyAnswerException;
import com.phillippitts.structurecoach.exception.InvalidAudioException;
import com.phillippitts.structurecoach.exception.InvalidTimeSpentException;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import com.phillippitts.structurecoach.service.metrics.AnalysisMetrics;
import com.phillippitts.structurecoach.service.progress.SectionProgressTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

/**
 * Submits one section as recorded audio: validate, transcribe, then store the transcript
 * like a typed answer.
 *
 * <p>Validation runs before the transcriber is called. A transcription failure propagates and
 * nothing is stored; a blank transcript is rejected rather than stored as an empty answer.
 */
@Service
public class SectionAudioSubmissionService {

    private static final Logger LOG = LogManager.getLogger(SectionAudioSubmissionService.class);

    private final SectionProgressTracker tracker;
    private final SpeechTranscriber transcriber;
    private final TranscriptionProperties properties;
    private final AnalysisMetrics metrics;

    public SectionAudioSubmissionService(SectionProgressTracker tracker,
                                         SpeechTranscriber transcriber,
                                         TranscriptionProperties properties,
                                         AnalysisMetrics metrics) {
        this.tracker = tracker;
        this.transcriber = transcriber;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Outcome of an audio submission: the transcript and the progress after storing it.
     */
    public record AudioSubmission(TranscriptionResult transcription, int timeSpentSeconds, ProgressSnapshot progress) {}

    /**
     * @param timeSpentSeconds recorded time; {@code null} to use the transcript duration
     */
    public AudioSubmission submit(long practiceId, int questionIndex, String sectionName,
                                  byte[] audio, String filename, String language, Integer timeSpentSeconds) {
        tracker.validateSection(practiceId, questionIndex, sectionName);
        validateAudio(audio);
        if (timeSpentSeconds != null && timeSpentSeconds < 0) {
            throw new InvalidTimeSpentException(timeSpentSeconds);
        }

        TranscriptionResult transcript;
        try {
            transcript = transcriber.transcribe(audio, filename, language);
        } catch (TranscriptionException e) {
            metrics.incrementTranscriptionFailure("error");
            LOG.warn("Transcription failed for question {} section {}: {}", questionIndex, sectionName, e.getMessage());
            throw e;
        }
        if (transcript.text().isBlank()) {
            metrics.incrementTranscriptionFailure("empty");
            throw new EmptyAnswerException(practiceId, questionIndex,
                    "Transcript for section '" + sectionName + "' is empty");
        }

        int seconds = timeSpentSeconds != null ? timeSpentSeconds : (int) Math.round(transcript.durationSeconds());
        ProgressSnapshot progress = tracker.submitSection(practiceId, questionIndex, sectionName,
                transcript.text(), seconds);
        return new AudioSubmission(transcript, seconds, progress);
    }

    private void validateAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new InvalidAudioException(0, "audio is empty");
        }
        if (audio.length > properties.getMaxAudioBytes()) {
            throw new InvalidAudioException(audio.length,
                    "audio exceeds the limit of " + properties.getMaxAudioBytes() + " bytes");
        }
    }
}
