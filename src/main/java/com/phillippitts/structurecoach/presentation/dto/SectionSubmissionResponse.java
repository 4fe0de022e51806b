package com.phillippitts.structurecoach.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.domain.TranscriptionResult;

/**
 * Result of storing one section answer. {@code transcript} is present only for audio
 * submissions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SectionSubmissionResponse(
        long practiceId,
        int questionIndex,
        String sectionName,
        int timeSpentSeconds,
        TranscriptView transcript,
        ProgressSnapshot progress
) {

    public record TranscriptView(String text, int wordCount, double durationSeconds, String model) {

        static TranscriptView of(TranscriptionResult result) {
            return new TranscriptView(result.text(), result.wordCount(), result.durationSeconds(),
                    result.modelIdentifier());
        }
    }

    public static SectionSubmissionResponse typed(long practiceId, int questionIndex, String sectionName,
                                                  int timeSpentSeconds, ProgressSnapshot progress) {
        return new SectionSubmissionResponse(practiceId, questionIndex, sectionName, timeSpentSeconds, null, progress);
    }

    public static SectionSubmissionResponse spoken(long practiceId, int questionIndex, String sectionName,
                                                   int timeSpentSeconds, TranscriptionResult transcript,
                                                   ProgressSnapshot progress) {
        return new SectionSubmissionResponse(practiceId, questionIndex, sectionName, timeSpentSeconds,
                TranscriptView.of(transcript), progress);
    }
}
