package com.phillippitts.structurecoach.presentation.controller;

import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.ProgressSnapshot;
import com.phillippitts.structurecoach.exception.InvalidAudioException;
import com.phillippitts.structurecoach.presentation.dto.AnalysisResponse;
import com.phillippitts.structurecoach.presentation.dto.AnalyzeRequest;
import com.phillippitts.structurecoach.presentation.dto.CreatePracticeRequest;
import com.phillippitts.structurecoach.presentation.dto.PracticeResponse;
import com.phillippitts.structurecoach.presentation.dto.SectionSubmissionResponse;
import com.phillippitts.structurecoach.presentation.dto.SubmitSectionRequest;
import com.phillippitts.structurecoach.service.analysis.StructureAnalysis;
import com.phillippitts.structurecoach.service.analysis.StructureAnalysisService;
import com.phillippitts.structurecoach.service.practice.PracticeService;
import com.phillippitts.structurecoach.service.progress.SectionProgressTracker;
import com.phillippitts.structurecoach.service.transcription.SectionAudioSubmissionService;
import com.phillippitts.structurecoach.service.transcription.SectionAudioSubmissionService.AudioSubmission;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Practice sessions: creation, section submission (typed or spoken), progress and analysis.
 */
@RestController
@RequestMapping("/api/practices")
class PracticeController {

    private static final Logger LOG = LogManager.getLogger(PracticeController.class);

    private final PracticeService practiceService;
    private final SectionProgressTracker tracker;
    private final SectionAudioSubmissionService audioSubmissionService;
    private final StructureAnalysisService analysisService;

    PracticeController(PracticeService practiceService,
                       SectionProgressTracker tracker,
                       SectionAudioSubmissionService audioSubmissionService,
                       StructureAnalysisService analysisService) {
        this.practiceService = practiceService;
        this.tracker = tracker;
        this.audioSubmissionService = audioSubmissionService;
        this.analysisService = analysisService;
    }

    @PostMapping
    ResponseEntity<PracticeResponse> create(@Valid @RequestBody CreatePracticeRequest request) {
        PracticeSession practice = practiceService.createPractice(
                request.interviewId(), request.track(), request.questionSpecs());
        return ResponseEntity.status(HttpStatus.CREATED).body(PracticeResponse.from(practice, List.of()));
    }

    @GetMapping("/{practiceId}")
    ResponseEntity<PracticeResponse> get(@PathVariable long practiceId) {
        PracticeService.PracticeOverview overview = practiceService.getPractice(practiceId);
        return ResponseEntity.ok(PracticeResponse.from(overview.practice(), overview.progress()));
    }

    @PostMapping("/{practiceId}/questions/{questionIndex}/sections")
    ResponseEntity<SectionSubmissionResponse> submitSection(@PathVariable long practiceId,
                                                            @PathVariable int questionIndex,
                                                            @Valid @RequestBody SubmitSectionRequest request) {
        ProgressSnapshot progress = tracker.submitSection(practiceId, questionIndex,
                request.sectionName(), request.answerText(), request.timeSpentSeconds());
        return ResponseEntity.ok(SectionSubmissionResponse.typed(practiceId, questionIndex,
                request.sectionName(), request.timeSpentSeconds(), progress));
    }

    @PostMapping(path = "/{practiceId}/questions/{questionIndex}/sections/audio",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<SectionSubmissionResponse> submitSectionAudio(
            @PathVariable long practiceId,
            @PathVariable int questionIndex,
            @RequestParam("section_name") String sectionName,
            @RequestPart("audio") MultipartFile audio,
            @RequestParam(value = "language", required = false) String language,
            @RequestParam(value = "time_spent_seconds", required = false) Integer timeSpentSeconds) {
        byte[] bytes;
        try {
            bytes = audio.getBytes();
        } catch (IOException e) {
            LOG.warn("Could not read uploaded audio for practice {} question {}", practiceId, questionIndex, e);
            throw new InvalidAudioException(audio.getSize(), "upload could not be read");
        }
        AudioSubmission submission = audioSubmissionService.submit(practiceId, questionIndex, sectionName,
                bytes, audio.getOriginalFilename(), language, timeSpentSeconds);
        return ResponseEntity.ok(SectionSubmissionResponse.spoken(practiceId, questionIndex, sectionName,
                submission.timeSpentSeconds(), submission.transcription(), submission.progress()));
    }

    @GetMapping("/{practiceId}/questions/{questionIndex}/progress")
    ResponseEntity<ProgressSnapshot> progress(@PathVariable long practiceId, @PathVariable int questionIndex) {
        return ResponseEntity.ok(tracker.getSnapshot(practiceId, questionIndex));
    }

    @PostMapping("/{practiceId}/questions/{questionIndex}/analysis")
    ResponseEntity<AnalysisResponse> analyze(@PathVariable long practiceId,
                                             @PathVariable int questionIndex,
                                             @RequestBody(required = false) AnalyzeRequest request) {
        List<String> kinds = request == null ? null : request.analysisTypes();
        StructureAnalysis result = analysisService.analyze(practiceId, questionIndex, kinds);
        return ResponseEntity.ok(AnalysisResponse.from(result));
    }
}
