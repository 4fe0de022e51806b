package com.phillippitts.structurecoach.presentation.controller;

import com.phillippitts.structurecoach.domain.Report;
import com.phillippitts.structurecoach.service.report.ReportSynthesizer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Whole-interview reports. Posting regenerates and replaces the stored report.
 */
@RestController
@RequestMapping("/api/interviews/{interviewId}/report")
class ReportController {

    private final ReportSynthesizer synthesizer;

    ReportController(ReportSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    @PostMapping
    ResponseEntity<Report> generate(@PathVariable long interviewId) {
        return ResponseEntity.ok(synthesizer.synthesize(interviewId));
    }

    @GetMapping
    ResponseEntity<Report> get(@PathVariable long interviewId) {
        return ResponseEntity.ok(synthesizer.getReport(interviewId));
    }
}
