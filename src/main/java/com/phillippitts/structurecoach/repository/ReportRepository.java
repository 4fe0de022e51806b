package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.Report;

import java.util.Optional;

/**
 * Storage for interview reports. At most one report exists per interview.
 */
public interface ReportRepository {

    /**
     * Inserts or atomically replaces the report for {@code report.interviewId()}.
     */
    Report upsert(Report report);

    Optional<Report> findByInterviewId(long interviewId);
}
