package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.Report;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static com.phillippitts.structurecoach.repository.JdbcSupport.instant;
import static com.phillippitts.structurecoach.repository.JdbcSupport.merge;
import static com.phillippitts.structurecoach.repository.JdbcSupport.storage;
import static com.phillippitts.structurecoach.repository.JdbcSupport.ts;

/**
 * H2-backed {@link ReportRepository}. The unique key on {@code interview_id} plus
 * {@code MERGE ... KEY} makes concurrent upserts for one interview converge on one row.
 */
@Repository
public class JdbcReportRepository implements ReportRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcReportRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Report upsert(Report report) {
        storage("upsert report", () -> merge(jdbcTemplate,
                "MERGE INTO report(report_id, interview_id, score_summary, overall_feedback, per_question_feedback, created_at) "
                        + "KEY(interview_id) VALUES (?,?,?,?,?,?)",
                report.reportId(),
                report.interviewId(),
                ReportJson.scoreSummary(report.scoreSummary()),
                ReportJson.overallFeedback(report.overallFeedback()),
                ReportJson.perQuestion(report.perQuestionFeedback()),
                ts(report.createdAt())));
        return report;
    }

    @Override
    public Optional<Report> findByInterviewId(long interviewId) {
        return storage("find report", () -> jdbcTemplate.query(
                "SELECT report_id, interview_id, score_summary, overall_feedback, per_question_feedback, created_at "
                        + "FROM report WHERE interview_id=?",
                (rs, rowNum) -> new Report(
                        rs.getString(1),
                        rs.getLong(2),
                        ReportJson.scoreSummary(rs.getString(3)),
                        ReportJson.overallFeedback(rs.getString(4)),
                        ReportJson.perQuestion(rs.getString(5)),
                        instant(rs.getTimestamp(6))),
                interviewId).stream().findFirst());
    }
}
