package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.SectionAnswer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.phillippitts.structurecoach.repository.JdbcSupport.instant;
import static com.phillippitts.structurecoach.repository.JdbcSupport.merge;
import static com.phillippitts.structurecoach.repository.JdbcSupport.storage;
import static com.phillippitts.structurecoach.repository.JdbcSupport.ts;

/**
 * H2-backed {@link SectionAnswerStore}. Upserts use {@code MERGE ... KEY} on the unique
 * {@code (practice_id, question_index, section_name)} constraint.
 */
@Repository
public class JdbcSectionAnswerStore implements SectionAnswerStore {

    private static final Logger LOG = LogManager.getLogger(JdbcSectionAnswerStore.class);

    private static final String COLUMNS =
            "id, practice_id, question_index, section_name, answer_text, time_spent_seconds, submitted_at";

    private static final RowMapper<SectionAnswer> ANSWER_MAPPER = (rs, rowNum) -> new SectionAnswer(
            rs.getLong(1), rs.getLong(2), rs.getInt(3), rs.getString(4), rs.getString(5),
            rs.getInt(6), instant(rs.getTimestamp(7)));

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcSectionAnswerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    @Override
    @Transactional
    public SectionAnswer upsert(long practiceId, int questionIndex, String sectionName,
                                String answerText, int timeSpentSeconds, Instant submittedAt) {
        return storage("upsert section answer", () -> {
            merge(jdbcTemplate,
                    "MERGE INTO section_answer(practice_id, question_index, section_name, answer_text, time_spent_seconds, submitted_at) "
                            + "KEY(practice_id, question_index, section_name) VALUES (?,?,?,?,?,?)",
                    practiceId, questionIndex, sectionName, answerText, timeSpentSeconds, ts(submittedAt));
            return jdbcTemplate.queryForObject(
                    "SELECT " + COLUMNS + " FROM section_answer WHERE practice_id=? AND question_index=? AND section_name=?",
                    ANSWER_MAPPER, practiceId, questionIndex, sectionName);
        });
    }

    @Override
    public List<SectionAnswer> findByQuestion(long practiceId, int questionIndex) {
        return storage("find section answers", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM section_answer WHERE practice_id=? AND question_index=? ORDER BY submitted_at, id",
                ANSWER_MAPPER, practiceId, questionIndex));
    }

    @Override
    @Transactional
    public long saveAnalysis(long practiceId, int questionIndex, AggregateAnalysis analysis) {
        return storage("save aggregate analysis", () -> {
            List<Long> latest = jdbcTemplate.queryForList(
                    "SELECT id FROM section_answer WHERE practice_id=? AND question_index=? ORDER BY submitted_at DESC, id DESC LIMIT 1",
                    Long.class, practiceId, questionIndex);
            if (latest.isEmpty()) {
                throw new IllegalStateException("No section answers to attach analysis to (practice "
                        + practiceId + ", question " + questionIndex + ")");
            }
            long answerId = latest.get(0);
            jdbcTemplate.update(
                    "UPDATE section_answer SET analysis_json=NULL, analyzed_at=NULL WHERE practice_id=? AND question_index=? AND id<>?",
                    practiceId, questionIndex, answerId);
            jdbcTemplate.update(
                    "UPDATE section_answer SET analysis_json=?, analyzed_at=? WHERE id=?",
                    AggregateAnalysisJson.toJson(analysis), ts(analysis.computedAt()), answerId);
            LOG.debug("Stored aggregate analysis on section answer {}", answerId);
            return answerId;
        });
    }

    @Override
    public Optional<AggregateAnalysis> findLatestAnalysis(long practiceId, int questionIndex) {
        return storage("find aggregate analysis", () -> jdbcTemplate.query(
                        "SELECT analysis_json FROM section_answer WHERE practice_id=? AND question_index=? "
                                + "AND analysis_json IS NOT NULL ORDER BY analyzed_at DESC, id DESC LIMIT 1",
                        (rs, rowNum) -> rs.getString(1), practiceId, questionIndex)
                .stream().findFirst().map(AggregateAnalysisJson::fromJson));
    }

    @Override
    public Map<Integer, AggregateAnalysis> findLatestAnalysesByQuestion(Collection<Long> practiceIds) {
        Map<Integer, AggregateAnalysis> latest = new HashMap<>();
        if (practiceIds.isEmpty()) {
            return latest;
        }
        List<Map.Entry<Integer, String>> rows = storage("find aggregate analyses", () -> namedJdbcTemplate.query(
                "SELECT question_index, analysis_json FROM section_answer WHERE practice_id IN (:ids) "
                        + "AND analysis_json IS NOT NULL ORDER BY analyzed_at, id",
                new MapSqlParameterSource("ids", practiceIds),
                (rs, rowNum) -> Map.entry(rs.getInt(1), rs.getString(2))));
        // ascending order: later rows overwrite earlier ones
        for (Map.Entry<Integer, String> row : rows) {
            latest.put(row.getKey(), AggregateAnalysisJson.fromJson(row.getValue()));
        }
        return latest;
    }
}
