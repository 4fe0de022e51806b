package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.Interview;
import com.phillippitts.structurecoach.domain.PracticeQuestion;
import com.phillippitts.structurecoach.domain.PracticeSession;
import com.phillippitts.structurecoach.domain.PracticeStatus;
import com.phillippitts.structurecoach.domain.QuestionSpec;
import com.phillippitts.structurecoach.service.framework.FrameworkRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.phillippitts.structurecoach.repository.JdbcSupport.instant;
import static com.phillippitts.structurecoach.repository.JdbcSupport.storage;
import static com.phillippitts.structurecoach.repository.JdbcSupport.ts;

@Repository
public class JdbcPracticeRepository implements PracticeRepository {

    private final JdbcTemplate jdbcTemplate;
    private final FrameworkRegistry frameworkRegistry;

    public JdbcPracticeRepository(JdbcTemplate jdbcTemplate, FrameworkRegistry frameworkRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.frameworkRegistry = frameworkRegistry;
    }

    @Override
    @Transactional
    public Interview createInterview(String track, List<QuestionSpec> questions) {
        return storage("create interview", () -> {
            long id = insertReturningId(
                    "INSERT INTO interview(track, created_at) VALUES (?, ?)",
                    track, ts(Instant.now()));
            for (int i = 0; i < questions.size(); i++) {
                QuestionSpec q = questions.get(i);
                jdbcTemplate.update(
                        "INSERT INTO interview_question(interview_id, question_index, text, structure_hint) VALUES (?,?,?,?)",
                        id, i, q.text(), q.structureHint());
            }
            return new Interview(id, track, questions);
        });
    }

    @Override
    public Optional<Interview> findInterview(long interviewId) {
        return storage("find interview", () -> {
            List<String> tracks = jdbcTemplate.query(
                    "SELECT track FROM interview WHERE id=?",
                    (rs, rowNum) -> rs.getString(1), interviewId);
            if (tracks.isEmpty()) {
                return Optional.empty();
            }
            List<QuestionSpec> questions = jdbcTemplate.query(
                    "SELECT text, structure_hint FROM interview_question WHERE interview_id=? ORDER BY question_index",
                    (rs, rowNum) -> new QuestionSpec(rs.getString(1), rs.getString(2)), interviewId);
            return Optional.of(new Interview(interviewId, tracks.get(0), questions));
        });
    }

    @Override
    @Transactional
    public PracticeSession createPractice(long interviewId, String track, List<PracticeQuestionDraft> questions) {
        return storage("create practice", () -> {
            Instant now = Instant.now();
            long id = insertReturningId(
                    "INSERT INTO practice_session(interview_id, track, status, created_at, updated_at) VALUES (?,?,?,?,?)",
                    interviewId, track, PracticeStatus.ACTIVE.wireName(), ts(now), ts(now));
            for (int i = 0; i < questions.size(); i++) {
                PracticeQuestionDraft q = questions.get(i);
                jdbcTemplate.update(
                        "INSERT INTO practice_question(practice_id, question_index, text, structure_hint, framework) VALUES (?,?,?,?,?)",
                        id, i, q.text(), q.structureHint(), q.frameworkName());
            }
            return findPractice(id).orElseThrow(() -> new IllegalStateException("Practice vanished after insert: " + id));
        });
    }

    @Override
    public Optional<PracticeSession> findPractice(long practiceId) {
        return storage("find practice", () -> {
            List<PracticeSession> rows = jdbcTemplate.query(
                    "SELECT id, interview_id, track, status, created_at FROM practice_session WHERE id=?",
                    (rs, rowNum) -> new PracticeSession(
                            rs.getLong(1), rs.getLong(2), rs.getString(3),
                            PracticeStatus.fromWireName(rs.getString(4)),
                            loadQuestions(rs.getLong(1)),
                            instant(rs.getTimestamp(5))),
                    practiceId);
            return rows.stream().findFirst();
        });
    }

    @Override
    public List<PracticeSession> findPracticesByInterview(long interviewId) {
        return storage("find practices by interview", () -> {
            List<Long> ids = jdbcTemplate.queryForList(
                    "SELECT id FROM practice_session WHERE interview_id=? ORDER BY created_at, id",
                    Long.class, interviewId);
            return ids.stream().map(this::findPractice).flatMap(Optional::stream).toList();
        });
    }

    @Override
    public void updateStatus(long practiceId, PracticeStatus status) {
        storage("update practice status", () -> jdbcTemplate.update(
                "UPDATE practice_session SET status=?, updated_at=? WHERE id=?",
                status.wireName(), ts(Instant.now()), practiceId));
    }

    private List<PracticeQuestion> loadQuestions(long practiceId) {
        return jdbcTemplate.query(
                "SELECT question_index, text, structure_hint, framework FROM practice_question WHERE practice_id=? ORDER BY question_index",
                (rs, rowNum) -> new PracticeQuestion(
                        practiceId, rs.getInt(1), rs.getString(2), rs.getString(3),
                        resolveFramework(rs.getString(4))),
                practiceId);
    }

    private Framework resolveFramework(String name) {
        return frameworkRegistry.find(name).orElseThrow(() ->
                new IllegalStateException("Stored framework is no longer registered: " + name));
    }

    private long insertReturningId(String sql, Object... args) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps;
        }, keys);
        Number key = Objects.requireNonNull(keys.getKey(), "generated key");
        return key.longValue();
    }
}
