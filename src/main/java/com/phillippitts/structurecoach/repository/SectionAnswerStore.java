package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.SectionAnswer;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of one answer per {@code (practiceId, questionIndex, sectionName)}.
 *
 * <p>Writes are full replacements keyed on that triple (last write wins), so concurrent
 * resubmissions never need read-modify-write. Reads observe every write committed before
 * the read started.
 */
public interface SectionAnswerStore {

    /**
     * Inserts or replaces the answer for the key. A previously stored aggregate analysis on
     * the row is left untouched.
     *
     * @return the stored record
     */
    SectionAnswer upsert(long practiceId, int questionIndex, String sectionName,
                         String answerText, int timeSpentSeconds, Instant submittedAt);

    /**
     * All section answers of one question, ordered by submission time.
     */
    List<SectionAnswer> findByQuestion(long practiceId, int questionIndex);

    /**
     * Attaches the analysis to the most recently submitted section answer of the question,
     * removing any analysis previously stored on the question's other rows.
     *
     * @return id of the section answer the analysis was attached to
     * @throws IllegalStateException if the question has no section answers
     */
    long saveAnalysis(long practiceId, int questionIndex, AggregateAnalysis analysis);

    Optional<AggregateAnalysis> findLatestAnalysis(long practiceId, int questionIndex);

    /**
     * Latest aggregate analysis per question index across the given practice sessions.
     * When several sessions analyzed the same index, the most recently computed one wins.
     */
    Map<Integer, AggregateAnalysis> findLatestAnalysesByQuestion(Collection<Long> practiceIds);
}
