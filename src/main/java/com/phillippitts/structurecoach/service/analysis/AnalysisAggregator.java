package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;

import java.util.Set;

/**
 * Runs several independent analysis dimensions over one answer and merges the outcome.
 */
public interface AnalysisAggregator {

    /**
     * Runs every requested kind concurrently, each bounded by its own timeout, and waits for
     * all of them to settle.
     *
     * <p>Never fails because a dimension failed or timed out; those are recorded in the
     * result.
     *
     * @throws com.phillippitts.structurecoach.exception.InvalidAnalysisRequestException if no kinds are requested
     * @throws com.phillippitts.structurecoach.exception.EmptyAnswerException if no sections were submitted
     */
    AggregateAnalysis aggregate(AnalysisContext context, Set<AnalysisKind> kinds);
}
