package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.service.analysis.AnalysisContext;

import java.util.Map;

/**
 * One independent analysis capability run against a combined answer.
 *
 * <p>Implementations must be stateless and thread-safe: the aggregator runs every requested
 * dimension concurrently against the same context. Long-running implementations should
 * respond to thread interruption, which is how a timed-out dimension is cancelled.
 */
public interface AnalysisDimension {

    AnalysisKind kind();

    /**
     * @return structured payload for this dimension; never {@code null}
     * @throws RuntimeException on any failure, recorded by the aggregator as {@code failed}
     */
    Map<String, Object> analyze(AnalysisContext context);
}
