/**
 * Concurrent analysis of a (possibly partial) section-structured answer.
 *
 * <p>{@link com.phillippitts.structurecoach.service.analysis.ConcurrentAnalysisAggregator}
 * fans out one task per requested dimension and joins them with per-kind deadlines;
 * {@link com.phillippitts.structurecoach.service.analysis.CompositeScoreCalculator} blends
 * section coverage and section quality into the composite score.
 */
package com.phillippitts.structurecoach.service.analysis;
