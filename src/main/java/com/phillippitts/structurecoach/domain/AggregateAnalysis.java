package com.phillippitts.structurecoach.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merged result of all requested analysis dimensions over one combined answer.
 *
 * <p>{@code perDimension} always holds exactly one entry per requested kind, whatever its
 * status. {@code failedKinds} includes timed-out kinds.
 *
 * @param perDimension     one entry per requested kind, in request order
 * @param requestedKinds   kinds that were requested
 * @param succeededKinds   kinds with status ok
 * @param failedKinds      kinds with status failed or timeout
 * @param sections         per-section judgments in framework order
 * @param qualitySource    where the section judgments came from
 * @param keyInsight       short free-text insight
 * @param compositeScore   0-100 blend of section coverage and quality
 * @param computedAt       when the aggregate was composed
 */
public record AggregateAnalysis(
        List<AnalysisResult> perDimension,
        List<AnalysisKind> requestedKinds,
        List<AnalysisKind> succeededKinds,
        List<AnalysisKind> failedKinds,
        List<SectionJudgment> sections,
        QualitySource qualitySource,
        String keyInsight,
        double compositeScore,
        Instant computedAt
) {

    public AggregateAnalysis {
        perDimension = List.copyOf(perDimension);
        requestedKinds = List.copyOf(requestedKinds);
        succeededKinds = List.copyOf(succeededKinds);
        failedKinds = List.copyOf(failedKinds);
        sections = List.copyOf(sections);
        Objects.requireNonNull(qualitySource, "Quality source must not be null");
        keyInsight = keyInsight == null ? "" : keyInsight;
        if (compositeScore < 0.0 || compositeScore > 100.0) {
            throw new IllegalArgumentException("Composite score must be between 0 and 100, got: " + compositeScore);
        }
        Objects.requireNonNull(computedAt, "Computed-at must not be null");
    }

    public Optional<AnalysisResult> result(AnalysisKind kind) {
        return perDimension.stream().filter(r -> r.kind() == kind).findFirst();
    }

    public boolean partialFailure() {
        return !failedKinds.isEmpty() && !succeededKinds.isEmpty();
    }
}
