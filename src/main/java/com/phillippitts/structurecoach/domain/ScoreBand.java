package com.phillippitts.structurecoach.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scored band of a report (knowledge/content or speech/structure).
 *
 * @param score       total points after the attempt penalty
 * @param maxScore    maximum points (25 or 20)
 * @param average     score divided by the number of criteria
 * @param maxAverage  maximum per-criterion average (5.0)
 * @param percentage  {@code score / maxScore * 100}, truncated
 * @param criteria    per-criterion points, summing to {@code score}
 */
public record ScoreBand(
        int score,
        int maxScore,
        double average,
        double maxAverage,
        int percentage,
        Map<String, Integer> criteria
) {

    public ScoreBand {
        if (score < 0 || score > maxScore) {
            throw new IllegalArgumentException("Score must be between 0 and " + maxScore + ", got: " + score);
        }
        criteria = Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
    }
}
