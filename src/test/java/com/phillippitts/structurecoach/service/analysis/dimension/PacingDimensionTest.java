package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.service.framework.Frameworks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phillippitts.structurecoach.service.analysis.AnalysisTestData.context;
import static com.phillippitts.structurecoach.service.analysis.AnalysisTestData.words;
import static org.assertj.core.api.Assertions.assertThat;

class PacingDimensionTest {

    private final PacingDimension dimension = new PacingDimension();

    @Test
    void categorizesWordsPerMinute() {
        assertThat(PacingDimension.categorize(90)).isEqualTo("too_slow");
        assertThat(PacingDimension.categorize(105)).isEqualTo("ideal");
        assertThat(PacingDimension.categorize(170)).isEqualTo("ideal");
        assertThat(PacingDimension.categorize(171)).isEqualTo("too_fast");
    }

    @Test
    void recommendedPaceWithAllIdealTimeScoresFive() {
        assertThat(PacingDimension.score(135, 100)).isEqualTo(5.0);
    }

    @Test
    void deviationFromRecommendedRangeLowersScore() {
        // consistency 0, accuracy 40 - 2*30 clamps to 0
        assertThat(PacingDimension.score(180, 0)).isEqualTo(0.0);
        // consistency 60, accuracy 40 - 2*10 = 20
        assertThat(PacingDimension.score(110, 100)).isEqualTo(4.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void measuresPacePerSectionAndOverall() {
        // 60 words in 30s = 120 wpm; 30 words in 30s = 60 wpm
        Map<String, Object> payload = dimension.analyze(context(Frameworks.star(),
                "Situation", words(60), "30",
                "Task", words(30), "30"));

        assertThat(payload.get("measurable")).isEqualTo(true);
        assertThat(payload.get("avg_wpm")).isEqualTo(90.0);
        assertThat(payload.get("category")).isEqualTo("too_slow");
        assertThat(payload.get("ideal_pct")).isEqualTo(50.0);
        assertThat(payload.get("too_slow_pct")).isEqualTo(50.0);
        List<Map<String, Object>> perSection = (List<Map<String, Object>>) payload.get("per_section");
        assertThat(perSection).extracting(m -> m.get("section")).containsExactly("Situation", "Task");
        assertThat(perSection).extracting(m -> m.get("category")).containsExactly("ideal", "too_slow");
        assertThat((String) payload.get("feedback")).contains("speak a little faster");
    }

    @Test
    void zeroRecordedTimeIsNotMeasurable() {
        Map<String, Object> payload = dimension.analyze(context(Frameworks.star(), "Situation", words(40), "0"));

        assertThat(payload.get("measurable")).isEqualTo(false);
        assertThat(payload).doesNotContainKey("score");
    }
}
