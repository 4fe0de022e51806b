package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.domain.SectionStatus;
import com.phillippitts.structurecoach.service.framework.Frameworks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeScoreCalculatorTest {

    @Test
    void threeOfFiveSubmittedScores55() {
        List<SectionJudgment> sections = List.of(
                SectionJudgment.of("Goal", SectionQuality.GOOD, 30),
                SectionJudgment.of("Constraints", SectionQuality.GOOD, 30),
                SectionJudgment.of("Decision", SectionQuality.PARTIAL, 30),
                SectionJudgment.missing("Implementation"),
                SectionJudgment.missing("Outcome"));

        // coverage 3/5*50 = 30, quality (100+100+50)/5 = 50 -> 25
        assertThat(CompositeScoreCalculator.compositeScore(sections)).isEqualTo(55.0);
    }

    @Test
    void allGoodScores100AndNothingScoresZero() {
        List<SectionJudgment> all = Frameworks.star().sections().stream()
                .map(s -> SectionJudgment.of(s, SectionQuality.GOOD, 10)).toList();
        List<SectionJudgment> none = Frameworks.star().sections().stream()
                .map(SectionJudgment::missing).toList();

        assertThat(CompositeScoreCalculator.compositeScore(all)).isEqualTo(100.0);
        assertThat(CompositeScoreCalculator.compositeScore(none)).isEqualTo(0.0);
    }

    @Test
    void oneOfFourPartialReflectsQuarterCoverage() {
        List<SectionJudgment> sections = CompositeScoreCalculator.classify(Frameworks.star(),
                Map.of("Situation", 40), Map.of("Situation", SectionQuality.PARTIAL));

        assertThat(sections).extracting(SectionJudgment::status).containsExactly(
                SectionStatus.PARTIAL, SectionStatus.MISSING, SectionStatus.MISSING, SectionStatus.MISSING);
        // 12.5 coverage + 50/4/2 = 6.25 quality
        assertThat(CompositeScoreCalculator.compositeScore(sections)).isEqualTo(18.75);
    }

    @Test
    void unsubmittedSectionsAreMissingWhateverTheJudgeSays() {
        List<SectionJudgment> sections = CompositeScoreCalculator.classify(Frameworks.star(),
                Map.of("Task", 20), Map.of("Situation", SectionQuality.GOOD, "Task", SectionQuality.GOOD));

        assertThat(sections.get(0).quality()).isEqualTo(SectionQuality.MISSING);
        assertThat(sections.get(0).submitted()).isFalse();
        assertThat(sections.get(1).quality()).isEqualTo(SectionQuality.GOOD);
        assertThat(sections.get(1).timeSpentSeconds()).isEqualTo(20);
    }

    @Test
    void submittedSectionWithoutJudgmentCountsAsPartial() {
        List<SectionJudgment> sections = CompositeScoreCalculator.classify(Frameworks.star(),
                Map.of("Action", 15), Map.of());

        assertThat(sections.get(2).quality()).isEqualTo(SectionQuality.PARTIAL);
    }

    @Test
    void progressMessageThresholds() {
        assertThat(CompositeScoreCalculator.progressMessage(80)).isEqualTo("Excellent Structure!");
        assertThat(CompositeScoreCalculator.progressMessage(79.9)).isEqualTo("Good Progress!");
        assertThat(CompositeScoreCalculator.progressMessage(40)).isEqualTo("Keep Practicing!");
        assertThat(CompositeScoreCalculator.progressMessage(18.75)).isEqualTo("Just Getting Started");
    }
}
