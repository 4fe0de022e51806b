package com.phillippitts.structurecoach.service.analysis;

import com.phillippitts.structurecoach.domain.Framework;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.domain.SectionQuality;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Per-section classification and the composite score.
 *
 * <p>Composite = coverage term + quality term, where coverage is
 * {@code submitted / total * 50} and quality is the average of
 * {@code good=100, partial=50, missing=0} over all framework sections, times {@code 50/100}.
 */
public final class CompositeScoreCalculator {

    private CompositeScoreCalculator() {}

    /**
     * Classifies every framework section. Unsubmitted sections are always missing; a
     * submitted section with no judgment counts as partial.
     */
    public static List<SectionJudgment> classify(Framework framework,
                                                 Map<String, Integer> submittedTimes,
                                                 Map<String, SectionQuality> judged) {
        List<SectionJudgment> out = new ArrayList<>(framework.totalSections());
        for (String section : framework.sections()) {
            Integer time = submittedTimes.get(section);
            if (time == null) {
                out.add(SectionJudgment.missing(section));
            } else {
                out.add(SectionJudgment.of(section, judged.getOrDefault(section, SectionQuality.PARTIAL), time));
            }
        }
        return out;
    }

    /**
     * {@code submitted / total * 50 + qualityAverage / 100 * 50}, unrounded.
     */
    public static double compositeScore(List<SectionJudgment> sections) {
        if (sections.isEmpty()) {
            return 0.0;
        }
        int total = sections.size();
        long submitted = sections.stream().filter(SectionJudgment::submitted).count();
        int qualitySum = sections.stream().mapToInt(s -> s.quality().score()).sum();

        double coverageTerm = submitted * 50.0 / total;
        double qualityTerm = qualitySum * 50.0 / (100.0 * total);
        return coverageTerm + qualityTerm;
    }

    /**
     * Headline shown with an analysis.
     */
    public static String progressMessage(double compositeScore) {
        if (compositeScore >= 80) {
            return "Excellent Structure!";
        }
        if (compositeScore >= 60) {
            return "Good Progress!";
        }
        if (compositeScore >= 40) {
            return "Keep Practicing!";
        }
        return "Just Getting Started";
    }
}
