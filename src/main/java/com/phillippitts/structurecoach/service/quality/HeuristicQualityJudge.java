package com.phillippitts.structurecoach.service.quality;

import com.phillippitts.structurecoach.config.properties.AnalysisProperties;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionQuality;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic judge: a submitted section is {@code good} when it has at least the
 * configured number of words, otherwise {@code partial}.
 */
@Component
public class HeuristicQualityJudge implements QualityJudge {

    private final int goodWordThreshold;

    @Autowired
    public HeuristicQualityJudge(AnalysisProperties properties) {
        this(properties.getGoodSectionWordThreshold());
    }

    public HeuristicQualityJudge(int goodWordThreshold) {
        if (goodWordThreshold < 1) {
            throw new IllegalArgumentException("Word threshold must be >= 1, got: " + goodWordThreshold);
        }
        this.goodWordThreshold = goodWordThreshold;
    }

    @Override
    public QualityJudgment judge(QualityRequest request) {
        Map<String, SectionQuality> qualities = new LinkedHashMap<>();
        List<String> thin = new ArrayList<>();
        for (Map.Entry<String, String> e : request.sectionTexts().entrySet()) {
            boolean good = wordCount(e.getValue()) >= goodWordThreshold;
            qualities.put(e.getKey(), good ? SectionQuality.GOOD : SectionQuality.PARTIAL);
            if (!good) {
                thin.add(e.getKey());
            }
        }
        List<String> missing = request.framework().sections().stream()
                .filter(s -> !request.sectionTexts().containsKey(s))
                .toList();
        return new QualityJudgment(qualities, insight(thin, missing), QualitySource.HEURISTIC);
    }

    @Override
    public String name() {
        return "heuristic";
    }

    private String insight(List<String> thin, List<String> missing) {
        StringBuilder sb = new StringBuilder();
        if (!thin.isEmpty()) {
            sb.append("Expand ").append(String.join(", ", thin))
              .append(" with more specific detail (aim for at least ").append(goodWordThreshold).append(" words).");
        }
        if (!missing.isEmpty()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("Still missing: ").append(String.join(", ", missing)).append('.');
        }
        if (sb.length() == 0) {
            sb.append("Every section is covered with solid detail.");
        }
        return sb.toString();
    }

    static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
