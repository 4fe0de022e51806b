package com.phillippitts.structurecoach.service.analysis.dimension;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.service.analysis.AnalysisContext;
import com.phillippitts.structurecoach.service.quality.HeuristicQualityJudge;
import com.phillippitts.structurecoach.service.quality.ModelQualityJudge;
import com.phillippitts.structurecoach.service.quality.QualityJudge;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-section quality from the model judge when one is configured, else from the heuristic
 * judge. A model failure fails this dimension; the aggregator then classifies sections with
 * the heuristic itself.
 */
@Component
public class ContentQualityDimension implements AnalysisDimension {

    static final String SECTIONS = "sections";
    static final String KEY_INSIGHT = "key_insight";
    static final String SOURCE = "source";
    static final String JUDGE = "judge";

    private final QualityJudge judge;

    @Autowired
    public ContentQualityDimension(ObjectProvider<ModelQualityJudge> modelJudge, HeuristicQualityJudge heuristicJudge) {
        this(select(modelJudge.getIfAvailable(), heuristicJudge));
    }

    public ContentQualityDimension(QualityJudge judge) {
        this.judge = judge;
    }

    private static QualityJudge select(QualityJudge model, QualityJudge heuristic) {
        return model != null ? model : heuristic;
    }

    public String judgeName() {
        return judge.name();
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.CONTENT_QUALITY;
    }

    @Override
    public Map<String, Object> analyze(AnalysisContext context) {
        QualityJudgment judgment = judge.judge(context.toQualityRequest());
        Map<String, Object> payload = toPayload(judgment);
        payload.put(JUDGE, judge.name());
        return payload;
    }

    public static Map<String, Object> toPayload(QualityJudgment judgment) {
        Map<String, Object> sections = new LinkedHashMap<>();
        judgment.sectionQuality().forEach((name, q) -> sections.put(name, q.wireName()));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SECTIONS, sections);
        payload.put(KEY_INSIGHT, judgment.keyInsight());
        payload.put(SOURCE, judgment.source().wireName());
        return payload;
    }

    /**
     * Reads back a payload produced by {@link #toPayload}.
     */
    public static QualityJudgment fromPayload(Map<String, Object> payload) {
        Map<String, SectionQuality> qualities = new LinkedHashMap<>();
        if (payload.get(SECTIONS) instanceof Map<?, ?> sections) {
            sections.forEach((k, v) -> qualities.put(String.valueOf(k), SectionQuality.parse(String.valueOf(v))));
        }
        Object source = payload.get(SOURCE);
        QualitySource qs = source == null ? QualitySource.MODEL : QualitySource.fromWireName(source.toString());
        Object insight = payload.get(KEY_INSIGHT);
        return new QualityJudgment(qualities, insight == null ? "" : insight.toString(), qs);
    }
}
