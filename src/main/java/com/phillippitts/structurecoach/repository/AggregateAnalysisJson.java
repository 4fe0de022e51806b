package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.AggregateAnalysis;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.AnalysisResult;
import com.phillippitts.structurecoach.domain.AnalysisStatus;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.domain.SectionStatus;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes an {@link AggregateAnalysis} as the single JSON document stored with a section answer.
 */
public final class AggregateAnalysisJson {

    private AggregateAnalysisJson() {}

    public static String toJson(AggregateAnalysis a) {
        JSONObject root = new JSONObject();
        JSONArray dims = new JSONArray();
        for (AnalysisResult r : a.perDimension()) {
            JSONObject d = new JSONObject();
            d.put("kind", r.kind().wireName());
            d.put("status", r.status().wireName());
            d.put("payload", new JSONObject(r.payload()));
            if (r.error() != null) {
                d.put("error", r.error());
            }
            d.put("latency_ms", r.latencyMs());
            dims.put(d);
        }
        root.put("per_dimension", dims);
        root.put("requested_kinds", kinds(a.requestedKinds()));
        root.put("succeeded_kinds", kinds(a.succeededKinds()));
        root.put("failed_kinds", kinds(a.failedKinds()));
        JSONArray sections = new JSONArray();
        for (SectionJudgment s : a.sections()) {
            JSONObject o = new JSONObject();
            o.put("name", s.sectionName());
            o.put("submitted", s.submitted());
            o.put("quality", s.quality().wireName());
            o.put("status", s.status().wireName());
            o.put("time_spent_seconds", s.timeSpentSeconds());
            sections.put(o);
        }
        root.put("sections", sections);
        root.put("quality_source", a.qualitySource().wireName());
        root.put("key_insight", a.keyInsight());
        root.put("composite_score", a.compositeScore());
        root.put("computed_at", a.computedAt().toString());
        return root.toString();
    }

    /**
     * @throws IllegalArgumentException if the document is not a valid encoded analysis
     */
    public static AggregateAnalysis fromJson(String json) {
        try {
            JSONObject root = new JSONObject(json);
            List<AnalysisResult> dims = new ArrayList<>();
            JSONArray arr = root.getJSONArray("per_dimension");
            for (int i = 0; i < arr.length(); i++) {
                JSONObject d = arr.getJSONObject(i);
                JSONObject payload = d.optJSONObject("payload");
                dims.add(new AnalysisResult(
                        AnalysisKind.fromWireName(d.getString("kind")),
                        AnalysisStatus.fromWireName(d.getString("status")),
                        payload == null ? null : payload.toMap(),
                        d.has("error") ? d.getString("error") : null,
                        d.optLong("latency_ms", 0L)));
            }
            List<SectionJudgment> sections = new ArrayList<>();
            JSONArray sArr = root.optJSONArray("sections");
            if (sArr != null) {
                for (int i = 0; i < sArr.length(); i++) {
                    JSONObject s = sArr.getJSONObject(i);
                    sections.add(new SectionJudgment(
                            s.getString("name"),
                            s.getBoolean("submitted"),
                            SectionQuality.parse(s.getString("quality")),
                            SectionStatus.fromWireName(s.getString("status")),
                            s.optInt("time_spent_seconds", 0)));
                }
            }
            return new AggregateAnalysis(
                    dims,
                    parseKinds(root.getJSONArray("requested_kinds")),
                    parseKinds(root.getJSONArray("succeeded_kinds")),
                    parseKinds(root.getJSONArray("failed_kinds")),
                    sections,
                    QualitySource.fromWireName(root.optString("quality_source", "heuristic")),
                    root.optString("key_insight", ""),
                    root.getDouble("composite_score"),
                    Instant.parse(root.getString("computed_at")));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed aggregate analysis document", e);
        }
    }

    private static JSONArray kinds(List<AnalysisKind> kinds) {
        JSONArray arr = new JSONArray();
        kinds.forEach(k -> arr.put(k.wireName()));
        return arr;
    }

    private static List<AnalysisKind> parseKinds(JSONArray arr) {
        List<AnalysisKind> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(AnalysisKind.fromWireName(arr.getString(i)));
        }
        return out;
    }
}
