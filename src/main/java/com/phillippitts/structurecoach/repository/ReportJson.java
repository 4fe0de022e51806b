package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.domain.OverallFeedback;
import com.phillippitts.structurecoach.domain.QuestionFeedback;
import com.phillippitts.structurecoach.domain.ScoreBand;
import com.phillippitts.structurecoach.domain.ScoreSummary;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON columns of the report table.
 */
final class ReportJson {

    private ReportJson() {}

    static String scoreSummary(ScoreSummary s) {
        JSONObject o = new JSONObject();
        o.put("knowledge_competence", band(s.knowledgeCompetence()));
        o.put("speech_and_structure", band(s.speechAndStructure()));
        o.put("source", s.source());
        return o.toString();
    }

    static ScoreSummary scoreSummary(String json) {
        JSONObject o = new JSONObject(json);
        return new ScoreSummary(
                band(o.getJSONObject("knowledge_competence")),
                band(o.getJSONObject("speech_and_structure")),
                o.getString("source"));
    }

    static String overallFeedback(OverallFeedback f) {
        JSONObject o = new JSONObject();
        o.put("strengths", new JSONArray(f.strengths()));
        o.put("areas_of_improvement", new JSONArray(f.areasOfImprovement()));
        o.put("actionable_steps", new JSONArray(f.actionableSteps()));
        return o.toString();
    }

    static OverallFeedback overallFeedback(String json) {
        JSONObject o = new JSONObject(json);
        return new OverallFeedback(
                strings(o.optJSONArray("strengths")),
                strings(o.optJSONArray("areas_of_improvement")),
                strings(o.optJSONArray("actionable_steps")));
    }

    static String perQuestion(List<QuestionFeedback> items) {
        JSONArray arr = new JSONArray();
        for (QuestionFeedback q : items) {
            if (q == null) {
                arr.put(JSONObject.NULL);
                continue;
            }
            JSONObject o = new JSONObject();
            o.put("question_index", q.questionIndex());
            o.put("question_text", q.questionText());
            o.put("composite_score", q.compositeScore());
            o.put("strengths", new JSONArray(q.strengths()));
            o.put("areas_of_improvement", new JSONArray(q.areasOfImprovement()));
            arr.put(o);
        }
        return arr.toString();
    }

    static List<QuestionFeedback> perQuestion(String json) {
        JSONArray arr = new JSONArray(json);
        List<QuestionFeedback> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject o = arr.optJSONObject(i);
            if (o == null) {
                out.add(null);
                continue;
            }
            out.add(new QuestionFeedback(
                    o.getInt("question_index"),
                    o.getString("question_text"),
                    o.getDouble("composite_score"),
                    strings(o.optJSONArray("strengths")),
                    strings(o.optJSONArray("areas_of_improvement"))));
        }
        return out;
    }

    private static JSONObject band(ScoreBand b) {
        JSONObject o = new JSONObject();
        o.put("score", b.score());
        o.put("max_score", b.maxScore());
        o.put("average", b.average());
        o.put("max_average", b.maxAverage());
        o.put("percentage", b.percentage());
        JSONArray criteria = new JSONArray();
        b.criteria().forEach((name, points) -> criteria.put(new JSONObject().put("name", name).put("points", points)));
        o.put("criteria", criteria);
        return o;
    }

    private static ScoreBand band(JSONObject o) {
        Map<String, Integer> criteria = new LinkedHashMap<>();
        // stored as an array to keep criterion order
        JSONArray c = o.optJSONArray("criteria");
        if (c != null) {
            for (int i = 0; i < c.length(); i++) {
                JSONObject item = c.getJSONObject(i);
                criteria.put(item.getString("name"), item.getInt("points"));
            }
        }
        return new ScoreBand(
                o.getInt("score"),
                o.getInt("max_score"),
                o.getDouble("average"),
                o.getDouble("max_average"),
                o.getInt("percentage"),
                criteria);
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                out.add(arr.getString(i));
            }
        }
        return out;
    }
}
