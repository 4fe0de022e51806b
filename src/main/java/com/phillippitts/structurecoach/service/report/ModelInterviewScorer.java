package com.phillippitts.structurecoach.service.report;

import com.phillippitts.structurecoach.config.properties.QualityProperties;
import com.phillippitts.structurecoach.domain.QuestionAttempt;
import com.phillippitts.structurecoach.domain.SectionJudgment;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import com.phillippitts.structurecoach.service.llm.ChatCompletionClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the generative-text collaborator for per-question criterion levels. Enabled together
 * with the model quality judge ({@code quality.llm.enabled=true}).
 */
@Component
@ConditionalOnProperty(prefix = "quality.llm", name = "enabled", havingValue = "true")
public class ModelInterviewScorer implements InterviewScorer {

    static final String COLLABORATOR = "interview-scorer";

    private static final String SYSTEM_PROMPT =
            "You are an expert interview assessor. For each answered question, rate the candidate "
            + "from 0 to 5 on knowledge criteria (accuracy, depth, relevance, examples, terminology) "
            + "and on speech criteria (fluency, structure, pacing, grammar). Base the ratings on the "
            + "per-section statuses, composite score and insight provided.\n"
            + "Return ONLY JSON: {\"scores\":[{\"question_index\":0,"
            + "\"knowledge\":{\"accuracy\":0,\"depth\":0,\"relevance\":0,\"examples\":0,\"terminology\":0},"
            + "\"speech\":{\"fluency\":0,\"structure\":0,\"pacing\":0,\"grammar\":0}}]}";

    private final ChatCompletionClient client;

    @Autowired
    public ModelInterviewScorer(RestTemplateBuilder builder, QualityProperties properties) {
        this(new ChatCompletionClient(COLLABORATOR, builder, properties.getLlm()));
    }

    ModelInterviewScorer(ChatCompletionClient client) {
        this.client = client;
    }

    @Override
    public List<QuestionScores> score(List<QuestionAttempt> attempted) {
        JSONArray questions = new JSONArray();
        for (QuestionAttempt a : attempted) {
            JSONObject sections = new JSONObject();
            for (SectionJudgment s : a.analysis().sections()) {
                sections.put(s.sectionName(), s.status().wireName());
            }
            questions.put(new JSONObject()
                    .put("question_index", a.questionIndex())
                    .put("question", a.questionText())
                    .put("framework", a.framework())
                    .put("composite_score", a.analysis().compositeScore())
                    .put("sections", sections)
                    .put("key_insight", a.analysis().keyInsight()));
        }

        JSONObject reply = client.completeJson(SYSTEM_PROMPT, new JSONObject().put("questions", questions));
        JSONArray scores = reply.optJSONArray("scores");
        if (scores == null) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "reply has no 'scores' array");
        }

        Map<Integer, QuestionScores> byIndex = new LinkedHashMap<>();
        for (int i = 0; i < scores.length(); i++) {
            JSONObject s = scores.optJSONObject(i);
            if (s == null || !s.has("question_index")) {
                continue;
            }
            int index = s.optInt("question_index");
            byIndex.put(index, new QuestionScores(index,
                    levels(s.optJSONObject("knowledge"), QuestionScores.KNOWLEDGE_CRITERIA),
                    levels(s.optJSONObject("speech"), QuestionScores.SPEECH_CRITERIA)));
        }

        List<QuestionScores> out = new ArrayList<>(attempted.size());
        for (QuestionAttempt a : attempted) {
            QuestionScores qs = byIndex.get(a.questionIndex());
            if (qs == null) {
                throw new CollaboratorUnavailableException(COLLABORATOR,
                        "no scores returned for question " + a.questionIndex());
            }
            out.add(qs);
        }
        return out;
    }

    @Override
    public String source() {
        return "scorer";
    }

    private static Map<String, Integer> levels(JSONObject obj, List<String> criteria) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (obj != null) {
            criteria.forEach(c -> out.put(c, obj.optInt(c, 0)));
        }
        return out;
    }
}
