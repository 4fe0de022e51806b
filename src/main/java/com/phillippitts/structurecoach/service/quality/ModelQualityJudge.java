package com.phillippitts.structurecoach.service.quality;

import com.phillippitts.structurecoach.config.properties.AnalysisProperties;
import com.phillippitts.structurecoach.config.properties.QualityProperties;
import com.phillippitts.structurecoach.domain.AnalysisKind;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import com.phillippitts.structurecoach.service.llm.ChatCompletionClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asks the generative-text collaborator to rate each submitted section
 * {@code good}/{@code partial}. Enabled with {@code quality.llm.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "quality.llm", name = "enabled", havingValue = "true")
public class ModelQualityJudge implements QualityJudge {

    static final String COLLABORATOR = "quality-model";

    private final ChatCompletionClient client;

    @Autowired
    public ModelQualityJudge(RestTemplateBuilder builder, QualityProperties properties,
                             AnalysisProperties analysisProperties) {
        // a request must not outlive the content_quality deadline
        this(new ChatCompletionClient(COLLABORATOR, builder, properties.getLlm(),
                analysisProperties.timeoutFor(AnalysisKind.CONTENT_QUALITY)));
    }

    ModelQualityJudge(ChatCompletionClient client) {
        this.client = client;
    }

    @Override
    public QualityJudgment judge(QualityRequest request) {
        JSONObject reply = client.completeJson(systemPrompt(request), userContent(request));

        JSONArray sections = reply.optJSONArray("sections");
        if (sections == null) {
            throw new CollaboratorUnavailableException(COLLABORATOR, "reply has no 'sections' array");
        }
        Map<String, SectionQuality> qualities = new LinkedHashMap<>();
        for (int i = 0; i < sections.length(); i++) {
            JSONObject s = sections.optJSONObject(i);
            if (s == null) {
                continue;
            }
            String name = s.optString("name", "");
            // only submitted sections can be judged; anything else stays missing
            if (request.sectionTexts().containsKey(name)) {
                qualities.put(name, SectionQuality.parse(s.optString("quality", null)));
            }
        }
        for (String submitted : request.sectionTexts().keySet()) {
            qualities.putIfAbsent(submitted, SectionQuality.PARTIAL);
        }
        return new QualityJudgment(qualities, reply.optString("key_insight", ""), QualitySource.MODEL);
    }

    @Override
    public String name() {
        return COLLABORATOR + ":" + client.model();
    }

    static String systemPrompt(QualityRequest request) {
        String framework = request.framework().name();
        StringBuilder sb = new StringBuilder()
                .append("You are an expert interview coach analyzing structured answers.\n")
                .append("Analyze the answer based on the ").append(framework).append(" framework with sections:\n");
        request.framework().sectionHints().forEach((section, hint) ->
                sb.append("- ").append(section).append(": ").append(hint).append('\n'));
        sb.append("The user submitted the answer section by section; each section is marked with [Section Name].\n")
          .append("Rate each SUBMITTED section:\n")
          .append("- \"good\": well-developed, clear, specific, addresses the section\n")
          .append("- \"partial\": present but underdeveloped, rushed or incomplete\n")
          .append("Sections that were not submitted are missing; do not rate them.\n")
          .append("Return ONLY JSON: {\"sections\":[{\"name\":\"...\",\"quality\":\"good|partial\"}],")
          .append("\"key_insight\":\"what was done well and what to improve\"}");
        return sb.toString();
    }

    static JSONObject userContent(QualityRequest request) {
        JSONObject submitted = new JSONObject();
        request.sectionTimes().forEach(submitted::put);
        return new JSONObject()
                .put("question", request.questionText())
                .put("framework", request.framework().name())
                .put("expected_sections", new JSONArray(request.framework().sections()))
                .put("submitted_sections_seconds", submitted)
                .put("answer", request.combinedText());
    }
}
