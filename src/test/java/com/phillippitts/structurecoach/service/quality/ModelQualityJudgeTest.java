package com.phillippitts.structurecoach.service.quality;

import com.phillippitts.structurecoach.config.properties.LlmClientProperties;
import com.phillippitts.structurecoach.domain.QualityJudgment;
import com.phillippitts.structurecoach.domain.QualitySource;
import com.phillippitts.structurecoach.domain.SectionQuality;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import com.phillippitts.structurecoach.service.framework.Frameworks;
import com.phillippitts.structurecoach.service.llm.ChatCompletionClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ModelQualityJudgeTest {

    private MockRestServiceServer server;
    private ModelQualityJudge judge;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        LlmClientProperties props = new LlmClientProperties();
        props.setBaseUrl("http://llm.test/v1/");
        props.setApiKey("secret");
        props.setModel("gpt-test");
        ChatCompletionClient client = new ChatCompletionClient("quality-model", new RestTemplateBuilder(customizer), props);
        server = customizer.getServer();
        judge = new ModelQualityJudge(client);
    }

    private static QualityRequest twoSections() {
        Map<String, String> texts = new LinkedHashMap<>();
        texts.put("Situation", "Our payments service kept timing out during peak traffic.");
        texts.put("Task", "I owned the fix.");
        return new QualityRequest("Tell me about an outage", Frameworks.star(), texts,
                Map.of("Situation", 40, "Task", 10), "[Situation]\n...\n\n[Task]\n...");
    }

    private static String reply(JSONObject content) {
        return new JSONObject().put("choices", new JSONArray()
                .put(new JSONObject().put("message", new JSONObject().put("content", content.toString()))))
                .toString();
    }

    @Test
    void shouldParseSectionQualitiesAndIgnoreUnsubmittedSections() {
        JSONObject content = new JSONObject()
                .put("sections", new JSONArray()
                        .put(new JSONObject().put("name", "Situation").put("quality", "good"))
                        .put(new JSONObject().put("name", "Result").put("quality", "good")))
                .put("key_insight", "Clear context; expand on your responsibility.");
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("gpt-test"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andRespond(withSuccess(reply(content), MediaType.APPLICATION_JSON));

        QualityJudgment j = judge.judge(twoSections());

        assertThat(j.source()).isEqualTo(QualitySource.MODEL);
        assertThat(j.sectionQuality())
                .containsEntry("Situation", SectionQuality.GOOD)
                .containsEntry("Task", SectionQuality.PARTIAL)
                .doesNotContainKey("Result");
        assertThat(j.keyInsight()).startsWith("Clear context");
        assertThat(judge.name()).isEqualTo("quality-model:gpt-test");
        server.verify();
    }

    @Test
    void shouldSurfaceServerErrorsAsCollaboratorFailure() {
        server.expect(requestTo("http://llm.test/v1/chat/completions")).andRespond(withServerError());

        assertThatThrownBy(() -> judge.judge(twoSections()))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("quality-model");
    }

    @Test
    void shouldRejectReplyWithoutSections() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withSuccess(reply(new JSONObject().put("verdict", "fine")), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> judge.judge(twoSections()))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("sections");
    }

    @Test
    void shouldRejectNonJsonContent() {
        String raw = new JSONObject().put("choices", new JSONArray()
                .put(new JSONObject().put("message", new JSONObject().put("content", "Sure! Here you go"))))
                .toString();
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withSuccess(raw, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> judge.judge(twoSections()))
                .isInstanceOf(CollaboratorUnavailableException.class)
                .hasMessageContaining("unparseable");
    }

    @Test
    void promptListsEveryFrameworkSection() {
        String prompt = ModelQualityJudge.systemPrompt(twoSections());

        assertThat(prompt).contains("STAR").contains("- Situation:").contains("- Result:");
        assertThat(ModelQualityJudge.userContent(twoSections()).getJSONObject("submitted_sections_seconds").keySet())
                .containsExactlyInAnyOrder("Situation", "Task");
    }
}
