package com.phillippitts.structurecoach.service.llm;

import com.phillippitts.structurecoach.config.properties.LlmClientProperties;
import com.phillippitts.structurecoach.exception.CollaboratorUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Minimal client for an OpenAI-compatible {@code /chat/completions} endpoint that asks for a
 * JSON object and returns it parsed.
 *
 * <p>Thread-safe. Every failure (transport, HTTP status, malformed JSON) surfaces as
 * {@link CollaboratorUnavailableException} so callers can fall back.
 *
 * <p>Requests go through the JDK {@link HttpClient}: interrupting the calling thread aborts
 * the exchange. Connect and read are each bounded by {@link #effectiveTimeout()}, which is
 * the configured timeout capped by the caller's deadline.
 */
public class ChatCompletionClient {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionClient.class);

    private final RestTemplate restTemplate;
    private final String collaborator;
    private final String url;
    private final String apiKey;
    private final String model;
    private final Duration effectiveTimeout;

    public ChatCompletionClient(String collaborator, RestTemplateBuilder builder, LlmClientProperties props) {
        this(collaborator, builder, props, props.getTimeout());
    }

    /**
     * @param deadline upper bound for one request; a shorter configured timeout wins
     */
    public ChatCompletionClient(String collaborator, RestTemplateBuilder builder, LlmClientProperties props,
                                Duration deadline) {
        this.collaborator = collaborator;
        Duration timeout = shorter(props.getTimeout(), deadline);
        if (timeout.compareTo(props.getTimeout()) < 0) {
            LOG.info("{} timeout capped at {} (configured {})", collaborator, timeout, props.getTimeout());
        }
        this.effectiveTimeout = timeout;
        this.restTemplate = builder
                .requestFactory(() -> requestFactory(timeout))
                .build();
        this.url = stripTrailingSlash(props.getBaseUrl()) + "/chat/completions";
        this.apiKey = props.getApiKey();
        this.model = props.getModel();
    }

    /**
     * Sends one system + user exchange and parses the reply content as a JSON object.
     */
    public JSONObject completeJson(String systemPrompt, JSONObject userContent) {
        JSONObject body = new JSONObject()
                .put("model", model)
                .put("temperature", 0.3)
                .put("response_format", new JSONObject().put("type", "json_object"))
                .put("messages", new JSONArray()
                        .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                        .put(new JSONObject().put("role", "user").put("content", userContent.toString())));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        long start = System.nanoTime();
        String raw;
        try {
            raw = restTemplate.postForObject(url, new HttpEntity<>(body.toString(), headers), String.class);
        } catch (RestClientException e) {
            throw new CollaboratorUnavailableException(collaborator, "request failed: " + e.getMessage(), e);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000L;
        if (raw == null || raw.isBlank()) {
            throw new CollaboratorUnavailableException(collaborator, "empty response");
        }
        try {
            String content = new JSONObject(raw)
                    .getJSONArray("choices")
                    .getJSONObject(0)
                    .getJSONObject("message")
                    .getString("content");
            LOG.debug("{} replied in {}ms (model={})", collaborator, latencyMs, model);
            return new JSONObject(content);
        } catch (JSONException e) {
            throw new CollaboratorUnavailableException(collaborator, "unparseable response: " + e.getMessage(), e);
        }
    }

    public String model() {
        return model;
    }

    public Duration effectiveTimeout() {
        return effectiveTimeout;
    }

    static Duration shorter(Duration configured, Duration deadline) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            return configured;
        }
        return deadline.compareTo(configured) < 0 ? deadline : configured;
    }

    private static JdkClientHttpRequestFactory requestFactory(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return factory;
    }

    static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
