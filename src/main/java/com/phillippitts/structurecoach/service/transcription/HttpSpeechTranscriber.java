package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.config.properties.TranscriptionProperties;
import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Transcribes section audio through an OpenAI-compatible {@code /audio/transcriptions}
 * endpoint, requesting {@code verbose_json} so the clip duration comes back with the text.
 */
@Component
@ConditionalOnProperty(prefix = "transcription", name = "enabled", havingValue = "true")
public class HttpSpeechTranscriber implements SpeechTranscriber {

    private static final Logger LOG = LogManager.getLogger(HttpSpeechTranscriber.class);

    private final RestTemplate restTemplate;
    private final String url;
    private final String apiKey;
    private final String model;

    public HttpSpeechTranscriber(RestTemplateBuilder builder, TranscriptionProperties props) {
        this.restTemplate = builder
                .setConnectTimeout(props.getTimeout())
                .setReadTimeout(props.getTimeout())
                .build();
        String base = props.getBaseUrl();
        this.url = (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/audio/transcriptions";
        this.apiKey = props.getApiKey();
        this.model = props.getModel();
    }

    @Override
    public TranscriptionResult transcribe(byte[] audio, String filename, String language) {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return filename == null || filename.isBlank() ? "section.webm" : filename;
            }
        });
        form.add("model", model);
        form.add("response_format", "verbose_json");
        if (language != null && !language.isBlank()) {
            form.add("language", language);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        long start = System.nanoTime();
        String raw;
        try {
            raw = restTemplate.postForObject(url, new HttpEntity<>(form, headers), String.class);
        } catch (RestClientException e) {
            throw new TranscriptionException("Transcription request failed: " + e.getMessage(), model, e);
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000L;

        TranscriptionResult result = TranscriptJsonParser.parse(raw, model, latencyMs);
        LOG.debug("Transcribed {} bytes in {}ms: {} words, {}s", audio.length, latencyMs,
                result.wordCount(), result.durationSeconds());
        return result;
    }

    @Override
    public String name() {
        return "http:" + model;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
