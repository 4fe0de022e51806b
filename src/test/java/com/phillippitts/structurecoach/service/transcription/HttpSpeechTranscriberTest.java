package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.config.properties.TranscriptionProperties;
import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSpeechTranscriberTest {

    private MockRestServiceServer server;
    private HttpSpeechTranscriber transcriber;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        TranscriptionProperties props = new TranscriptionProperties();
        props.setBaseUrl("http://stt.test/v1");
        props.setApiKey("k");
        transcriber = new HttpSpeechTranscriber(new RestTemplateBuilder(customizer), props);
        server = customizer.getServer();
    }

    @Test
    void shouldPostMultipartAndParseVerboseJson() {
        server.expect(requestTo("http://stt.test/v1/audio/transcriptions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer k"))
                .andRespond(withSuccess("{\"text\":\"I led the rollback.\",\"duration\":4.2}",
                        MediaType.APPLICATION_JSON));

        TranscriptionResult r = transcriber.transcribe(new byte[]{1, 2, 3}, "answer.webm", "en");

        assertThat(r.text()).isEqualTo("I led the rollback.");
        assertThat(r.durationSeconds()).isEqualTo(4.2);
        assertThat(r.modelIdentifier()).isEqualTo("whisper-1");
        assertThat(transcriber.name()).isEqualTo("http:whisper-1");
        server.verify();
    }

    @Test
    void shouldWrapTransportFailures() {
        server.expect(requestTo("http://stt.test/v1/audio/transcriptions")).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> transcriber.transcribe(new byte[]{1}, null, null))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageStartingWith("Transcription request failed")
                .extracting("modelIdentifier").isEqualTo("whisper-1");
    }

    @Test
    void disabledTranscriberAlwaysFails() {
        DisabledSpeechTranscriber disabled = new DisabledSpeechTranscriber();

        assertThat(disabled.isAvailable()).isFalse();
        assertThatThrownBy(() -> disabled.transcribe(new byte[]{1}, null, null))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("disabled");
    }
}
