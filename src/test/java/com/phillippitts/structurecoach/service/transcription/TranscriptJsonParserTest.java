package com.phillippitts.structurecoach.service.transcription;

import com.phillippitts.structurecoach.domain.TranscriptionResult;
import com.phillippitts.structurecoach.exception.TranscriptionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptJsonParserTest {

    @Test
    void readsTopLevelTextAndDuration() {
        TranscriptionResult r = TranscriptJsonParser.parse(
                "{\"text\":\" We migrated the cache. \",\"duration\":12.5}", "whisper-1", 40);

        assertThat(r.text()).isEqualTo("We migrated the cache.");
        assertThat(r.wordCount()).isEqualTo(4);
        assertThat(r.durationSeconds()).isEqualTo(12.5);
        assertThat(r.modelIdentifier()).isEqualTo("whisper-1");
        assertThat(r.latencyMs()).isEqualTo(40);
    }

    @Test
    void joinsSegmentsWhenTextIsAbsent() {
        TranscriptionResult r = TranscriptJsonParser.parse(
                "{\"segments\":[{\"text\":\" First part.\",\"end\":3.0},{\"text\":\"Second part.\",\"end\":7.25}]}",
                "whisper-1", 0);

        assertThat(r.text()).isEqualTo("First part. Second part.");
        assertThat(r.durationSeconds()).isEqualTo(7.25);
    }

    @Test
    void silenceYieldsEmptyText() {
        TranscriptionResult r = TranscriptJsonParser.parse("{\"text\":\"\",\"duration\":2}", "whisper-1", 0);

        assertThat(r.text()).isEmpty();
        assertThat(r.wordCount()).isZero();
    }

    @Test
    void rejectsMalformedOrEmptyResponses() {
        assertThatThrownBy(() -> TranscriptJsonParser.parse("not json", "whisper-1", 0))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> TranscriptJsonParser.parse("  ", "whisper-1", 0))
                .isInstanceOf(TranscriptionException.class);
    }
}
