package com.phillippitts.structurecoach.config.properties;

import com.phillippitts.structurecoach.domain.AnalysisKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the analysis aggregator.
 *
 * <p>Example:
 * <pre>
 * analysis.default-timeout=20s
 * analysis.timeouts.content-quality=45s
 * analysis.good-section-word-threshold=25
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    @NotNull
    private Duration defaultTimeout = Duration.ofSeconds(20);

    /** Per-kind overrides of {@link #defaultTimeout}. */
    private Map<AnalysisKind, Duration> timeouts = new EnumMap<>(AnalysisKind.class);

    /** Heuristic judge: sections with at least this many words are classified good. */
    @Min(1)
    private int goodSectionWordThreshold = 25;

    public Duration timeoutFor(AnalysisKind kind) {
        Duration override = timeouts.get(kind);
        return override != null ? override : defaultTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Map<AnalysisKind, Duration> getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Map<AnalysisKind, Duration> timeouts) {
        this.timeouts = timeouts;
    }

    public int getGoodSectionWordThreshold() {
        return goodSectionWordThreshold;
    }

    public void setGoodSectionWordThreshold(int goodSectionWordThreshold) {
        this.goodSectionWordThreshold = goodSectionWordThreshold;
    }
}
