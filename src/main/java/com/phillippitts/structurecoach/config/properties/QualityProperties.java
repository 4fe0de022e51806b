package com.phillippitts.structurecoach.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Generative quality collaborator settings ({@code quality.llm.*}). Also used by the
 * interview scorer.
 */
@ConfigurationProperties(prefix = "quality")
public class QualityProperties {

    private LlmClientProperties llm = new LlmClientProperties("gpt-4o-mini");

    public LlmClientProperties getLlm() {
        return llm;
    }

    public void setLlm(LlmClientProperties llm) {
        this.llm = llm;
    }
}
