package com.adlanda.apidocsrag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for optional answer generation on top of retrieval.
 */
@Component
@ConfigurationProperties(prefix = "apidocs.answer")
public class AnswerProperties {

    /**
     * Whether retrieved context is forwarded to the chat model.
     * When false, queries return retrieval-only responses.
     */
    private boolean enabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
