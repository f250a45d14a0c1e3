package com.adlanda.apidocsrag.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for loading the endpoint corpus.
 *
 * Maps to properties prefixed with 'apidocs.corpus' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "apidocs.corpus")
public class CorpusProperties {

    /**
     * Whether the corpus is loaded at startup.
     * When false, the index stays empty until a reload is requested (useful for testing).
     */
    private boolean enabled = true;

    /**
     * Spring resource location of the scraped documentation JSON.
     */
    private String location = "classpath:corpus/documentation.json";

    /**
     * Whether malformed entries are skipped (and counted) instead of failing the whole load.
     */
    private boolean skipMalformed = true;

    /**
     * Name reported as the answer source.
     */
    private String sourceName = "API Documentation";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public boolean isSkipMalformed() {
        return skipMalformed;
    }

    public void setSkipMalformed(boolean skipMalformed) {
        this.skipMalformed = skipMalformed;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName;
    }
}
