package com.adlanda.apidocsrag;

import com.adlanda.apidocsrag.config.CorpusProperties;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.service.CorpusIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Loads and indexes the endpoint corpus on application startup.
 *
 * A failed load is fatal: the exception propagates and the application does not start.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class CorpusLoadRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoadRunner.class);

    private final CorpusIndexService corpusIndexService;
    private final CorpusProperties properties;

    public CorpusLoadRunner(CorpusIndexService corpusIndexService, CorpusProperties properties) {
        this.corpusIndexService = corpusIndexService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Corpus loading disabled, index stays empty until a reload is requested");
            return;
        }

        log.info("Starting corpus load from {}", properties.getLocation());
        Corpus corpus = corpusIndexService.reload();
        log.info("Corpus load complete: {} endpoints indexed", corpus.size());
    }
}
