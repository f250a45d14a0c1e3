package com.adlanda.apidocsrag;

import com.adlanda.apidocsrag.repository.EndpointIndexStore;
import com.adlanda.apidocsrag.service.AnswerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after CorpusLoadRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final EndpointIndexStore indexStore;
    private final AnswerService answerService;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(EndpointIndexStore indexStore, AnswerService answerService) {
        this.indexStore = indexStore;
        this.answerService = answerService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            API Docs RAG v{}
            Index: {} endpoints
            Answer generation: {}

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/query
              POST http://localhost:{}/api/v1/retrieve
              GET  http://localhost:{}/api/v1/endpoints
              POST http://localhost:{}/api/v1/reload

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, indexStore.size(), answerService.isAvailable() ? "enabled" : "disabled",
            port, port, port, port, port, port
        );
    }
}
