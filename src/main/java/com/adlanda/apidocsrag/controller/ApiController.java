package com.adlanda.apidocsrag.controller;

import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.service.AnswerService;
import com.adlanda.apidocsrag.service.CorpusIndexService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service overview: what is indexed, whether answers are generated, and where the endpoints are.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    private static final Map<String, String> ROUTES = routes();

    private final CorpusIndexService corpusIndexService;
    private final AnswerService answerService;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    public ApiController(CorpusIndexService corpusIndexService, AnswerService answerService) {
        this.corpusIndexService = corpusIndexService;
        this.answerService = answerService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> overview() {
        Corpus corpus = corpusIndexService.currentCorpus();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "API Docs RAG");
        body.put("version", appVersion);
        body.put("indexedEndpoints", corpus.size());
        body.put("corpusLoadedAt", corpus.loadedAt());
        body.put("answerGeneration", answerService.isAvailable() ? "enabled" : "disabled");
        body.put("routes", ROUTES);
        return ResponseEntity.ok(body);
    }

    private static Map<String, String> routes() {
        Map<String, String> routes = new LinkedHashMap<>();
        routes.put("POST /api/v1/query", "Answer a question from the best matching endpoints");
        routes.put("POST /api/v1/retrieve", "Ranked endpoints and assembled context, no answer");
        routes.put("GET /api/v1/endpoints", "Indexed endpoint labels and corpus metadata");
        routes.put("POST /api/v1/reload", "Reload the corpus and swap in a new index");
        routes.put("GET /actuator/health", "Corpus health");
        return routes;
    }
}
