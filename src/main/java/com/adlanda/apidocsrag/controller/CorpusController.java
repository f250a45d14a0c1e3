package com.adlanda.apidocsrag.controller;

import com.adlanda.apidocsrag.exception.CorpusLoadException;
import com.adlanda.apidocsrag.model.Corpus;
import com.adlanda.apidocsrag.model.EndpointRecord;
import com.adlanda.apidocsrag.model.ReloadResponse;
import com.adlanda.apidocsrag.service.CorpusIndexService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for inspecting and reloading the endpoint corpus.
 */
@RestController
@RequestMapping("/api/v1")
public class CorpusController {

    private final CorpusIndexService corpusIndexService;

    public CorpusController(CorpusIndexService corpusIndexService) {
        this.corpusIndexService = corpusIndexService;
    }

    /**
     * Debug view of the indexed endpoints.
     */
    @GetMapping("/endpoints")
    public ResponseEntity<Map<String, Object>> endpoints() {
        Corpus corpus = corpusIndexService.currentCorpus();
        List<String> labels = corpus.endpoints().stream()
                .map(EndpointRecord::label)
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalEndpoints", corpus.size());
        body.put("endpoints", labels);
        body.put("sampleEndpoint", corpus.isEmpty() ? null : corpus.get(0));
        body.put("baseUrl", corpus.baseUrl());
        body.put("sourceTimestamp", corpus.sourceTimestamp());
        body.put("loadedAt", corpus.loadedAt());
        body.put("skippedEntries", corpus.skippedEntries());
        return ResponseEntity.ok(body);
    }

    /**
     * Reload the corpus from its configured location and swap in the new index.
     */
    @PostMapping("/reload")
    public ResponseEntity<ReloadResponse> reload() {
        return ResponseEntity.ok(ReloadResponse.loaded(corpusIndexService.reload()));
    }

    @ExceptionHandler(CorpusLoadException.class)
    public ResponseEntity<Map<String, Object>> handleLoadFailure(CorpusLoadException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of(
                "status", "failed",
                "reason", e.getReason().name(),
                "error", e.getMessage()
        ));
    }
}
