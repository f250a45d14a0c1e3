package com.adlanda.apidocsrag.controller;

import com.adlanda.apidocsrag.model.QueryRequest;
import com.adlanda.apidocsrag.model.QueryResponse;
import com.adlanda.apidocsrag.model.RetrieveResponse;
import com.adlanda.apidocsrag.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for asking questions about the documented API.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Answer a question from the most relevant endpoints.
     *
     * @param request The query request containing the question
     * @return QueryResponse with the answer, matched endpoints and metadata
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResponse response = retrievalService.query(
                request.question(), request.requestedMaxResults(), request.generateAnswer());
        return ResponseEntity.ok(response);
    }

    /**
     * Retrieve matching endpoints and the assembled context without generating an answer.
     */
    @PostMapping("/retrieve")
    public ResponseEntity<RetrieveResponse> retrieve(@Valid @RequestBody QueryRequest request) {
        return ResponseEntity.ok(retrievalService.retrieveContext(request.question(), request.requestedMaxResults()));
    }
}
