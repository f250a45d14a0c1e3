package com.adlanda.apidocsrag.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param answer           Generated answer, or a retrieval-only fallback text
 * @param results          Matched endpoints, ordered by relevance
 * @param sources          Documentation sources the answer draws on
 * @param confidence       Heuristic confidence between 0.1 and 1.0
 * @param explanation      Short human-readable summary of the retrieval
 * @param answerGenerated  Whether {@code answer} came from the language model
 * @param totalEndpoints   Number of endpoints in the index
 * @param contextEndpoints Number of endpoints rendered into the model context
 * @param queryTimeMs      Time taken to process the query in milliseconds
 */
public record QueryResponse(
        String answer,
        List<QueryResult> results,
        List<String> sources,
        double confidence,
        String explanation,
        boolean answerGenerated,
        int totalEndpoints,
        int contextEndpoints,
        long queryTimeMs
) {}
