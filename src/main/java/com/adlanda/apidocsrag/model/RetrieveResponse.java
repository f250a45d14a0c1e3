package com.adlanda.apidocsrag.model;

import java.util.List;

/**
 * Response from the retrieval-only endpoint.
 *
 * @param results          Matched endpoints, ordered by relevance
 * @param context          Assembled context text
 * @param totalEndpoints   Number of endpoints in the index
 * @param contextEndpoints Number of endpoints rendered into {@code context}
 * @param queryTimeMs      Time taken in milliseconds
 */
public record RetrieveResponse(
        List<QueryResult> results,
        String context,
        int totalEndpoints,
        int contextEndpoints,
        long queryTimeMs
) {}
