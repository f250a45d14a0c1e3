package com.adlanda.apidocsrag.model;

import java.util.List;

/**
 * Outcome of retrieval for one query.
 *
 * @param results        Top ranked results, best first
 * @param context        Rendered context for answer generation
 * @param contextRecords How many of {@code results}, counted from the top, were rendered into {@code context}
 */
public record RetrievalResponse(List<RankedResult> results, String context, int contextRecords) {

    public RetrievalResponse {
        results = List.copyOf(results);
    }

    public boolean hasResults() {
        return !results.isEmpty();
    }

    public boolean hasContext() {
        return contextRecords > 0;
    }
}
