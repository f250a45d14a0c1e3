package com.adlanda.apidocsrag.model;

import java.util.List;

/**
 * A single endpoint returned to web clients.
 *
 * @param method       HTTP method
 * @param path         URL template
 * @param name         Optional title
 * @param description  Endpoint description
 * @param score        Ranking score (higher is more relevant)
 * @param matchedTerms Query terms found in the endpoint, sorted
 */
public record QueryResult(
        String method,
        String path,
        String name,
        String description,
        double score,
        List<String> matchedTerms
) {
    public static QueryResult from(EndpointRecord record, RankedResult ranked) {
        return new QueryResult(
                record.method().name(),
                record.path(),
                record.name(),
                record.description(),
                ranked.score(),
                ranked.matchedTerms().stream().sorted().toList()
        );
    }
}
