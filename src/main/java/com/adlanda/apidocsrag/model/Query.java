package com.adlanda.apidocsrag.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An analyzed query.
 *
 * @param raw   The text as the caller sent it
 * @param terms Normalized terms in query order, duplicates retained
 */
public record Query(String raw, List<String> terms) {

    public Query {
        raw = raw == null ? "" : raw;
        terms = List.copyOf(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * Distinct terms in first-occurrence order.
     */
    public Set<String> distinctTerms() {
        return new LinkedHashSet<>(terms);
    }

    /**
     * The normalized query as a single space-separated phrase.
     */
    public String phrase() {
        return String.join(" ", terms);
    }
}
