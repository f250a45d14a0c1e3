package com.adlanda.apidocsrag.model;

import java.util.List;

/**
 * One documented API operation.
 *
 * @param method      HTTP method
 * @param path        URL template, may contain placeholders such as {@code {id}}
 * @param name        Optional human-readable title ("Create Ticket"), null when absent
 * @param description Free-text description, never null
 * @param parameters  Documented parameters in source order
 * @param example     Optional literal request example (usually a cURL command), null when absent
 * @param tags        Grouping labels from the documentation section
 */
public record EndpointRecord(
        EndpointMethod method,
        String path,
        String name,
        String description,
        List<EndpointParameter> parameters,
        String example,
        List<String> tags
) {
    public EndpointRecord {
        if (method == null) {
            throw new IllegalArgumentException("Endpoint method is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Endpoint path is required");
        }
        description = description == null ? "" : description;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Creates a record with only method, path and description.
     */
    public static EndpointRecord of(EndpointMethod method, String path, String description) {
        return new EndpointRecord(method, path, null, description, List.of(), null, List.of());
    }

    /**
     * Returns the "METHOD path" label identifying this record within a corpus.
     */
    public String label() {
        return method + " " + path;
    }

    public boolean hasExample() {
        return example != null && !example.isBlank();
    }
}
