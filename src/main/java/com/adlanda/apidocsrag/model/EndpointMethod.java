package com.adlanda.apidocsrag.model;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods an endpoint record may declare.
 */
public enum EndpointMethod {
    GET, POST, PUT, PATCH, DELETE, HEAD, OPTIONS;

    /**
     * Parses a method label case-insensitively.
     *
     * @return the method, or empty when the label is blank or unknown
     */
    public static Optional<EndpointMethod> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
