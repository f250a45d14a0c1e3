package com.adlanda.apidocsrag.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a request parameter is carried.
 */
public enum ParameterLocation {
    PATH, QUERY, HEADER, BODY, FORM, COOKIE, UNSPECIFIED;

    /**
     * Parses a location label. A blank label maps to {@link #UNSPECIFIED};
     * an unrecognised one yields empty.
     */
    public static Optional<ParameterLocation> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.of(UNSPECIFIED);
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "path", "url" -> Optional.of(PATH);
            case "query", "querystring", "query_string" -> Optional.of(QUERY);
            case "header", "headers" -> Optional.of(HEADER);
            case "body", "json", "payload" -> Optional.of(BODY);
            case "form", "formdata", "form_data", "multipart" -> Optional.of(FORM);
            case "cookie" -> Optional.of(COOKIE);
            default -> Optional.empty();
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
