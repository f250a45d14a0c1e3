package com.adlanda.apidocsrag.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Value type of a request parameter.
 *
 * Documentation sources label types loosely ("int", "array of strings", "datetime"),
 * so {@link #fromLabel(String)} folds the common spellings onto this closed set.
 */
public enum ParameterType {
    STRING, INTEGER, NUMBER, BOOLEAN, ARRAY, OBJECT, DATE, FILE, UNSPECIFIED;

    public static Optional<ParameterType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.of(UNSPECIFIED);
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("array") || normalized.startsWith("list") || normalized.endsWith("[]")) {
            return Optional.of(ARRAY);
        }
        return switch (normalized) {
            case "string", "str", "text", "email", "url", "uuid" -> Optional.of(STRING);
            case "integer", "int", "long" -> Optional.of(INTEGER);
            case "number", "float", "double", "decimal" -> Optional.of(NUMBER);
            case "boolean", "bool" -> Optional.of(BOOLEAN);
            case "object", "hash", "json", "map", "dictionary" -> Optional.of(OBJECT);
            case "date", "datetime", "date-time", "timestamp", "time" -> Optional.of(DATE);
            case "file", "binary", "attachment" -> Optional.of(FILE);
            default -> Optional.empty();
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
