package com.adlanda.apidocsrag.index;

import com.adlanda.apidocsrag.model.EndpointParameter;
import com.adlanda.apidocsrag.model.EndpointRecord;

import java.util.stream.Collectors;

/**
 * Fields of an endpoint record that carry their own term statistics and weight.
 *
 * Declaration order is the order in which fields are scored.
 */
public enum IndexField {
    PATH,
    NAME,
    DESCRIPTION,
    PARAMETERS,
    TAGS;

    /**
     * Extracts the raw text of this field from a record.
     */
    public String textOf(EndpointRecord record) {
        return switch (this) {
            case PATH -> record.path();
            case NAME -> record.name() == null ? "" : record.name();
            case DESCRIPTION -> record.description();
            case PARAMETERS -> record.parameters().stream()
                    .map(EndpointParameter::name)
                    .collect(Collectors.joining(" "));
            case TAGS -> String.join(" ", record.tags());
        };
    }
}
