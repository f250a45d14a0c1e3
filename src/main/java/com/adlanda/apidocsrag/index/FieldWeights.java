package com.adlanda.apidocsrag.index;

import com.adlanda.apidocsrag.config.RetrievalProperties;

/**
 * Per-field score multipliers, fixed for the lifetime of an index.
 */
public record FieldWeights(
        double path,
        double name,
        double description,
        double parameters,
        double tags
) {
    public static final FieldWeights DEFAULT = new FieldWeights(3.0, 2.0, 1.5, 1.0, 0.5);

    public static FieldWeights from(RetrievalProperties properties) {
        return new FieldWeights(
                properties.getPathWeight(),
                properties.getNameWeight(),
                properties.getDescriptionWeight(),
                properties.getParameterWeight(),
                properties.getTagWeight()
        );
    }

    public double weight(IndexField field) {
        return switch (field) {
            case PATH -> path;
            case NAME -> name;
            case DESCRIPTION -> description;
            case PARAMETERS -> parameters;
            case TAGS -> tags;
        };
    }
}
