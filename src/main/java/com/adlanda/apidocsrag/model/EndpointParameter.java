package com.adlanda.apidocsrag.model;

/**
 * One documented parameter of an endpoint.
 *
 * @param name         Parameter name as documented
 * @param location     Where the parameter is sent
 * @param type         Value type
 * @param required     Whether callers must supply it
 * @param description  Free-text description, never null
 * @param defaultValue Documented default, or null
 */
public record EndpointParameter(
        String name,
        ParameterLocation location,
        ParameterType type,
        boolean required,
        String description,
        String defaultValue
) {
    public EndpointParameter {
        if (description == null) {
            description = "";
        }
    }

    public static EndpointParameter of(String name, ParameterLocation location, ParameterType type,
                                       boolean required, String description) {
        return new EndpointParameter(name, location, type, required, description, null);
    }
}
