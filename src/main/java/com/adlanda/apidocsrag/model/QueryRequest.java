package com.adlanda.apidocsrag.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the query and retrieve endpoints.
 *
 * @param question       The question to answer
 * @param maxResults     Number of endpoints to return, null for the configured default
 * @param generateAnswer Whether to ask the chat model for an answer, true when absent
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1) @Max(20)
        Integer maxResults,

        Boolean generateAnswer
) {
    public QueryRequest {
        if (generateAnswer == null) {
            generateAnswer = true;
        }
    }

    /**
     * Returns the requested result count, or 0 when the caller left it to the service default.
     */
    public int requestedMaxResults() {
        return maxResults == null ? 0 : maxResults;
    }
}
