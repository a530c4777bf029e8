package com.adlanda.channelknowledge.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for the query endpoint.
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        @Size(max = 4000)
        String question,

        @Min(1) @Max(20)
        Integer maxResults,

        String category
) {
    public QueryRequest {
        if (maxResults == null) {
            maxResults = 5;
        }
        if (category != null && category.isBlank()) {
            category = null;
        }
    }
}
