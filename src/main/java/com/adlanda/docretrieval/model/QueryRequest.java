package com.adlanda.docretrieval.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the query endpoint. A missing {@code maxResults} falls back
 * to the configured default.
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1) @Max(20)
        Integer maxResults
) {}
