package com.example.CourseRag.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for asking a question about the course corpus.
 *
 * @param query     user question
 * @param sessionId optional conversation id; a new one is issued when absent
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryRequest(
        @NotBlank(message = "query is required") String query,
        String sessionId
) {
    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
