package com.example.CourseRag.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A single nearest-neighbor hit, best-first ordering is decided by {@code score}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResult(
        String text,
        String courseTitle,
        Integer lessonNumber,
        String link,
        double score
) {
    public Source toSource() {
        return new Source(courseTitle, lessonNumber, link);
    }
}
