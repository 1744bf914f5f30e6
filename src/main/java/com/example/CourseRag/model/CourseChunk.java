package com.example.CourseRag.model;

/**
 * A context-prefixed span of course text stored for semantic search.
 *
 * text         - chunk text including the "Course ... Lesson ... content: " prefix
 * courseTitle  - owning course
 * lessonNumber - lesson the text was taken from, null when unknown
 * index        - emission order within the course, starting at 0
 */
public record CourseChunk(
        String text,
        String courseTitle,
        Integer lessonNumber,
        int index
) {
}
