package com.example.CourseRag.model;

import java.util.List;

public record ChunkedCourse(
        Course course,
        List<CourseChunk> chunks
) {
}
