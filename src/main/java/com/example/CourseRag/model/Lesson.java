package com.example.CourseRag.model;

/**
 * One lesson of a course. Numbers are unique within their course.
 */
public record Lesson(
        int number,
        String title,
        String link
) {
}
