package com.example.CourseRag.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Course metadata parsed from the header of a transcript document.
 *
 * title      - unique identifier of the course
 * link       - optional course URL
 * instructor - optional instructor name
 * lessons    - lessons ordered by lesson number
 */
public record Course(
        String title,
        String link,
        String instructor,
        List<Lesson> lessons
) {
    public Course {
        lessons = lessons == null
                ? List.of()
                : lessons.stream().sorted(Comparator.comparingInt(Lesson::number)).toList();
    }

    public Optional<Lesson> findLesson(Integer number) {
        if (number == null) {
            return Optional.empty();
        }
        return lessons.stream()
                .filter(lesson -> lesson.number() == number)
                .findFirst();
    }

    public String lessonLink(Integer number) {
        return findLesson(number).map(Lesson::link).orElse(null);
    }
}
