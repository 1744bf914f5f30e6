package com.example.CourseRag.tools;

import com.example.CourseRag.exception.NoCourseMatchException;
import com.example.CourseRag.model.Course;
import com.example.CourseRag.model.Lesson;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.repository.CourseIndexStore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Course structure lookup: title, link, instructor and the ordered lesson list.
 */
@Component
@RequiredArgsConstructor
public class CourseOutlineTool implements AiToolDefinition {

    public static final String NAME = "get_course_outline";

    private final CourseIndexStore indexStore;
    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Request(@JsonProperty("course_title") String courseTitle) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Get course outline including title, link, and complete lesson list with numbers and titles";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "course_title": {
                      "type": "string",
                      "description": "Course title to get outline for (partial matches work)"
                    }
                  },
                  "required": ["course_title"]
                }
                """;
    }

    @Override
    public ToolOutcome execute(String argumentsJson) {
        Request request;
        try {
            request = objectMapper.readValue(argumentsJson == null ? "{}" : argumentsJson, Request.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid arguments for " + NAME + ": " + e.getOriginalMessage(), e);
        }
        if (request.courseTitle() == null || request.courseTitle().isBlank()) {
            throw new IllegalArgumentException("course_title is required");
        }
        return outline(request.courseTitle());
    }

    public ToolOutcome outline(String courseName) {
        String resolved;
        try {
            resolved = indexStore.resolveCourseName(courseName);
        } catch (NoCourseMatchException ex) {
            return ToolOutcome.of("No course found matching '" + courseName + "'");
        }

        Course course = indexStore.findCourse(resolved).orElse(null);
        if (course == null) {
            return ToolOutcome.of("Course '" + resolved + "' not found in metadata");
        }
        return new ToolOutcome(format(course), List.of(new Source(course.title(), null, course.link())));
    }

    private static String format(Course course) {
        List<String> lines = new ArrayList<>();
        lines.add("**Course Title:** " + course.title());
        if (course.link() != null) {
            lines.add("**Course Link:** " + course.link());
        }
        if (course.instructor() != null) {
            lines.add("**Instructor:** " + course.instructor());
        }
        lines.add("**Total Lessons:** " + course.lessons().size());
        lines.add("");
        lines.add("**Lesson List:**");
        for (Lesson lesson : course.lessons()) {
            String line = "Lesson " + lesson.number() + ": " + lesson.title();
            if (lesson.link() != null) {
                line += " - " + lesson.link();
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }
}
