package com.example.CourseRag.tools;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.NoCourseMatchException;
import com.example.CourseRag.model.SearchResult;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.repository.CourseIndexStore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Semantic search over course content, with optional fuzzy course and exact lesson filters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CourseSearchTool implements AiToolDefinition {

    public static final String NAME = "search_course_content";

    private final CourseIndexStore indexStore;
    private final RagProperties properties;
    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Request(
            @JsonProperty("query") String query,
            @JsonProperty("course_name") String courseName,
            @JsonProperty("lesson_number") Integer lessonNumber
    ) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search course materials with smart course name matching and lesson filtering";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "query": {
                      "type": "string",
                      "description": "What to search for in the course content"
                    },
                    "course_name": {
                      "type": "string",
                      "description": "Course title (partial matches work, e.g. 'MCP', 'Introduction')"
                    },
                    "lesson_number": {
                      "type": "integer",
                      "description": "Specific lesson number to search within (e.g. 1, 2, 3)"
                    }
                  },
                  "required": ["query"]
                }
                """;
    }

    @Override
    public ToolOutcome execute(String argumentsJson) {
        Request request = parse(argumentsJson);
        return search(request.query(), request.courseName(), request.lessonNumber());
    }

    public ToolOutcome search(String query, String courseName, Integer lessonNumber) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }

        String courseTitle = null;
        if (courseName != null && !courseName.isBlank()) {
            try {
                courseTitle = indexStore.resolveCourseName(courseName);
            } catch (NoCourseMatchException ex) {
                log.info("No course matches '{}'", courseName);
                return ToolOutcome.of("No matching course found for '" + courseName + "'.");
            }
        }

        List<SearchResult> results = indexStore.search(query, courseTitle, lessonNumber, properties.getMaxResults());
        if (results.isEmpty()) {
            return ToolOutcome.of(emptyMessage(courseTitle, lessonNumber));
        }

        String formatted = results.stream()
                .map(result -> header(result) + "\n" + result.text())
                .collect(Collectors.joining("\n\n"));
        List<Source> sources = results.stream()
                .map(SearchResult::toSource)
                .toList();
        log.debug("search_course_content '{}' -> {} results", query, results.size());
        return new ToolOutcome(formatted, sources);
    }

    private static String header(SearchResult result) {
        if (result.lessonNumber() == null) {
            return "[" + result.courseTitle() + "]";
        }
        return "[" + result.courseTitle() + " - Lesson " + result.lessonNumber() + "]";
    }

    private static String emptyMessage(String courseTitle, Integer lessonNumber) {
        StringBuilder message = new StringBuilder("No relevant content found");
        if (courseTitle != null) {
            message.append(" in course '").append(courseTitle).append("'");
        }
        if (lessonNumber != null) {
            message.append(" in lesson ").append(lessonNumber);
        }
        return message.append('.').toString();
    }

    private Request parse(String argumentsJson) {
        try {
            return objectMapper.readValue(argumentsJson == null ? "{}" : argumentsJson, Request.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid arguments for " + NAME + ": " + e.getOriginalMessage(), e);
        }
    }
}
