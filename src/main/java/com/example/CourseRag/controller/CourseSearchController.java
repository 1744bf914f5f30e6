package com.example.CourseRag.controller;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.model.SearchResult;
import com.example.CourseRag.repository.CourseIndexStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Retrieval only, no LLM call. Useful for checking what the search tool would see.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CourseSearchController {

    private final CourseIndexStore indexStore;
    private final RagProperties properties;

    /**
     * GET /api/search?q=xxx&course=MCP&lesson=2&limit=5
     */
    @GetMapping("/search")
    public List<SearchResult> search(
            @RequestParam("q") String query,
            @RequestParam(value = "course", required = false) String course,
            @RequestParam(value = "lesson", required = false) Integer lesson,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        int resolvedLimit = limit == null || limit <= 0 ? properties.getMaxResults() : limit;
        return indexStore.search(query, course, lesson, resolvedLimit);
    }
}
