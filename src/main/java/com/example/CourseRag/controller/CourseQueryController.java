package com.example.CourseRag.controller;

import com.example.CourseRag.model.CourseStats;
import com.example.CourseRag.model.QueryRequest;
import com.example.CourseRag.model.QueryResponse;
import com.example.CourseRag.service.CourseQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CourseQueryController {

    private final CourseQueryService courseQueryService;

    /**
     * Ask a question about the course corpus.
     *  POST /api/query
     *  {
     *    "query": "What is covered in lesson 2 of the MCP course?",
     *    "session_id": "session-..."   (optional)
     *  }
     */
    @PostMapping("/query")
    public QueryResponse query(@Valid @RequestBody QueryRequest request) {
        return courseQueryService.query(request);
    }

    @GetMapping("/courses")
    public CourseStats courses() {
        return courseQueryService.courseStats();
    }
}
