package com.example.CourseRag.tools;

import com.example.CourseRag.ingest.CourseDocumentChunker;
import com.example.CourseRag.model.ChunkedCourse;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.repository.InMemoryCourseIndexStore;
import com.example.CourseRag.support.CourseFixtures;
import com.example.CourseRag.support.TrigramEmbeddingModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CourseOutlineToolTest {

    private InMemoryCourseIndexStore store;
    private CourseOutlineTool tool;

    @BeforeEach
    void setUp() {
        store = new InMemoryCourseIndexStore(new TrigramEmbeddingModel());
        tool = new CourseOutlineTool(store, new ObjectMapper());
    }

    @Test
    void outlineListsEveryLessonInOrder() {
        ChunkedCourse intro = new CourseDocumentChunker(80, 20).chunk(CourseFixtures.INTRO);
        store.upsert(intro.course(), intro.chunks());

        ToolOutcome outcome = tool.execute("{\"course_title\":\"intro\"}");

        assertEquals("""
                **Course Title:** Intro
                **Course Link:** https://example.com/intro
                **Instructor:** Ada Lovelace
                **Total Lessons:** 2

                **Lesson List:**
                Lesson 0: Basics - https://example.com/intro/0
                Lesson 1: Collections""", outcome.observation());
        assertEquals(List.of(new Source("Intro", null, "https://example.com/intro")), outcome.sources());
    }

    @Test
    void emptyIndexReportsNoMatch() {
        ToolOutcome outcome = tool.outline("Intro");

        assertEquals("No course found matching 'Intro'", outcome.observation());
        assertTrue(outcome.sources().isEmpty());
    }

    @Test
    void missingTitleArgumentIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tool.execute("{}"));
    }
}
