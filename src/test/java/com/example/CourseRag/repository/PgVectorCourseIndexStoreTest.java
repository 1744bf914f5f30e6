package com.example.CourseRag.repository;

import com.example.CourseRag.exception.IndexUnavailableException;
import com.example.CourseRag.exception.NoCourseMatchException;
import com.example.CourseRag.ingest.CourseDocumentChunker;
import com.example.CourseRag.model.ChunkedCourse;
import com.example.CourseRag.support.CourseFixtures;
import com.example.CourseRag.support.TrigramEmbeddingModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PgVectorCourseIndexStoreTest {

    private JdbcTemplate jdbcTemplate;
    private TrigramEmbeddingModel embeddingModel;
    private PgVectorCourseIndexStore store;
    private ChunkedCourse intro;

    @BeforeEach
    void setUp() {
        jdbcTemplate = Mockito.mock(JdbcTemplate.class);
        embeddingModel = new TrigramEmbeddingModel();
        store = new PgVectorCourseIndexStore(jdbcTemplate, new ObjectMapper(), embeddingModel);
        intro = new CourseDocumentChunker(80, 20).chunk(CourseFixtures.INTRO);
    }

    @Test
    void knownTitleWritesNoChunks() {
        catalogHolds(1);

        assertFalse(store.upsert(intro.course(), intro.chunks()));
        verify(jdbcTemplate, never()).update(contains("INSERT INTO course_catalog"), any(Object[].class));
        verify(jdbcTemplate, never()).batchUpdate(anyString(), anyList(), any(int[].class));
    }

    @Test
    void knownTitleIsNotEmbeddedAgain() {
        catalogHolds(1);

        store.upsert(intro.course(), intro.chunks());

        assertEquals(0, embeddingModel.calls());
    }

    @Test
    void knownTitleIsSkippedWhileEmbeddingBackendIsDown() {
        EmbeddingModel broken = Mockito.mock(EmbeddingModel.class);
        when(broken.embed(anyString())).thenThrow(new IllegalStateException("embedding service down"));
        PgVectorCourseIndexStore warmStore = new PgVectorCourseIndexStore(jdbcTemplate, new ObjectMapper(), broken);
        catalogHolds(1);

        assertFalse(warmStore.upsert(intro.course(), intro.chunks()));
    }

    @Test
    void newTitleWritesChunksInOneBatch() {
        catalogHolds(0);
        when(jdbcTemplate.update(contains("ON CONFLICT (title) DO NOTHING"), any(), any(), any(), any(), any()))
                .thenReturn(1);

        assertTrue(store.upsert(intro.course(), intro.chunks()));
        assertEquals(intro.chunks().size() + 1, embeddingModel.calls());
        verify(jdbcTemplate).batchUpdate(contains("INSERT INTO course_chunks"), anyList(), any(int[].class));
    }

    @Test
    void titleIndexedConcurrentlyWritesNoChunks() {
        catalogHolds(0);
        when(jdbcTemplate.update(contains("ON CONFLICT (title) DO NOTHING"), any(), any(), any(), any(), any()))
                .thenReturn(0);

        assertFalse(store.upsert(intro.course(), intro.chunks()));
        verify(jdbcTemplate, never()).batchUpdate(anyString(), anyList(), any(int[].class));
    }

    @Test
    void emptyCatalogHasNoCourseMatch() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());

        assertThrows(NoCourseMatchException.class, () -> store.resolveCourseName("Intro"));
    }

    @Test
    void databaseFailureSurfacesAsIndexUnavailable() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(IndexUnavailableException.class, () -> store.courseTitles());
    }

    private void catalogHolds(int count) {
        when(jdbcTemplate.queryForObject(contains("FROM course_catalog WHERE title"), eq(Integer.class), any(Object[].class)))
                .thenReturn(count);
    }
}
