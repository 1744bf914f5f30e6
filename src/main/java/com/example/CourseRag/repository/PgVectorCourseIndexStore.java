package com.example.CourseRag.repository;

import com.example.CourseRag.exception.IndexUnavailableException;
import com.example.CourseRag.exception.InvalidFilterException;
import com.example.CourseRag.exception.NoCourseMatchException;
import com.example.CourseRag.model.Course;
import com.example.CourseRag.model.CourseChunk;
import com.example.CourseRag.model.Lesson;
import com.example.CourseRag.model.SearchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL + pgvector index. Similarity uses the cosine distance operator {@code <=>};
 * score = 1 - distance. Schema lives in {@code db/pgvector-schema.sql}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rag.index.store", havingValue = "pgvector")
public class PgVectorCourseIndexStore implements CourseIndexStore {

    private static final TypeReference<List<Lesson>> LESSON_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EmbeddingModel embeddingModel;

    /**
     * Upserts of one title are serialized by a transaction-scoped advisory lock on the title.
     * A known title is detected before anything is embedded, so a warm start costs one lookup
     * per course.
     */
    @Override
    @Transactional
    public boolean upsert(Course course, List<CourseChunk> chunks) {
        try {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))", (ResultSetExtractor<Void>) rs -> null,
                    course.title());
            if (titleExists(course.title())) {
                log.debug("Course '{}' already indexed, skipping", course.title());
                return false;
            }
        } catch (DataAccessException ex) {
            throw new IndexUnavailableException("Failed to check course '" + course.title() + "'", ex);
        }

        PGvector titleVector = new PGvector(embed(course.title()));
        List<PGvector> chunkVectors = new ArrayList<>(chunks.size());
        for (CourseChunk chunk : chunks) {
            chunkVectors.add(new PGvector(embed(chunk.text())));
        }

        try {
            int claimed = jdbcTemplate.update("""
                            INSERT INTO course_catalog (title, link, instructor, lessons, embedding)
                            VALUES (?, ?, ?, CAST(? AS jsonb), ?)
                            ON CONFLICT (title) DO NOTHING
                            """,
                    course.title(), course.link(), course.instructor(), toJson(course.lessons()), titleVector);
            if (claimed == 0) {
                log.debug("Course '{}' indexed concurrently, skipping", course.title());
                return false;
            }

            List<Object[]> rows = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                CourseChunk chunk = chunks.get(i);
                rows.add(new Object[]{
                        chunk.courseTitle(),
                        chunk.lessonNumber(),
                        course.lessonLink(chunk.lessonNumber()),
                        chunk.index(),
                        chunk.text(),
                        chunkVectors.get(i)
                });
            }
            jdbcTemplate.batchUpdate("""
                            INSERT INTO course_chunks (course_title, lesson_number, lesson_link, chunk_index, content, embedding)
                            VALUES (?, ?, ?, ?, ?, ?)
                            """,
                    rows,
                    new int[]{Types.VARCHAR, Types.INTEGER, Types.VARCHAR, Types.INTEGER, Types.VARCHAR, Types.OTHER});
        } catch (DataAccessException ex) {
            throw new IndexUnavailableException("Failed to index course '" + course.title() + "'", ex);
        }

        log.info("Indexed course '{}' with {} chunks", course.title(), chunks.size());
        return true;
    }

    @Override
    public String resolveCourseName(String fuzzyName) {
        PGvector queryVector = new PGvector(embed(fuzzyName));
        List<String> titles = query(
                "SELECT title FROM course_catalog ORDER BY embedding <=> ? LIMIT 1",
                (rs, rowNum) -> rs.getString("title"),
                queryVector);
        if (titles.isEmpty()) {
            throw new NoCourseMatchException(fuzzyName);
        }
        return titles.get(0);
    }

    @Override
    public List<SearchResult> search(String query, String courseFilter, Integer lessonFilter, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        String courseTitle = null;
        if (courseFilter != null && !courseFilter.isBlank()) {
            try {
                courseTitle = findCourse(courseFilter).isPresent() ? courseFilter : resolveCourseName(courseFilter);
            } catch (NoCourseMatchException ex) {
                throw new InvalidFilterException(courseFilter, ex);
            }
        }

        PGvector queryVector = new PGvector(embed(query));
        StringBuilder sql = new StringBuilder("""
                SELECT content,
                       course_title,
                       lesson_number,
                       lesson_link,
                       1 - (embedding <=> ?) AS score
                FROM course_chunks
                WHERE 1 = 1
                """);
        List<Object> args = new ArrayList<>();
        args.add(queryVector);
        if (courseTitle != null) {
            sql.append(" AND course_title = ?");
            args.add(courseTitle);
        }
        if (lessonFilter != null) {
            sql.append(" AND lesson_number = ?");
            args.add(lessonFilter);
        }
        sql.append(" ORDER BY embedding <=> ? LIMIT ?");
        args.add(queryVector);
        args.add(limit);

        return query(sql.toString(), new SearchResultRowMapper(), args.toArray());
    }

    @Override
    public Optional<Course> findCourse(String title) {
        List<Course> found = query(
                "SELECT title, link, instructor, lessons FROM course_catalog WHERE title = ?",
                (rs, rowNum) -> new Course(
                        rs.getString("title"),
                        rs.getString("link"),
                        rs.getString("instructor"),
                        fromJson(rs.getString("lessons"))
                ),
                title);
        return found.stream().findFirst();
    }

    @Override
    public List<String> courseTitles() {
        return query("SELECT title FROM course_catalog ORDER BY title", (rs, rowNum) -> rs.getString("title"));
    }

    @Override
    public int chunkCount(String courseTitle) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM course_chunks WHERE course_title = ?", Integer.class, courseTitle);
            return count == null ? 0 : count;
        } catch (DataAccessException ex) {
            throw new IndexUnavailableException("Failed to count chunks of '" + courseTitle + "'", ex);
        }
    }

    private boolean titleExists(String title) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM course_catalog WHERE title = ?", Integer.class, title);
        return count != null && count > 0;
    }

    private <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        try {
            return jdbcTemplate.query(sql, mapper, args);
        } catch (DataAccessException ex) {
            throw new IndexUnavailableException("Index query failed: " + ex.getMostSpecificCause().getMessage(), ex);
        }
    }

    private float[] embed(String text) {
        try {
            return embeddingModel.embed(text);
        } catch (RuntimeException ex) {
            throw new IndexUnavailableException("Embedding backend failed: " + ex.getMessage(), ex);
        }
    }

    private String toJson(List<Lesson> lessons) {
        try {
            return objectMapper.writeValueAsString(lessons);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize lessons", e);
        }
    }

    private List<Lesson> fromJson(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LESSON_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable lesson metadata, treating as empty: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static class SearchResultRowMapper implements RowMapper<SearchResult> {
        @Override
        public SearchResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            int lesson = rs.getInt("lesson_number");
            Integer lessonNumber = rs.wasNull() ? null : lesson;
            return new SearchResult(
                    rs.getString("content"),
                    rs.getString("course_title"),
                    lessonNumber,
                    rs.getString("lesson_link"),
                    rs.getDouble("score")
            );
        }
    }
}
