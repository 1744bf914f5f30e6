package com.example.CourseRag.repository;

import com.example.CourseRag.exception.IndexUnavailableException;
import com.example.CourseRag.exception.InvalidFilterException;
import com.example.CourseRag.exception.NoCourseMatchException;
import com.example.CourseRag.model.Course;
import com.example.CourseRag.model.CourseChunk;
import com.example.CourseRag.model.SearchResult;
import com.example.CourseRag.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime index: embeddings are computed with the Spring AI {@link EmbeddingModel}
 * and compared by cosine similarity. Nothing survives a restart.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "rag.index.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCourseIndexStore implements CourseIndexStore {

    private final EmbeddingModel embeddingModel;

    private final Map<String, IndexedCourse> courses = new ConcurrentHashMap<>();

    /** One monitor per title so concurrent upserts of the same course serialize. */
    private final Map<String, Object> titleLocks = new ConcurrentHashMap<>();

    public InMemoryCourseIndexStore(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public boolean upsert(Course course, List<CourseChunk> chunks) {
        Object lock = titleLocks.computeIfAbsent(course.title(), title -> new Object());
        synchronized (lock) {
            if (courses.containsKey(course.title())) {
                log.debug("Course '{}' already indexed, skipping", course.title());
                return false;
            }

            float[] titleEmbedding = embed(course.title());
            List<IndexedChunk> indexedChunks = new ArrayList<>(chunks.size());
            for (CourseChunk chunk : chunks) {
                if (!course.title().equals(chunk.courseTitle())) {
                    throw new IllegalArgumentException(
                            "Chunk " + chunk.index() + " belongs to '" + chunk.courseTitle()
                                    + "', not '" + course.title() + "'");
                }
                indexedChunks.add(new IndexedChunk(chunk, embed(chunk.text())));
            }

            // Publish only fully embedded courses so readers never see a partial one.
            courses.put(course.title(), new IndexedCourse(course, titleEmbedding, List.copyOf(indexedChunks)));
            log.info("Indexed course '{}' with {} chunks", course.title(), indexedChunks.size());
            return true;
        }
    }

    @Override
    public String resolveCourseName(String fuzzyName) {
        if (courses.isEmpty()) {
            throw new NoCourseMatchException(fuzzyName);
        }
        if (courses.containsKey(fuzzyName)) {
            return fuzzyName;
        }

        float[] query = embed(fuzzyName);
        return courses.values().stream()
                .max(Comparator.comparingDouble(c -> VectorMath.cosineSimilarity(query, c.titleEmbedding())))
                .map(c -> c.course().title())
                .orElseThrow(() -> new NoCourseMatchException(fuzzyName));
    }

    @Override
    public List<SearchResult> search(String query, String courseFilter, Integer lessonFilter, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        String courseTitle = null;
        if (courseFilter != null && !courseFilter.isBlank()) {
            try {
                courseTitle = resolveCourseName(courseFilter);
            } catch (NoCourseMatchException ex) {
                throw new InvalidFilterException(courseFilter, ex);
            }
        }

        List<IndexedCourse> candidates = courseTitle == null
                ? List.copyOf(courses.values())
                : List.of(courses.get(courseTitle));
        if (candidates.stream().allMatch(c -> c.chunks().isEmpty())) {
            return List.of();
        }

        float[] queryEmbedding = embed(query);
        List<SearchResult> scored = new ArrayList<>();
        for (IndexedCourse indexed : candidates) {
            for (IndexedChunk entry : indexed.chunks()) {
                CourseChunk chunk = entry.chunk();
                if (lessonFilter != null && !lessonFilter.equals(chunk.lessonNumber())) {
                    continue;
                }
                double score = VectorMath.cosineSimilarity(queryEmbedding, entry.embedding());
                scored.add(new SearchResult(
                        chunk.text(),
                        chunk.courseTitle(),
                        chunk.lessonNumber(),
                        indexed.course().lessonLink(chunk.lessonNumber()),
                        score
                ));
            }
        }

        List<SearchResult> results = scored.stream()
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                .limit(limit)
                .toList();
        log.debug("Search '{}' (course={}, lesson={}) -> {} results", query, courseTitle, lessonFilter, results.size());
        return results;
    }

    @Override
    public Optional<Course> findCourse(String title) {
        return Optional.ofNullable(courses.get(title)).map(IndexedCourse::course);
    }

    @Override
    public List<String> courseTitles() {
        return courses.keySet().stream().sorted().toList();
    }

    @Override
    public int chunkCount(String courseTitle) {
        IndexedCourse indexed = courses.get(courseTitle);
        return indexed == null ? 0 : indexed.chunks().size();
    }

    private float[] embed(String text) {
        try {
            return embeddingModel.embed(text);
        } catch (RuntimeException ex) {
            throw new IndexUnavailableException("Embedding backend failed: " + ex.getMessage(), ex);
        }
    }

    private record IndexedCourse(Course course, float[] titleEmbedding, List<IndexedChunk> chunks) {
    }

    private record IndexedChunk(CourseChunk chunk, float[] embedding) {
    }
}
