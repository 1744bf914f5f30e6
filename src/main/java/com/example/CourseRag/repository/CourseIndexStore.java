package com.example.CourseRag.repository;

import com.example.CourseRag.model.Course;
import com.example.CourseRag.model.CourseChunk;
import com.example.CourseRag.model.SearchResult;

import java.util.List;
import java.util.Optional;

/**
 * Owner of course embeddings and the only way to read or write indexed chunks.
 */
public interface CourseIndexStore {

    /**
     * Store a course and its chunks. Idempotent by course title: a title that is already
     * indexed is left untouched. The check and the write are atomic per title.
     *
     * @return true if the course was newly indexed
     */
    boolean upsert(Course course, List<CourseChunk> chunks);

    /**
     * Nearest stored course title to an approximate name. There is no similarity floor:
     * the best match is returned whenever at least one course exists.
     *
     * @throws com.example.CourseRag.exception.NoCourseMatchException if no course is indexed
     */
    String resolveCourseName(String fuzzyName);

    /**
     * Up to {@code limit} chunks nearest to the query, best-first, restricted by the optional
     * course and lesson filters. Empty when nothing matches or nothing is loaded.
     *
     * @param courseFilter exact course title; an inexact value is resolved with {@link #resolveCourseName}
     * @throws com.example.CourseRag.exception.InvalidFilterException if courseFilter cannot be resolved
     */
    List<SearchResult> search(String query, String courseFilter, Integer lessonFilter, int limit);

    Optional<Course> findCourse(String title);

    /**
     * Indexed course titles in alphabetical order.
     */
    List<String> courseTitles();

    int chunkCount(String courseTitle);
}
