package com.example.CourseRag.model;

/**
 * Outcome of loading a document directory.
 *
 * added   - courses newly indexed
 * skipped - documents whose course title was already indexed
 * failed  - documents that could not be read or parsed
 * chunks  - chunks stored for the newly indexed courses
 */
public record IngestionReport(int added, int skipped, int failed, int chunks) {

    public static IngestionReport empty() {
        return new IngestionReport(0, 0, 0, 0);
    }
}
