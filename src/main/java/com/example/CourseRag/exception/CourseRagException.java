package com.example.CourseRag.exception;

/**
 * Base type for failures raised by the course Q&A pipeline.
 */
public class CourseRagException extends RuntimeException {

    public CourseRagException(String message) {
        super(message);
    }

    public CourseRagException(String message, Throwable cause) {
        super(message, cause);
    }
}
