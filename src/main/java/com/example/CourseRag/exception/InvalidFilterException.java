package com.example.CourseRag.exception;

/**
 * A course filter was supplied to a search but no indexed course could be resolved from it.
 */
public class InvalidFilterException extends CourseRagException {

    public InvalidFilterException(String courseFilter, Throwable cause) {
        super("Invalid course filter '" + courseFilter + "'", cause);
    }
}
