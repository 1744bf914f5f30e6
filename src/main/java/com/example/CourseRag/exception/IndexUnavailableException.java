package com.example.CourseRag.exception;

public class IndexUnavailableException extends CourseRagException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
