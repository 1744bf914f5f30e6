package com.example.CourseRag.exception;

/**
 * A transcript document is missing its required header lines.
 */
public class MalformedDocumentException extends CourseRagException {

    public MalformedDocumentException(String message) {
        super(message);
    }
}
