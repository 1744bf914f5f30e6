package com.example.CourseRag.exception;

public class ModelUnavailableException extends CourseRagException {

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
