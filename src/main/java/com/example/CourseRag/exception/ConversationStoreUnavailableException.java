package com.example.CourseRag.exception;

/**
 * The session history backend could not be read or written.
 */
public class ConversationStoreUnavailableException extends CourseRagException {

    public ConversationStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
