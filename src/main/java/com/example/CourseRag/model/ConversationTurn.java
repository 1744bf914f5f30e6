package com.example.CourseRag.model;

/**
 * One entry of a session history. An exchange is a user turn followed by an assistant turn.
 */
public record ConversationTurn(String role, String content, long timestamp) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
}
