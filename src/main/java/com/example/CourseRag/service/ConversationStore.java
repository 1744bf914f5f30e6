package com.example.CourseRag.service;

import com.example.CourseRag.model.ConversationTurn;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bounded per-session conversation history. Sessions are created on first append and never
 * destroyed explicitly; an unknown id simply has no history.
 */
public interface ConversationStore {

    /**
     * Turns of a session, oldest first; empty for an unknown id.
     */
    List<ConversationTurn> getHistory(String sessionId);

    /**
     * Append one turn, then keep only the most recent {@code 2 * maxHistory} turns.
     */
    void append(String sessionId, String role, String text);

    /**
     * Append a user turn and the assistant reply in one write, so a session never holds a
     * question without its answer.
     */
    void appendExchange(String sessionId, String question, String answer);

    default String newSessionId() {
        return "session-" + UUID.randomUUID();
    }

    /**
     * Render history for the model prompt as "role: content" lines.
     */
    static String renderHistory(List<ConversationTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        return turns.stream()
                .map(turn -> turn.role() + ": " + turn.content())
                .collect(Collectors.joining("\n"));
    }
}
