package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.model.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime session history. Each session holds an immutable snapshot that is replaced
 * atomically on append, so reads never block and writes to one session serialize.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "rag.memory.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryConversationStore implements ConversationStore {

    private final int maxEntries;

    private final Map<String, List<ConversationTurn>> sessions = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryConversationStore(RagProperties properties) {
        this(properties.getMaxHistory());
    }

    public InMemoryConversationStore(int maxHistory) {
        if (maxHistory < 0) {
            throw new IllegalArgumentException("maxHistory must not be negative");
        }
        this.maxEntries = maxHistory * 2;
    }

    @Override
    public List<ConversationTurn> getHistory(String sessionId) {
        if (sessionId == null) {
            return List.of();
        }
        return sessions.getOrDefault(sessionId, List.of());
    }

    @Override
    public void append(String sessionId, String role, String text) {
        appendTurns(sessionId, List.of(new ConversationTurn(role, text, Instant.now().toEpochMilli())));
    }

    @Override
    public void appendExchange(String sessionId, String question, String answer) {
        long now = Instant.now().toEpochMilli();
        appendTurns(sessionId, List.of(
                new ConversationTurn(ConversationTurn.USER, question, now),
                new ConversationTurn(ConversationTurn.ASSISTANT, answer, now)));
    }

    private void appendTurns(String sessionId, List<ConversationTurn> turns) {
        sessions.compute(sessionId, (id, current) -> {
            List<ConversationTurn> next = new ArrayList<>(current == null ? List.of() : current);
            next.addAll(turns);
            // FIFO eviction down to the most recent maxEntries turns
            int overflow = next.size() - maxEntries;
            if (overflow > 0) {
                next.subList(0, overflow).clear();
            }
            return List.copyOf(next);
        });
        log.debug("Session {} now holds {} turns", sessionId, sessions.get(sessionId).size());
    }
}
