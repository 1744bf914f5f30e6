package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.ConversationStoreUnavailableException;
import com.example.CourseRag.model.ConversationTurn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Session history kept as one Redis list per session. Each append is a single RPUSH of all new
 * turns followed by an LTRIM to the newest {@code 2 * maxHistory} entries, so a question and its
 * answer always land together. Redis failures surface as
 * {@link ConversationStoreUnavailableException}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "rag.memory.store", havingValue = "redis")
public class RedisConversationStore implements ConversationStore {

    private static final String KEY_PREFIX = "course:memory:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final int maxEntries;

    public RedisConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, RagProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.maxEntries = properties.getMaxHistory() * 2;
    }

    @Override
    public List<ConversationTurn> getHistory(String sessionId) {
        if (sessionId == null) {
            return List.of();
        }
        List<String> rawMessages;
        try {
            rawMessages = redisTemplate.opsForList().range(buildKey(sessionId), 0, -1);
        } catch (DataAccessException e) {
            throw new ConversationStoreUnavailableException("Failed to load history of session " + sessionId, e);
        }
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<ConversationTurn> turns = new ArrayList<>();
        for (String raw : rawMessages) {
            try {
                turns.add(objectMapper.readValue(raw, ConversationTurn.class));
            } catch (JsonProcessingException e) {
                // Skip malformed entries instead of failing the whole load
                log.warn("Dropping unreadable history entry for session {}: {}", sessionId, e.getOriginalMessage());
            }
        }
        return turns;
    }

    @Override
    public void append(String sessionId, String role, String text) {
        push(sessionId, List.of(new ConversationTurn(role, text, Instant.now().toEpochMilli())));
    }

    @Override
    public void appendExchange(String sessionId, String question, String answer) {
        long now = Instant.now().toEpochMilli();
        push(sessionId, List.of(
                new ConversationTurn(ConversationTurn.USER, question, now),
                new ConversationTurn(ConversationTurn.ASSISTANT, answer, now)));
    }

    private void push(String sessionId, List<ConversationTurn> turns) {
        String key = buildKey(sessionId);
        List<String> payloads = new ArrayList<>(turns.size());
        for (ConversationTurn turn : turns) {
            try {
                payloads.add(objectMapper.writeValueAsString(turn));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize conversation turn", e);
            }
        }

        try {
            redisTemplate.opsForList().rightPushAll(key, payloads);
            if (maxEntries == 0) {
                redisTemplate.delete(key);
                return;
            }
            redisTemplate.opsForList().trim(key, -maxEntries, -1);
        } catch (DataAccessException e) {
            throw new ConversationStoreUnavailableException("Failed to append to session " + sessionId, e);
        }
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}
