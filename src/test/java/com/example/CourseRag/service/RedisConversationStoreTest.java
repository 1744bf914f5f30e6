package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.ConversationStoreUnavailableException;
import com.example.CourseRag.model.ConversationTurn;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisConversationStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ListOperations<String, String> listOperations;
    private RedisConversationStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = Mockito.mock(StringRedisTemplate.class);
        listOperations = Mockito.mock(ListOperations.class);
        when(redisTemplate.opsForList()).thenReturn(listOperations);

        RagProperties properties = new RagProperties();
        properties.setMaxHistory(2);
        store = new RedisConversationStore(redisTemplate, objectMapper, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void appendPushesThenTrimsToBound() throws Exception {
        store.append("s1", ConversationTurn.USER, "hello");

        ArgumentCaptor<Collection<String>> payloads = ArgumentCaptor.forClass(Collection.class);
        verify(listOperations).rightPushAll(eq("course:memory:s1"), payloads.capture());
        verify(listOperations).trim("course:memory:s1", -4, -1);

        List<String> pushed = List.copyOf(payloads.getValue());
        assertEquals(1, pushed.size());
        ConversationTurn stored = objectMapper.readValue(pushed.get(0), ConversationTurn.class);
        assertEquals("user", stored.role());
        assertEquals("hello", stored.content());
    }

    @Test
    @SuppressWarnings("unchecked")
    void exchangeIsPushedInOneCommand() throws Exception {
        store.appendExchange("s1", "What is MCP?", "A protocol.");

        ArgumentCaptor<Collection<String>> payloads = ArgumentCaptor.forClass(Collection.class);
        verify(listOperations, times(1)).rightPushAll(eq("course:memory:s1"), payloads.capture());
        verify(listOperations, never()).rightPush(anyString(), anyString());

        List<String> pushed = List.copyOf(payloads.getValue());
        assertEquals(2, pushed.size());
        assertEquals("user", objectMapper.readValue(pushed.get(0), ConversationTurn.class).role());
        assertEquals("A protocol.", objectMapper.readValue(pushed.get(1), ConversationTurn.class).content());
    }

    @Test
    void unreachableRedisOnReadIsBackendFailure() {
        when(listOperations.range("course:memory:s1", 0, -1))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        assertThrows(ConversationStoreUnavailableException.class, () -> store.getHistory("s1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void unreachableRedisOnWriteIsBackendFailure() {
        when(listOperations.rightPushAll(anyString(), any(Collection.class)))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        assertThrows(ConversationStoreUnavailableException.class,
                () -> store.appendExchange("s1", "question", "answer"));
    }

    @Test
    void historySkipsUnreadableEntries() throws Exception {
        String good = objectMapper.writeValueAsString(new ConversationTurn("assistant", "hi", 1L));
        when(listOperations.range("course:memory:s1", 0, -1)).thenReturn(List.of("{not json", good));

        List<ConversationTurn> history = store.getHistory("s1");

        assertEquals(1, history.size());
        assertEquals("hi", history.get(0).content());
    }

    @Test
    void unknownSessionIsEmpty() {
        when(listOperations.range("course:memory:none", 0, -1)).thenReturn(List.of());

        assertTrue(store.getHistory("none").isEmpty());
    }
}
