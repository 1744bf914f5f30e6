package com.example.CourseRag.service;

import com.example.CourseRag.model.ChatLog;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.repository.ChatLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatLogServiceTest {

    private final ChatLogRepository repository = Mockito.mock(ChatLogRepository.class);
    private final ChatLogService service = new ChatLogService(repository, new ObjectMapper());

    @Test
    void recordsQuestionAnswerAndSources() {
        service.recordChat("s1", "deepseek-chat", "What is MCP?", "A protocol.",
                List.of(new Source("MCP", 1, "https://example.com/mcp/1")), 1);

        ArgumentCaptor<ChatLog> saved = ArgumentCaptor.forClass(ChatLog.class);
        verify(repository).save(saved.capture());
        ChatLog log = saved.getValue();
        assertEquals("s1", log.getSessionId());
        assertEquals("deepseek-chat", log.getModel());
        assertEquals("What is MCP?", log.getQuestion());
        assertEquals("A protocol.", log.getAnswer());
        assertEquals("[{\"course_title\":\"MCP\",\"lesson_number\":1,\"link\":\"https://example.com/mcp/1\"}]",
                log.getSourcesJson());
        assertEquals(1, log.getToolRounds());
    }

    @Test
    void storageFailureDoesNotPropagate() {
        when(repository.save(any(ChatLog.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> service.recordChat("s1", "m", "q", "a", List.of(), 0));
    }
}
