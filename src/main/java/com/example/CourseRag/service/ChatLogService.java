package com.example.CourseRag.service;

import com.example.CourseRag.model.ChatLog;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.repository.ChatLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit trail of answered questions. Recording is best effort: a failure is logged and the
 * answer is still returned to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatLogService {

    private final ChatLogRepository chatLogRepository;
    private final ObjectMapper objectMapper;

    public void recordChat(String sessionId,
                           String model,
                           String question,
                           String answer,
                           List<Source> sources,
                           int toolRounds) {
        ChatLog chatLog = new ChatLog();
        chatLog.setSessionId(sessionId);
        chatLog.setModel(model);
        chatLog.setQuestion(question);
        chatLog.setAnswer(answer);
        chatLog.setSourcesJson(serializeSources(sources));
        chatLog.setToolRounds(toolRounds);

        try {
            chatLogRepository.save(chatLog);
        } catch (DataAccessException e) {
            log.warn("Failed to record chat log for session {}", sessionId, e);
        }
    }

    private String serializeSources(List<Source> sources) {
        if (sources == null || sources.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(sources);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize sources for chat log", e);
            return "[]";
        }
    }
}
