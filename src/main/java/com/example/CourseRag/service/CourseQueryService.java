package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.model.ConversationTurn;
import com.example.CourseRag.model.CourseStats;
import com.example.CourseRag.model.QueryRequest;
import com.example.CourseRag.model.QueryResponse;
import com.example.CourseRag.repository.CourseIndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Per-query orchestration:
 * - resolve or create the session
 * - load its history
 * - run the agent loop
 * - persist the exchange and return answer + sources
 *
 * A model failure propagates before anything is written, so session history stays untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseQueryService {

    private final CourseAgent courseAgent;
    private final ConversationStore conversationStore;
    private final CourseIndexStore indexStore;
    private final ChatLogService chatLogService;
    private final RagProperties properties;

    public QueryResponse query(QueryRequest request) {
        String sessionId = request.hasSession() ? request.sessionId() : conversationStore.newSessionId();
        List<ConversationTurn> history = conversationStore.getHistory(sessionId);
        log.info("Query for session {} ({} prior turns)", sessionId, history.size());

        AgentResult result = courseAgent.run(request.query(), history);

        conversationStore.appendExchange(sessionId, request.query(), result.answer());
        chatLogService.recordChat(
                sessionId,
                properties.getChatModel(),
                request.query(),
                result.answer(),
                result.sources(),
                result.toolRounds()
        );

        log.info("Answered session {} with {} source(s) after {} tool round(s)",
                sessionId, result.sources().size(), result.toolRounds());
        return new QueryResponse(result.answer(), result.sources(), sessionId);
    }

    public CourseStats courseStats() {
        List<String> titles = indexStore.courseTitles();
        return new CourseStats(titles.size(), titles);
    }
}
