package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.ModelUnavailableException;
import com.example.CourseRag.model.ConversationTurn;
import com.example.CourseRag.model.Source;
import com.example.CourseRag.tools.ToolOutcome;
import com.example.CourseRag.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the language model through at most one round of tool execution.
 *
 * <pre>
 * IDLE -> AWAITING_MODEL -> DONE                                   (answered directly)
 * IDLE -> AWAITING_MODEL -> TOOL_CALLS_REQUESTED -> EXECUTING_TOOLS
 *      -> AWAITING_MODEL -> DONE                                   (second response is final)
 * </pre>
 *
 * Tool execution happens here, not inside Spring AI: the chat options declare the tools but
 * disable internal tool execution, so the round limit and the sources stay under our control.
 */
@Slf4j
public class CourseAgent {

    static final int MAX_TOOL_ROUNDS = 1;

    static final String NO_RESPONSE = "Unable to generate response.";

    static final String SYSTEM_PROMPT = """
            You are an AI assistant specialized in course materials and educational content with access to search tools for course information.

            Available Tools:
            1. search_course_content: for questions about specific course content, detailed explanations, code examples or technical details
            2. get_course_outline: for questions about course structure, the list of lessons, course links or course overviews

            Tool Usage Guidelines:
            - Use a tool only for course-specific questions; answer general knowledge questions from your own knowledge
            - When using the outline tool, return the course title, course link, total number of lessons and the complete lesson list with numbers and titles
            - Synthesize tool results into accurate, fact-based responses
            - If tools yield no results, state this clearly without offering alternatives
            - After tool results come back you will not be able to call tools again, so answer completely

            Response Protocol:
            - Provide direct answers only: no reasoning process, search explanations, or question-type analysis
            - Do not mention "based on the search results"

            All responses must be brief, educational, clear, and supported by examples when they aid understanding.
            """;

    enum State {
        IDLE, AWAITING_MODEL, TOOL_CALLS_REQUESTED, EXECUTING_TOOLS, DONE
    }

    private final ChatModel chatModel;
    private final ToolRegistry toolRegistry;
    private final RagProperties properties;

    public CourseAgent(ChatModel chatModel, ToolRegistry toolRegistry, RagProperties properties) {
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    public AgentResult run(String query, List<ConversationTurn> history) {
        State state = State.IDLE;
        ToolCallingChatOptions options = buildOptions();

        List<Message> transcript = new ArrayList<>();
        transcript.add(new SystemMessage(buildSystemPrompt(history)));
        transcript.add(new UserMessage(query));

        List<Source> sources = List.of();
        int toolRounds = 0;

        state = transition(state, State.AWAITING_MODEL);
        AssistantMessage reply = call(transcript, options);

        while (reply.hasToolCalls() && toolRounds < MAX_TOOL_ROUNDS) {
            state = transition(state, State.TOOL_CALLS_REQUESTED);
            transcript.add(reply);

            state = transition(state, State.EXECUTING_TOOLS);
            List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
            for (AssistantMessage.ToolCall toolCall : reply.getToolCalls()) {
                log.info("Executing tool '{}' args={}", toolCall.name(), toolCall.arguments());
                ToolOutcome outcome = toolRegistry.execute(toolCall);
                responses.add(new ToolResponseMessage.ToolResponse(toolCall.id(), toolCall.name(), outcome.observation()));
                // an empty outcome (no results, unknown course, failure) keeps earlier sources
                if (!outcome.sources().isEmpty()) {
                    sources = outcome.sources();
                }
            }
            transcript.add(new ToolResponseMessage(responses));
            toolRounds++;

            state = transition(state, State.AWAITING_MODEL);
            reply = call(transcript, options);
        }

        if (reply.hasToolCalls()) {
            log.info("Model requested {} more tool call(s) after the final round; ignoring them",
                    reply.getToolCalls().size());
        }
        transition(state, State.DONE);

        String answer = reply.getText();
        if (answer == null || answer.isBlank()) {
            answer = NO_RESPONSE;
        }
        return new AgentResult(answer, sources, toolRounds);
    }

    private AssistantMessage call(List<Message> transcript, ToolCallingChatOptions options) {
        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(List.copyOf(transcript), options));
        } catch (RuntimeException ex) {
            throw new ModelUnavailableException("Language model call failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ModelUnavailableException("Language model returned an empty response", null);
        }
        return response.getResult().getOutput();
    }

    private ToolCallingChatOptions buildOptions() {
        return ToolCallingChatOptions.builder()
                .model(properties.getChatModel())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .toolCallbacks(toolRegistry.toolCallbacks())
                .internalToolExecutionEnabled(false)
                .build();
    }

    private static String buildSystemPrompt(List<ConversationTurn> history) {
        String rendered = ConversationStore.renderHistory(history);
        if (rendered.isEmpty()) {
            return SYSTEM_PROMPT;
        }
        return SYSTEM_PROMPT + "\nPrevious conversation:\n" + rendered;
    }

    private static State transition(State from, State to) {
        log.debug("Agent {} -> {}", from, to);
        return to;
    }
}
