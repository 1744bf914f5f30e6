package com.example.CourseRag.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Central registry for all AI tools: maps the tool name the model asks for to its implementation.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, AiToolDefinition> toolsByName;

    public ToolRegistry(List<AiToolDefinition> definitions) {
        // Index by name, keeping registration order for the schema sent to the model
        this.toolsByName = definitions.stream()
                .collect(Collectors.toMap(
                        AiToolDefinition::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate tool name: " + a.name());
                        },
                        LinkedHashMap::new
                ));
    }

    /**
     * Look up a tool definition by its name.
     */
    public Optional<AiToolDefinition> findByName(String name) {
        return Optional.ofNullable(toolsByName.get(name));
    }

    /**
     * Tool declarations for the chat options. The model only sees these definitions;
     * execution stays with the agent loop.
     */
    public List<ToolCallback> toolCallbacks() {
        return toolsByName.values().stream()
                .map(RegisteredToolCallback::new)
                .map(ToolCallback.class::cast)
                .toList();
    }

    /**
     * Dispatch one model-issued tool call. Unknown names and tool failures become observations.
     */
    public ToolOutcome execute(AssistantMessage.ToolCall toolCall) {
        AiToolDefinition tool = findByName(toolCall.name()).orElse(null);
        if (tool == null) {
            log.warn("Model requested unknown tool '{}'", toolCall.name());
            return ToolOutcome.of("Tool '" + toolCall.name() + "' not found");
        }
        try {
            return tool.execute(toolCall.arguments());
        } catch (RuntimeException ex) {
            log.warn("Tool '{}' failed: {}", toolCall.name(), ex.getMessage());
            return ToolOutcome.of("Tool execution failed: " + ex.getMessage());
        }
    }

    private static final class RegisteredToolCallback implements ToolCallback {

        private final AiToolDefinition tool;
        private final ToolDefinition definition;

        private RegisteredToolCallback(AiToolDefinition tool) {
            this.tool = tool;
            this.definition = ToolDefinition.builder()
                    .name(tool.name())
                    .description(tool.description())
                    .inputSchema(tool.inputSchema())
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            return tool.execute(toolInput).observation();
        }

        @Override
        public String call(String toolInput, ToolContext toolContext) {
            return call(toolInput);
        }
    }
}
