package com.example.CourseRag.tools;

import com.example.CourseRag.model.Source;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void unknownToolBecomesObservation() {
        ToolRegistry registry = new ToolRegistry(List.of(new EchoTool("echo")));

        ToolOutcome outcome = registry.execute(call("teleport", "{}"));

        assertEquals("Tool 'teleport' not found", outcome.observation());
        assertTrue(outcome.sources().isEmpty());
    }

    @Test
    void toolFailureBecomesObservation() {
        ToolRegistry registry = new ToolRegistry(List.of(new EchoTool("echo")));

        ToolOutcome outcome = registry.execute(call("echo", "boom"));

        assertEquals("Tool execution failed: echo exploded", outcome.observation());
    }

    @Test
    void dispatchesByName() {
        ToolRegistry registry = new ToolRegistry(List.of(new EchoTool("echo"), new EchoTool("other")));

        ToolOutcome outcome = registry.execute(call("echo", "hello"));

        assertEquals("echo:hello", outcome.observation());
        assertEquals(List.of(new Source("echo", null, null)), outcome.sources());
    }

    @Test
    void callbacksExposeDefinitionsInRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry(List.of(new EchoTool("b"), new EchoTool("a")));

        List<ToolCallback> callbacks = registry.toolCallbacks();

        assertEquals(List.of("b", "a"), callbacks.stream().map(c -> c.getToolDefinition().name()).toList());
        assertEquals("Echoes its input", callbacks.get(0).getToolDefinition().description());
        assertEquals("a:echo-input", callbacks.get(1).call("echo-input"));
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThrows(IllegalStateException.class,
                () -> new ToolRegistry(List.of(new EchoTool("echo"), new EchoTool("echo"))));
    }

    private static AssistantMessage.ToolCall call(String name, String arguments) {
        return new AssistantMessage.ToolCall("call_1", "function", name, arguments);
    }

    private record EchoTool(String name) implements AiToolDefinition {

        @Override
        public String description() {
            return "Echoes its input";
        }

        @Override
        public String inputSchema() {
            return "{\"type\":\"object\"}";
        }

        @Override
        public ToolOutcome execute(String argumentsJson) {
            if ("boom".equals(argumentsJson)) {
                throw new IllegalStateException(name + " exploded");
            }
            return new ToolOutcome(name + ":" + argumentsJson, List.of(new Source(name, null, null)));
        }
    }
}
