package com.example.CourseRag.tools;

/**
 * A capability the language model may invoke by name.
 * The model sees name, description and input schema; the agent calls {@link #execute}.
 */
public interface AiToolDefinition {
    /**
     * Unique tool name, as declared to the model.
     */
    String name();

    /**
     * Natural language description visible to the LLM.
     */
    String description();

    /**
     * JSON schema of the tool arguments.
     */
    String inputSchema();

    /**
     * Run the tool with the JSON arguments produced by the model.
     * Always returns an observation the model can read; failures may still be thrown
     * and are turned into observations by the caller.
     */
    ToolOutcome execute(String argumentsJson);
}
