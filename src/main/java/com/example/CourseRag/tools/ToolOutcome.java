package com.example.CourseRag.tools;

import com.example.CourseRag.model.Source;

import java.util.List;

/**
 * Result of one tool invocation.
 *
 * observation - text handed back to the model
 * sources     - provenance of the content in the observation, empty when nothing was retrieved
 */
public record ToolOutcome(String observation, List<Source> sources) {

    public ToolOutcome {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static ToolOutcome of(String observation) {
        return new ToolOutcome(observation, List.of());
    }
}
