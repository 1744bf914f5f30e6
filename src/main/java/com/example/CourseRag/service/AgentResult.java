package com.example.CourseRag.service;

import com.example.CourseRag.model.Source;

import java.util.List;

/**
 * Terminal output of one agent run.
 *
 * answer     - final answer text
 * sources    - sources of the last executed tool call, empty if no tool ran
 * toolRounds - 0 if the model answered directly, 1 if a tool round was executed
 */
public record AgentResult(String answer, List<Source> sources, int toolRounds) {

    public AgentResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
