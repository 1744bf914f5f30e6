package com.example.CourseRag.support;

public final class CourseFixtures {

    private CourseFixtures() {
    }

    public static final String INTRO = """
            Course Title: Intro
            Course Link: https://example.com/intro
            Course Instructor: Ada Lovelace
            Lesson 0: Basics
            Lesson Link: https://example.com/intro/0
            Variables hold values for later use. Functions group statements into reusable units. Loops repeat a block until a condition fails.
            Lesson 1: Collections
            Lists keep items in insertion order. Dictionaries map keys to values. Sets store unique members only.
            """;

    public static final String MCP = """
            Course Title: MCP: Build Rich-Context AI Apps
            Course Link: https://example.com/mcp
            Course Instructor: Elie Schoppik
            Lesson 0: Introduction
            Lesson Link: https://example.com/mcp/0
            The Model Context Protocol standardizes how applications provide context to language models. Servers expose tools, resources and prompts.
            Lesson 1: Building a server
            A server declares its tools with JSON schemas. Clients discover the tools and call them over a transport such as stdio.
            """;
}
