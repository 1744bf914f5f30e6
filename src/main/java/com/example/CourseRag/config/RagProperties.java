package com.example.CourseRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the 'rag.*' properties from application.yml. Values are fixed for the lifetime of the process.
 */
@Data
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    /** Chunk window size in characters, prefix excluded. */
    private int chunkSize = 800;

    /** Characters shared between consecutive chunks of a lesson. */
    private int chunkOverlap = 100;

    /** Result limit used by the content search tool. */
    private int maxResults = 5;

    /** Exchanges (user + assistant) retained per session. */
    private int maxHistory = 2;

    /** Which chat model bean drives the agent: "deepseek" or "openai". */
    private String chatProvider = "deepseek";

    private String chatModel = "deepseek-chat";

    private String embeddingModel = "text-embedding-3-small";

    private int maxTokens = 800;

    private double temperature = 0.0;

    /** Directory of course transcripts loaded at startup. */
    private String docsPath = "docs";

    private Index index = new Index();

    private Memory memory = new Memory();

    @Data
    public static class Index {
        /** "memory" or "pgvector". */
        private String store = "memory";
    }

    @Data
    public static class Memory {
        /** "memory" or "redis". */
        private String store = "memory";
    }
}
