package com.example.CourseRag;

import com.example.CourseRag.repository.CourseIndexStore;
import com.example.CourseRag.repository.InMemoryCourseIndexStore;
import com.example.CourseRag.service.ConversationStore;
import com.example.CourseRag.service.CourseAgent;
import com.example.CourseRag.service.InMemoryConversationStore;
import com.example.CourseRag.tools.CourseOutlineTool;
import com.example.CourseRag.tools.CourseSearchTool;
import com.example.CourseRag.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(CourseRagApplicationTests.TestAiConfiguration.class)
class CourseRagApplicationTests {

    @Autowired
    private CourseIndexStore indexStore;

    @Autowired
    private ConversationStore conversationStore;

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private CourseAgent courseAgent;

    @Test
    void contextLoadsWithInMemoryDefaults() {
        assertInstanceOf(InMemoryCourseIndexStore.class, indexStore);
        assertInstanceOf(InMemoryConversationStore.class, conversationStore);
        assertNotNull(courseAgent);
        assertTrue(toolRegistry.findByName(CourseSearchTool.NAME).isPresent());
        assertTrue(toolRegistry.findByName(CourseOutlineTool.NAME).isPresent());
        assertTrue(indexStore.courseTitles().isEmpty());
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        EmbeddingModel embeddingModel() {
            return Mockito.mock(EmbeddingModel.class);
        }

        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
