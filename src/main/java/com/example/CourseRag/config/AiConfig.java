package com.example.CourseRag.config;

import com.example.CourseRag.service.CourseAgent;
import com.example.CourseRag.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AiConfig {

    /**
     * The agent runs on the chat model named by rag.chat-provider.
     * If that model is not configured in this environment (e.g. missing API key),
     * fall back to whichever of DeepSeek / OpenAI is available.
     */
    @Bean
    public CourseAgent courseAgent(
            RagProperties properties,
            ToolRegistry toolRegistry,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();

        ChatModel chatModel;
        if ("openai".equalsIgnoreCase(properties.getChatProvider())) {
            chatModel = openAiModel != null ? openAiModel : deepseekModel;
        } else {
            chatModel = deepseekModel != null ? deepseekModel : openAiModel;
        }

        if (chatModel == null) {
            throw new IllegalStateException("No ChatModel beans are available to build the course agent");
        }
        log.info("Course agent using {} (model={})", chatModel.getClass().getSimpleName(), properties.getChatModel());
        return new CourseAgent(chatModel, toolRegistry, properties);
    }
}
