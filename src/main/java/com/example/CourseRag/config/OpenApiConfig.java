package com.example.CourseRag.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "CourseRag API",
                version = "v1",
                description = "Question answering over course transcripts"
        )
)
public class OpenApiConfig {
}
