package com.example.ConfluenceAgent.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "ConfluenceAgent API",
                version = "v1",
                description = "Streaming Confluence agent with on-demand Atlassian authorization"
        )
)
public class OpenApiConfig {
}
