package com.example.ConfluenceAgent;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.openai.api-key=test",
                "spring.ai.deepseek.api-key=test",
                "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
                "spring.datasource.driver-class-name=org.h2.Driver",
                "spring.datasource.username=sa",
                "spring.datasource.password=",
                "spring.jpa.hibernate.ddl-auto=create-drop",
                "spring.data.redis.repositories.enabled=false",
                "spring.sql.init.mode=never"
        }
)
@ActiveProfiles("test")
@Import(ConfluenceAgentApplicationTests.TestAiConfiguration.class)
class ConfluenceAgentApplicationTests {

    @Test
    void contextLoads() {
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
