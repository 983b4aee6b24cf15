package com.example.ConfluenceAgent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockagentcore.BedrockAgentCoreClient;

@Configuration
public class AwsConfig {

    /**
     * AgentCore Identity data-plane client. Credentials come from the default AWS provider
     * chain and are resolved on first use.
     */
    @Bean
    BedrockAgentCoreClient bedrockAgentCoreClient(ConfluenceAgentProperties properties) {
        return BedrockAgentCoreClient.builder()
                .region(Region.of(properties.authorization().awsRegion()))
                .build();
    }
}
