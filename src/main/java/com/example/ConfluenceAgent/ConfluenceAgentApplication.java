package com.example.ConfluenceAgent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ConfluenceAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfluenceAgentApplication.class, args);
    }
}
