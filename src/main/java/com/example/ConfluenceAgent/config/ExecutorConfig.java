package com.example.ConfluenceAgent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Runs agent invocations in the background while the caller drains the stream.
     */
    @Bean
    ThreadPoolTaskExecutor agentTaskExecutor(ConfluenceAgentProperties properties) {
        ConfluenceAgentProperties.Executor settings = properties.executor();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.corePoolSize());
        executor.setMaxPoolSize(settings.maxPoolSize());
        executor.setQueueCapacity(settings.queueCapacity());
        executor.setThreadNamePrefix("agent-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Separate pool for authorization flows, so a waiting invocation never starves
     * the pool its own authorization runs on. There is no queue: every flow gets a
     * thread at once and can publish its consent URL, and a flow beyond the pool size
     * is rejected rather than parked behind flows that may poll for minutes.
     */
    @Bean
    ThreadPoolTaskExecutor authorizationExecutor(ConfluenceAgentProperties properties) {
        int poolSize = properties.executor().authorizationPoolSize();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(0);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("authorization-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
