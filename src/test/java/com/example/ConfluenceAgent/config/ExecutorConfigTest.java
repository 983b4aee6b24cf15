package com.example.ConfluenceAgent.config;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorConfigTest {

    private final ExecutorConfig config = new ExecutorConfig();

    @Test
    void pendingAuthorizationFlowsAllStartAtOnce() throws Exception {
        ThreadPoolTaskExecutor executor = config.authorizationExecutor(ConfluenceAgentProperties.defaults());
        executor.initialize();
        CountDownLatch started = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        try {
            for (int i = 0; i < 3; i++) {
                executor.execute(() -> {
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }

            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void flowBeyondThePoolSizeIsRejectedInsteadOfQueued() {
        ConfluenceAgentProperties properties = new ConfluenceAgentProperties(
                null, null, new ConfluenceAgentProperties.Executor(0, 0, 0, 1));
        ThreadPoolTaskExecutor executor = config.authorizationExecutor(properties);
        executor.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void authorizationPoolDefaultsToTheAgentPoolMaximum() {
        ConfluenceAgentProperties.Executor settings = ConfluenceAgentProperties.defaults().executor();

        assertThat(settings.authorizationPoolSize()).isEqualTo(settings.maxPoolSize()).isEqualTo(8);
    }
}
