package com.example.ConfluenceAgent.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisChatMemoryServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private RedisChatMemoryService service;

    @BeforeEach
    void setUp() {
        service = new RedisChatMemoryService(redisTemplate, new ObjectMapper());
    }

    @Test
    void promptWithoutHistoryIsPassedThrough() {
        assertThat(service.buildTaskInput("find runbook", List.of())).isEqualTo("find runbook");
    }

    @Test
    void historyIsRenderedBeforeTheRequest() {
        List<RedisChatMemoryService.StoredMessage> history = List.of(
                new RedisChatMemoryService.StoredMessage("user", "search ops", 1L),
                new RedisChatMemoryService.StoredMessage("assistant", "Found 3 pages", 2L));

        assertThat(service.buildTaskInput("open the first", history)).isEqualTo("""
                Conversation History:
                user: search ops
                assistant: Found 3 pages

                User Request: open the first""");
    }

    @Test
    void loadsStoredMessagesAndSkipsMalformedOnes() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range("confluence-agent:memory:s1", -10, -1)).thenReturn(List.of(
                "{\"role\":\"user\",\"content\":\"hi\",\"timestamp\":1}",
                "not json"));

        assertThat(service.loadHistory("s1"))
                .containsExactly(new RedisChatMemoryService.StoredMessage("user", "hi", 1L));
    }

    @Test
    void redisOutageYieldsEmptyHistory() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);
        when(listOperations.range(anyString(), anyLong(), anyLong()))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.loadHistory("s1")).isEmpty();
    }

    @Test
    void temporarySessionsExpireQuickly() {
        when(redisTemplate.opsForList()).thenReturn(listOperations);

        service.appendTurn("temp-1", "q", "a", true);

        verify(redisTemplate).expire("confluence-agent:memory:temp-1", RedisChatMemoryService.TEMPORARY_TTL);
    }
}
