package com.example.ConfluenceAgent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Short conversation memory per session, stored as a Redis list of JSON messages.
 * Memory is a convenience: Redis failures are logged and the invocation carries on without it.
 */
@Service
@RequiredArgsConstructor
public class RedisChatMemoryService {

    private static final Logger log = LoggerFactory.getLogger(RedisChatMemoryService.class);

    private static final String KEY_PREFIX = "confluence-agent:memory:";

    /** Max number of messages (user + assistant) kept per session. */
    static final int MAX_MESSAGES_PER_SESSION = 10;

    /** Max number of messages rendered into the agent prompt. */
    static final int MAX_MESSAGES_IN_PROMPT = 6;

    static final Duration TEMPORARY_TTL = Duration.ofMinutes(1);

    /** Rolling TTL, refreshed on every appended turn. */
    static final Duration PERSISTENT_TTL = Duration.ofDays(7);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public List<StoredMessage> loadHistory(String sessionId) {
        String key = buildKey(sessionId);
        List<String> rawMessages;
        try {
            rawMessages = redisTemplate.opsForList().range(key, -MAX_MESSAGES_PER_SESSION, -1);
        } catch (DataAccessException e) {
            log.warn("Could not load chat memory for session={}: {}", sessionId, e.getMessage());
            return List.of();
        }
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<StoredMessage> messages = new ArrayList<>();
        for (String raw : rawMessages) {
            try {
                messages.add(objectMapper.readValue(raw, StoredMessage.class));
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed chat memory entry for session={}", sessionId);
            }
        }
        return messages;
    }

    /**
     * Append one turn (user + assistant), trim the window and refresh the TTL.
     */
    public void appendTurn(String sessionId, String userMessage, String assistantMessage, boolean temporary) {
        String key = buildKey(sessionId);
        long now = Instant.now().toEpochMilli();
        try {
            redisTemplate.opsForList().rightPushAll(key,
                    objectMapper.writeValueAsString(new StoredMessage("user", userMessage, now)),
                    objectMapper.writeValueAsString(new StoredMessage("assistant", assistantMessage, now)));
            redisTemplate.opsForList().trim(key, -MAX_MESSAGES_PER_SESSION, -1);
            redisTemplate.expire(key, temporary ? TEMPORARY_TTL : PERSISTENT_TTL);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Could not store chat memory for session={}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Agent input for a prompt: the bare prompt without history, otherwise the latest
     * messages followed by the new request.
     */
    public String buildTaskInput(String prompt, List<StoredMessage> history) {
        if (history == null || history.isEmpty()) {
            return prompt;
        }
        int startIdx = Math.max(0, history.size() - MAX_MESSAGES_IN_PROMPT);
        String rendered = history.subList(startIdx, history.size()).stream()
                .map(m -> m.role() + ": " + m.content())
                .collect(Collectors.joining("\n"));
        return "Conversation History:\n" + rendered + "\n\nUser Request: " + prompt;
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId;
    }

    public record StoredMessage(String role, String content, long timestamp) { }
}
