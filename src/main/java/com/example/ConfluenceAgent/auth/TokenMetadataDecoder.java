package com.example.ConfluenceAgent.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Best-effort introspection of JWT access tokens.
 * The signature is NOT verified; the result is only used for logging and display.
 */
@Component
@RequiredArgsConstructor
public class TokenMetadataDecoder {

    private static final Logger log = LoggerFactory.getLogger(TokenMetadataDecoder.class);

    private final ObjectMapper objectMapper;

    /**
     * Decode the claims section of a JWT.
     * Opaque tokens and malformed payloads yield {@link TokenMetadata#empty()}.
     */
    public TokenMetadata decode(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return TokenMetadata.empty();
        }
        String[] parts = accessToken.split("\\.");
        if (parts.length < 2) {
            return TokenMetadata.empty();
        }
        try {
            JsonNode claims = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            if (claims == null || !claims.isObject()) {
                return TokenMetadata.empty();
            }
            return new TokenMetadata(
                    text(claims, "iss"),
                    text(claims, "sub"),
                    audience(claims.get("aud")),
                    epochSeconds(claims.get("iat")),
                    epochSeconds(claims.get("exp")),
                    text(claims, "scope")
            );
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Access token is not a decodable JWT: {}", e.getMessage());
            return TokenMetadata.empty();
        }
    }

    private static String text(JsonNode claims, String name) {
        JsonNode node = claims.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String audience(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(v -> values.add(v.asText()));
            return String.join(" ", values);
        }
        return node.asText();
    }

    private static Instant epochSeconds(JsonNode node) {
        if (node == null || !node.canConvertToLong()) {
            return null;
        }
        return Instant.ofEpochSecond(node.asLong());
    }
}
