package com.example.ConfluenceAgent.auth;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Claims read from an access token without verifying it. Every field may be null.
 */
public record TokenMetadata(
        String issuer,
        String subject,
        String audience,
        Instant issuedAt,
        Instant expiresAt,
        String scope
) {
    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final TokenMetadata EMPTY = new TokenMetadata(null, null, null, null, null, null);

    public static TokenMetadata empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return issuer == null && subject == null && audience == null
                && issuedAt == null && expiresAt == null && scope == null;
    }

    /**
     * Expiry rendered in the system time zone, e.g. "2025-01-31 17:45:00".
     */
    public Optional<String> formattedExpiry() {
        return Optional.ofNullable(expiresAt)
                .map(exp -> EXPIRY_FORMAT.format(exp.atZone(ZoneId.systemDefault())));
    }
}
