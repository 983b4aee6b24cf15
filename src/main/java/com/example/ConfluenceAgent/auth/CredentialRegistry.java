package com.example.ConfluenceAgent.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory credential store keyed by principal.
 *
 * Credentials are never persisted. An entry lives until the token's {@code exp} claim, or for
 * {@link #DEFAULT_TTL} when the token carries no expiry; expired entries are dropped on lookup
 * and whenever a new credential is stored.
 *
 * Authentication for one principal is serialized through {@link #withAuthenticationLock}.
 * Lock entries are reference counted and removed once no thread holds or waits on them.
 */
@Component
public class CredentialRegistry {

    private static final Logger log = LoggerFactory.getLogger(CredentialRegistry.class);

    static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Map<String, StoredCredential> credentials = new ConcurrentHashMap<>();
    private final Map<String, PrincipalLock> authenticationLocks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration fallbackTtl;

    public CredentialRegistry() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    CredentialRegistry(Clock clock, Duration fallbackTtl) {
        this.clock = clock;
        this.fallbackTtl = fallbackTtl;
    }

    public Optional<AtlassianCredential> find(String principal) {
        if (principal == null) {
            return Optional.empty();
        }
        StoredCredential stored = credentials.get(principal);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(clock.instant())) {
            credentials.remove(principal, stored);
            log.info("Atlassian credential for principal={} expired", principal);
            return Optional.empty();
        }
        return Optional.of(stored.credential());
    }

    public void store(String principal, AtlassianCredential credential) {
        Instant now = clock.instant();
        evictExpired(now);

        Instant expiresAt = credential.metadata().expiresAt() != null
                ? credential.metadata().expiresAt()
                : now.plus(fallbackTtl);
        StoredCredential previous = credentials.put(principal, new StoredCredential(credential, expiresAt));
        if (previous != null) {
            log.info("Replaced Atlassian credential for principal={} ({} -> {})",
                    principal, previous.credential().cloudId(), credential.cloudId());
        } else {
            log.info("Stored Atlassian credential for principal={}: {}", principal, credential);
        }
    }

    public void remove(String principal) {
        credentials.remove(principal);
    }

    /**
     * Run an authentication attempt while holding the principal's lock.
     */
    public <T> T withAuthenticationLock(String principal, Supplier<T> action) {
        PrincipalLock entry = authenticationLocks.compute(principal, (key, existing) -> {
            PrincipalLock lock = existing == null ? new PrincipalLock() : existing;
            lock.users++;
            return lock;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            authenticationLocks.compute(principal, (key, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int size() {
        return credentials.size();
    }

    int lockCount() {
        return authenticationLocks.size();
    }

    private void evictExpired(Instant now) {
        credentials.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    }

    private record StoredCredential(AtlassianCredential credential, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    // users is only touched inside ConcurrentHashMap.compute for this key
    private static final class PrincipalLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
