package com.example.ConfluenceAgent.auth;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialRegistryTest {

    private final CredentialRegistry registry = new CredentialRegistry();

    @Test
    void credentialsAreScopedToTheirPrincipal() {
        registry.store("s1", new AtlassianCredential("token-1", "cloud-1", null, null));

        assertThat(registry.find("s1")).map(AtlassianCredential::cloudId).contains("cloud-1");
        assertThat(registry.find("s2")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void reauthenticationReplacesTheCredential() {
        registry.store("s1", new AtlassianCredential("old", "cloud-1", null, null));
        registry.store("s1", new AtlassianCredential("new", "cloud-2", null, null));

        assertThat(registry.find("s1")).map(AtlassianCredential::accessToken).contains("new");
    }

    @Test
    void removeForgetsTheCredential() {
        registry.store("s1", new AtlassianCredential("token", "cloud", null, null));

        registry.remove("s1");

        assertThat(registry.find("s1")).isEmpty();
    }

    @Test
    void authenticationForOnePrincipalIsSerialized() throws Exception {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return registry.withAuthenticationLock("shared", () -> {
                        int now = concurrent.incrementAndGet();
                        maxConcurrent.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        concurrent.decrementAndGet();
                        return true;
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    void lockEntriesAreReleasedOnceNobodyHoldsThem() throws Exception {
        authenticationForOnePrincipalIsSerialized();

        assertThat(registry.lockCount()).isZero();
    }

    @Test
    void removingTheCredentialWhileAuthenticatingKeepsTheLockExclusive() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = pool.submit(() -> registry.withAuthenticationLock("p1", () -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                holding.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                concurrent.decrementAndGet();
                return true;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            registry.remove("p1");

            Future<?> second = pool.submit(() -> registry.withAuthenticationLock("p1", () -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                concurrent.decrementAndGet();
                return true;
            }));
            Thread.sleep(50);
            assertThat(second.isDone()).isFalse();

            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(registry.lockCount()).isZero();
    }

    @Test
    void credentialWithoutExpiryLapsesAfterTheFallbackTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        CredentialRegistry expiring = new CredentialRegistry(clock, Duration.ofMinutes(10));
        expiring.store("p1", new AtlassianCredential("token", "cloud", null, null));

        clock.advance(Duration.ofMinutes(9));
        assertThat(expiring.find("p1")).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(expiring.find("p1")).isEmpty();
        assertThat(expiring.size()).isZero();
    }

    @Test
    void tokenExpiryClaimWinsOverTheFallbackTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        CredentialRegistry expiring = new CredentialRegistry(clock, Duration.ofHours(1));
        TokenMetadata metadata = new TokenMetadata(null, null, null, null,
                Instant.parse("2025-01-01T00:05:00Z"), null);
        expiring.store("p1", new AtlassianCredential("token", "cloud", null, metadata));

        clock.advance(Duration.ofMinutes(5));

        assertThat(expiring.find("p1")).isEmpty();
    }

    @Test
    void storingEvictsExpiredCredentialsOfOtherPrincipals() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        CredentialRegistry expiring = new CredentialRegistry(clock, Duration.ofMinutes(1));
        for (int i = 0; i < 10; i++) {
            expiring.store("p" + i, new AtlassianCredential("token", "cloud", null, null));
        }
        assertThat(expiring.size()).isEqualTo(10);

        clock.advance(Duration.ofMinutes(2));
        expiring.store("fresh", new AtlassianCredential("token", "cloud", null, null));

        assertThat(expiring.size()).isEqualTo(1);
        assertThat(expiring.find("fresh")).isPresent();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
