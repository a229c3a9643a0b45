package com.example.shield.service;

import com.example.shield.config.ShieldProperties;
import com.example.shield.dto.RateLimitResult;
import com.example.shield.model.RateLimitTier;
import com.example.shield.model.SecurityEventType;
import com.example.shield.store.InMemoryRateWindowStore;
import com.example.shield.store.RateWindowStore;
import com.example.shield.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RateLimiterServiceTest {

    private static final String CLIENT = "10.0.0.7:Mozilla/5.0";

    private MutableClock clock;
    private ShieldProperties properties;
    private SecurityMonitorService monitor;
    private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        properties = new ShieldProperties();
        properties.getRateLimit().setTiers(new ArrayList<>(List.of(
                new RateLimitTier("auth", "/api/auth/**", 0, 15 * 60_000L, 5),
                new RateLimitTier("api", "/api/**", 10, 60_000L, 3))));
        monitor = mock(SecurityMonitorService.class);
        rateLimiter = new RateLimiterService(new InMemoryRateWindowStore(), monitor, properties, clock);
    }

    @Test
    void testAllowsUpToLimitThenRejects() {
        assertThat(rateLimiter.check(CLIENT, "api").block().getRemaining()).isEqualTo(2);
        assertThat(rateLimiter.check(CLIENT, "api").block().getRemaining()).isEqualTo(1);
        assertThat(rateLimiter.check(CLIENT, "api").block().getRemaining()).isZero();

        RateLimitResult rejected = rateLimiter.check(CLIENT, "api").block();

        assertThat(rejected.isAllowed()).isFalse();
        assertThat(rejected.getRemaining()).isZero();
        assertThat(rejected.getLimit()).isEqualTo(3);
        assertThat(rejected.getResetAtMillis())
                .isEqualTo(Instant.parse("2024-05-01T10:01:00Z").toEpochMilli());
        assertThat(rejected.retryAfterSeconds(clock.millis())).isEqualTo(60);
    }

    @Test
    void testWindowResetsAfterExpiry() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.check(CLIENT, "api").block();
        }

        clock.advance(Duration.ofSeconds(60));

        StepVerifier.create(rateLimiter.check(CLIENT, "api"))
                .assertNext(result -> {
                    assertThat(result.isAllowed()).isTrue();
                    assertThat(result.getRemaining()).isEqualTo(2);
                })
                .verifyComplete();
    }

    @Test
    void testBurstAcrossWindowBoundaryIsAdmitted() {
        // fixed windows admit up to twice the limit around a boundary
        rateLimiter.check(CLIENT, "api").block();
        clock.advance(Duration.ofMillis(59_999));
        assertThat(rateLimiter.check(CLIENT, "api").block().isAllowed()).isTrue();
        assertThat(rateLimiter.check(CLIENT, "api").block().isAllowed()).isTrue();

        clock.advance(Duration.ofMillis(1));
        for (int i = 0; i < 3; i++) {
            assertThat(rateLimiter.check(CLIENT, "api").block().isAllowed()).isTrue();
        }
        assertThat(rateLimiter.check(CLIENT, "api").block().isAllowed()).isFalse();
    }

    @Test
    void testIdentifiersAreIsolated() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.check(CLIENT, "api").block();
        }

        assertThat(rateLimiter.check("10.0.0.8:curl", "api").block().isAllowed()).isTrue();
        assertThat(rateLimiter.check(CLIENT, "auth").block().isAllowed()).isTrue();
    }

    @Test
    void testStoreFailureFailsOpenAndRecordsDegradedMode() {
        RateWindowStore failing = mock(RateWindowStore.class);
        when(failing.hit(anyString(), anyString(), anyLong(), anyLong()))
                .thenReturn(Mono.error(new IllegalStateException("store down")));
        RateLimiterService degraded = new RateLimiterService(failing, monitor, properties, clock);

        StepVerifier.create(degraded.check(CLIENT, "api"))
                .assertNext(result -> {
                    assertThat(result.isAllowed()).isTrue();
                    assertThat(result.isDegraded()).isTrue();
                    assertThat(result.getTier()).isEqualTo("api");
                })
                .verifyComplete();

        verify(monitor).logEvent(argThat(event -> event.getType() == SecurityEventType.RATE_LIMITER_DEGRADED
                && "api".equals(event.getDetails().get("tier"))));
    }

    @Test
    void testStoreThrowingSynchronouslyFailsOpen() {
        RateWindowStore failing = mock(RateWindowStore.class);
        when(failing.hit(anyString(), anyString(), anyLong(), anyLong()))
                .thenThrow(new IllegalStateException("boom"));
        RateLimiterService degraded = new RateLimiterService(failing, monitor, properties, clock);

        assertThat(degraded.check(CLIENT, "api").block().isAllowed()).isTrue();
    }

    @Test
    void testStalledStoreTimesOutAndFailsOpen() {
        properties.getRateLimit().setStoreTimeout(Duration.ofMillis(50));
        RateWindowStore stalled = mock(RateWindowStore.class);
        when(stalled.hit(anyString(), anyString(), anyLong(), anyLong())).thenReturn(Mono.never());
        RateLimiterService degraded = new RateLimiterService(stalled, monitor, properties, clock);

        StepVerifier.create(degraded.check(CLIENT, "api"))
                .assertNext(result -> assertThat(result.isDegraded()).isTrue())
                .verifyComplete();
    }

    @Test
    void testDegradedEventsAreThrottled() {
        RateWindowStore failing = mock(RateWindowStore.class);
        when(failing.hit(anyString(), anyString(), anyLong(), anyLong()))
                .thenReturn(Mono.error(new IllegalStateException("store down")));
        RateLimiterService degraded = new RateLimiterService(failing, monitor, properties, clock);

        degraded.check(CLIENT, "api").block();
        degraded.check(CLIENT, "api").block();
        clock.advance(Duration.ofSeconds(2));
        degraded.check(CLIENT, "api").block();

        verify(monitor, times(2)).logEvent(any());
    }

    @Test
    void testUnknownTierIsRejected() {
        assertThatThrownBy(() -> rateLimiter.check(CLIENT, "bogus"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bogus");
    }

    @Test
    void testResolveTierUsesPriority() {
        assertThat(rateLimiter.resolveTier("/api/auth/signin")).get()
                .extracting(RateLimitTier::getName).isEqualTo("auth");
        assertThat(rateLimiter.resolveTier("/api/articles/42")).get()
                .extracting(RateLimitTier::getName).isEqualTo("api");
        assertThat(rateLimiter.resolveTier("/about")).isEmpty();
    }

    @Test
    void testResetClearsAllTiersForIdentifier() {
        for (int i = 0; i < 4; i++) {
            rateLimiter.check(CLIENT, "api").block();
        }

        StepVerifier.create(rateLimiter.reset(CLIENT)).verifyComplete();

        assertThat(rateLimiter.check(CLIENT, "api").block().getRemaining()).isEqualTo(2);
    }

    @Test
    void testStatsAndSweep() {
        rateLimiter.check(CLIENT, "api").block();
        rateLimiter.check("other", "api").block();
        clock.advance(Duration.ofMinutes(2));

        assertThat(rateLimiter.stats().block().expiredWindows()).isEqualTo(2);
        assertThat(rateLimiter.sweepExpired(100).block()).isEqualTo(2);
        assertThat(rateLimiter.stats().block().totalWindows()).isZero();
    }

    @Test
    void testSweepContinuesPastFullBatches() {
        for (int i = 0; i < 7; i++) {
            rateLimiter.check("client-" + i, "api").block();
        }
        clock.advance(Duration.ofMinutes(2));

        assertThat(rateLimiter.sweepExpired(3).block()).isEqualTo(7);
        assertThat(rateLimiter.stats().block().totalWindows()).isZero();
    }

    @Test
    void testNonPositiveTierRejectedAtStartup() {
        properties.getRateLimit().setTiers(List.of(new RateLimitTier("broken", "/x/**", 0, 0, 5)));

        assertThatThrownBy(() -> new RateLimiterService(new InMemoryRateWindowStore(), monitor, properties, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
