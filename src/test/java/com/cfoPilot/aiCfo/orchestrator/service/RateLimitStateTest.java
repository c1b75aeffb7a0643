package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitStateTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-01T10:00:00Z"));
    private final RateLimitState state = new RateLimitState(clock, Duration.ofSeconds(60));

    @Test
    void notCoolingDownBeforeAnyRateLimit() {
        assertThat(state.isCoolingDown()).isFalse();
        assertThat(state.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void blocksForTheCooldownWindow() {
        state.recordRateLimit();

        clock.advance(Duration.ofSeconds(59));
        assertThat(state.isCoolingDown()).isTrue();
        assertThat(state.remaining()).isEqualTo(Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(2));
        assertThat(state.isCoolingDown()).isFalse();
        assertThat(state.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void laterRateLimitRestartsWindow() {
        state.recordRateLimit();
        clock.advance(Duration.ofSeconds(50));
        state.recordRateLimit();
        clock.advance(Duration.ofSeconds(50));

        assertThat(state.isCoolingDown()).isTrue();
    }
}
