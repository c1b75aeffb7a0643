package com.cfoPilot.aiCfo.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide circuit breaker for the language capability.
 * A rate-limit error opens it for the cooldown window; last writer wins.
 */
@Slf4j
@Component
public class RateLimitState {

    private final Clock clock;
    private final Duration cooldown;
    private final AtomicReference<Instant> lastRateLimit = new AtomicReference<>();

    public RateLimitState(Clock clock, @Value("${ai-cfo.rate-limit.cooldown:60s}") Duration cooldown) {
        this.clock = clock;
        this.cooldown = cooldown;
    }

    public void recordRateLimit() {
        Instant now = clock.instant();
        lastRateLimit.set(now);
        log.warn("Language capability rate limited - AI calls paused for {}s", cooldown.toSeconds());
    }

    public boolean isCoolingDown() {
        Instant last = lastRateLimit.get();
        return last != null && clock.instant().isBefore(last.plus(cooldown));
    }

    public Duration remaining() {
        Instant last = lastRateLimit.get();
        if (last == null) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(clock.instant(), last.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
