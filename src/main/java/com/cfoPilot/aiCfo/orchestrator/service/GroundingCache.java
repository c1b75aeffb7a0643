package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingContext;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Grounding cache - keeps retrieved evidence per (org, intent) using Caffeine.
 *
 * Entries expire a fixed time after they were written. When disabled, every lookup loads.
 */
@Slf4j
@Component
public class GroundingCache {

    private final boolean enabled;
    private final Cache<Key, GroundingContext> cache;

    public GroundingCache(@Value("${ai-cfo.grounding.cache-enabled:true}") boolean enabled,
                          @Value("${ai-cfo.grounding.cache-ttl:5m}") Duration ttl) {
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .build();
    }

    /**
     * Returns the cached context or loads it. Concurrent loads of the same key run once.
     */
    public GroundingContext get(String orgId, IntentType intent, Supplier<GroundingContext> loader) {
        if (!enabled) {
            return loader.get();
        }
        Key key = new Key(orgId, intent);
        GroundingContext cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Grounding cache hit - orgId: {}, intent: {}", IdMasker.mask(orgId), intent.getWireName());
            return cached;
        }
        return cache.get(key, k -> loader.get());
    }

    public void invalidate(String orgId) {
        cache.asMap().keySet().removeIf(key -> key.orgId().equals(orgId));
    }

    public boolean isEnabled() {
        return enabled;
    }

    private record Key(String orgId, IntentType intent) {}
}
