package com.botical.gateway.approval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Session-scoped answers, keyed by session and tool name, so a repeated call
 * of an already-answered tool skips the prompt.
 */
public class ApprovalDecisionCache {

    private static final Duration DEFAULT_TTL = Duration.ofHours(8);
    private static final long MAX_ENTRIES = 10_000;

    private record Key(String sessionId, String toolName) {
    }

    private final Cache<Key, ApprovalDecision> cache;

    public ApprovalDecisionCache() {
        this(DEFAULT_TTL);
    }

    public ApprovalDecisionCache(Duration ttl) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(MAX_ENTRIES)
                .build();
    }

    public void remember(String sessionId, String toolName, ApprovalDecision decision) {
        if (sessionId == null || toolName == null || decision == null) {
            return;
        }
        cache.put(new Key(sessionId, toolName), decision);
    }

    public Optional<ApprovalDecision> lookup(String sessionId, String toolName) {
        if (sessionId == null || toolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(new Key(sessionId, toolName)));
    }

    /**
     * @return number of decisions dropped
     */
    public int invalidateSession(String sessionId) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.sessionId().equals(sessionId));
        return before - cache.asMap().size();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
