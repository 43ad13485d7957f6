package com.hellblazer.viewstream.resource;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * A reusable viewport slot. Instances are owned by {@link ViewportPool} and only mutated while holding the pool's
 * lock; callers see {@link ViewportHandle} snapshots.
 */
final class PooledViewport {

    final String              poolId;
    final String              viewportId;
    final long                createdAt;
    final Map<String, Object> metadata = new HashMap<>();

    ViewportType       type;
    ViewportState      state = ViewportState.AVAILABLE;
    long               lastUsedAt;
    int                usageCount;
    String             contentId;
    // Content of the last release, used to reclaim a slot still pending cleanup
    String             releasedContentId;
    Object             resource;
    ScheduledFuture<?> pendingCleanup;
    boolean            cleaning;

    PooledViewport(String poolId, String viewportId, ViewportType type, long createdAt, Object resource) {
        this.poolId = poolId;
        this.viewportId = viewportId;
        this.type = type;
        this.createdAt = createdAt;
        this.resource = resource;
    }

    /**
     * Record an acquisition for the given content.
     */
    void recordAcquire(String contentId, long now) {
        this.state = ViewportState.IN_USE;
        this.contentId = contentId;
        this.releasedContentId = null;
        this.lastUsedAt = now;
        this.usageCount++;
    }

    boolean isIdle(long now, long maxIdleMillis) {
        return state == ViewportState.AVAILABLE && lastUsedAt > 0 && now - lastUsedAt > maxIdleMillis;
    }

    ViewportHandle snapshot() {
        return new ViewportHandle(poolId, viewportId, type, state, contentId, resource, createdAt, lastUsedAt,
                                  usageCount);
    }

    @Override
    public String toString() {
        return String.format("PooledViewport[poolId=%s, type=%s, state=%s, content=%s, uses=%d]", poolId, type,
                             state, contentId, usageCount);
    }
}
