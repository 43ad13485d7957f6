/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Viewstream.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewstream.progressive;

import java.util.List;

/**
 * An item list partitioned into chunks. The chunks cover the item list contiguously, in order, without overlap.
 *
 * @author hal.hildebrand
 */
public class LoadingSession {
    private final String                       sessionId;
    private final List<ProgressiveLoadRequest> chunks;
    private final int                          totalItems;
    private final LoadingStrategy              strategy;
    private final SessionMetadata              metadata;
    private final long                         createdAt;
    private volatile long                      lastAccessed;

    LoadingSession(String sessionId, List<ProgressiveLoadRequest> chunks, int totalItems, LoadingStrategy strategy,
                   SessionMetadata metadata, long createdAt) {
        this.sessionId = sessionId;
        this.chunks = List.copyOf(chunks);
        this.totalItems = totalItems;
        this.strategy = strategy;
        this.metadata = metadata;
        this.createdAt = createdAt;
        this.lastAccessed = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<ProgressiveLoadRequest> getChunks() {
        return chunks;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public LoadingStrategy getStrategy() {
        return strategy;
    }

    public SessionMetadata getMetadata() {
        return metadata;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    void touch(long now) {
        this.lastAccessed = now;
    }

    @Override
    public String toString() {
        return String.format("LoadingSession[id=%s, items=%d, chunks=%d, strategy=%s]", sessionId, totalItems,
                             chunks.size(), strategy);
    }
}
