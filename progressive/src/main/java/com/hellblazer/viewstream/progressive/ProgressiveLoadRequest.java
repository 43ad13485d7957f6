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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A chunk of items to load: a contiguous slice of a session's item list. Everything but the priority is fixed at
 * creation; {@link ProgressiveScheduler#queueSession} rewrites the priority of every chunk it queues.
 *
 * @author hal.hildebrand
 */
public class ProgressiveLoadRequest {
    private final String       id;
    private final String       sessionId;
    private final List<String> itemIds;
    private final int          chunkIndex;
    private final int          totalChunks;
    private final long         estimatedSize;
    private final long         createdAt;
    private final Duration     timeout;

    private volatile LoadPriority               priority;
    private volatile Consumer<ChunkProgress>    onProgress;
    private volatile Consumer<List<ItemResult>> onComplete;
    private volatile Consumer<Throwable>        onError;

    /**
     * @param sessionId owning session, null for a standalone chunk
     */
    public ProgressiveLoadRequest(String id, String sessionId, List<String> itemIds, LoadPriority priority,
                                  int chunkIndex, int totalChunks, long estimatedSize, long createdAt,
                                  Duration timeout) {
        this.id = Objects.requireNonNull(id, "id");
        this.sessionId = sessionId;
        this.itemIds = List.copyOf(itemIds);
        this.priority = Objects.requireNonNull(priority, "priority");
        this.chunkIndex = chunkIndex;
        this.totalChunks = totalChunks;
        this.estimatedSize = estimatedSize;
        this.createdAt = createdAt;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static String chunkId(String sessionId, int chunkIndex) {
        return sessionId + "-chunk-" + chunkIndex;
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getItemIds() {
        return itemIds;
    }

    public LoadPriority getPriority() {
        return priority;
    }

    void setPriority(LoadPriority priority) {
        this.priority = priority;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getTotalChunks() {
        return totalChunks;
    }

    public long getEstimatedSize() {
        return estimatedSize;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Consumer<ChunkProgress> getOnProgress() {
        return onProgress;
    }

    public Consumer<List<ItemResult>> getOnComplete() {
        return onComplete;
    }

    public Consumer<Throwable> getOnError() {
        return onError;
    }

    public ProgressiveLoadRequest onProgress(Consumer<ChunkProgress> callback) {
        this.onProgress = callback;
        return this;
    }

    public ProgressiveLoadRequest onComplete(Consumer<List<ItemResult>> callback) {
        this.onComplete = callback;
        return this;
    }

    public ProgressiveLoadRequest onError(Consumer<Throwable> callback) {
        this.onError = callback;
        return this;
    }

    @Override
    public String toString() {
        return String.format("ProgressiveLoadRequest[id=%s, items=%d, priority=%s, chunk=%d/%d]", id,
                             itemIds.size(), priority, chunkIndex + 1, totalChunks);
    }
}
