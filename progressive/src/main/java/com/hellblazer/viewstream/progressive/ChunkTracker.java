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

import java.util.concurrent.Future;

/**
 * Live progress of one chunk. Updated by the worker processing the chunk and by cancellation.
 */
final class ChunkTracker {
    final ProgressiveLoadRequest request;

    private ChunkStatus status = ChunkStatus.PENDING;
    private int         loadedItems;
    private int         failedItems;
    private long        bytesLoaded;
    private long        estimatedTimeRemainingMillis;
    private double      networkSpeed;
    private Throwable   error;
    private boolean     aborted;
    private long        startNanos;
    private Future<?>   current;

    ChunkTracker(ProgressiveLoadRequest request, double initialSpeed) {
        this.request = request;
        this.networkSpeed = initialSpeed;
    }

    /**
     * @return false if the chunk was aborted before it started
     */
    synchronized boolean start() {
        if (aborted) {
            return false;
        }
        status = ChunkStatus.LOADING;
        startNanos = System.nanoTime();
        return true;
    }

    synchronized void abort() {
        aborted = true;
        if (status == ChunkStatus.PENDING || status == ChunkStatus.LOADING) {
            status = ChunkStatus.CANCELLED;
        }
        if (current != null) {
            current.cancel(true);
        }
    }

    synchronized boolean isAborted() {
        return aborted;
    }

    /**
     * Track the in-flight item fetch so that an abort can cancel it.
     */
    synchronized void setCurrent(Future<?> fetch) {
        current = fetch;
        if (aborted && fetch != null) {
            fetch.cancel(true);
        }
    }

    synchronized void itemLoaded(long bytes) {
        if (status != ChunkStatus.LOADING) {
            return;
        }
        loadedItems++;
        bytesLoaded += bytes;
        updateRate();
    }

    synchronized void itemFailed() {
        if (status != ChunkStatus.LOADING) {
            return;
        }
        failedItems++;
        updateRate();
    }

    /**
     * Settle the terminal status; an abort wins over any failure or success.
     */
    synchronized ChunkStatus finish(Throwable failure) {
        current = null;
        if (aborted) {
            status = ChunkStatus.CANCELLED;
        } else if (failure != null) {
            status = ChunkStatus.ERROR;
            error = failure;
        } else {
            status = ChunkStatus.COMPLETED;
            estimatedTimeRemainingMillis = 0;
        }
        return status;
    }

    synchronized ChunkStatus status() {
        return status;
    }

    synchronized long bytesLoaded() {
        return bytesLoaded;
    }

    synchronized ChunkProgress snapshot() {
        return new ChunkProgress(request.getId(), request.getChunkIndex(), request.getTotalChunks(), loadedItems,
                                 failedItems, request.getItemIds().size(), bytesLoaded, request.getEstimatedSize(),
                                 estimatedTimeRemainingMillis, networkSpeed, status, error);
    }

    private void updateRate() {
        double elapsedSeconds = Math.max(System.nanoTime() - startNanos, 1_000_000L) / 1e9;
        networkSpeed = bytesLoaded / elapsedSeconds;
        long remaining = Math.max(0, request.getEstimatedSize() - bytesLoaded);
        estimatedTimeRemainingMillis = networkSpeed > 0 ? (long) (remaining / networkSpeed * 1000) : 0;
    }
}
