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
 * Scheduler notifications. Chunk callbacks run on the worker that processed the chunk; exceptions are logged and
 * ignored.
 */
public interface ProgressiveLoadListener {

    default void chunkQueued(ProgressiveLoadRequest request) {
    }

    default void chunkStarted(ChunkProgress progress) {
    }

    /**
     * Called after every item of a loading chunk.
     */
    default void chunkProgress(ChunkProgress progress) {
    }

    default void chunkCompleted(ChunkProgress progress, List<ItemResult> results) {
    }

    default void chunkFailed(ChunkProgress progress, Throwable error) {
    }

    /**
     * Retained results of a completed chunk were dropped under memory pressure.
     */
    default void chunkEvicted(String chunkId) {
    }

    /**
     * Every chunk of the session reached a terminal state; the status is COMPLETED or ERROR.
     */
    default void sessionCompleted(SessionProgress progress) {
    }

    default void sessionCancelled(String sessionId) {
    }
}
