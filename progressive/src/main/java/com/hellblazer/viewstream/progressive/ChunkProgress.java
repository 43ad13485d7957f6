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

/**
 * Progress of one chunk at a point in time.
 *
 * @param loadedItems                  items fetched successfully
 * @param failedItems                  items whose fetch failed
 * @param totalBytes                   estimated size of the chunk
 * @param estimatedTimeRemainingMillis remaining bytes over the observed speed, 0 when unknown
 * @param networkSpeed                 observed bytes per second for this chunk
 * @param error                        terminal error when the status is ERROR, otherwise null
 */
public record ChunkProgress(String chunkId, int chunkIndex, int totalChunks, int loadedItems, int failedItems,
                            int totalItems, long bytesLoaded, long totalBytes, long estimatedTimeRemainingMillis,
                            double networkSpeed, ChunkStatus status, Throwable error) {

    public int processedItems() {
        return loadedItems + failedItems;
    }
}
