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
 * Progress of a session, summed over its chunks.
 *
 * @param percentage processed items over total items, rounded, 0 to 100
 */
public record SessionProgress(String sessionId, int totalChunks, int completedChunks, int loadingChunks,
                              int errorChunks, int cancelledChunks, int totalItems, int loadedItems,
                              int failedItems, long totalBytes, long loadedBytes, int percentage,
                              SessionStatus status) {
}
