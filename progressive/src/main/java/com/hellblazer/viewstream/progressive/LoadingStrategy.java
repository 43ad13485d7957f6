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
 * How a session's chunks are sized and prioritized.
 *
 * @author hal.hildebrand
 */
public enum LoadingStrategy {
    /**
     * Front-loaded: first chunk CRITICAL, second HIGH, the rest NORMAL. Smaller chunks for finer progress.
     */
    SEQUENTIAL(0.8) {
        @Override
        public LoadPriority priorityFor(int chunkIndex, int totalChunks) {
            if (chunkIndex == 0) {
                return LoadPriority.CRITICAL;
            }
            return chunkIndex == 1 ? LoadPriority.HIGH : LoadPriority.NORMAL;
        }
    },
    /**
     * Balanced: first two chunks HIGH, chunks before the 30% mark NORMAL, the rest LOW.
     */
    ADAPTIVE(1.0) {
        @Override
        public LoadPriority priorityFor(int chunkIndex, int totalChunks) {
            if (chunkIndex < 2) {
                return LoadPriority.HIGH;
            }
            return chunkIndex < totalChunks * 0.3 ? LoadPriority.NORMAL : LoadPriority.LOW;
        }
    },
    /**
     * Chunks spread evenly over the five priority levels in order.
     */
    PRIORITY_BASED(1.0) {
        @Override
        public LoadPriority priorityFor(int chunkIndex, int totalChunks) {
            int section = (int) Math.floor((double) chunkIndex / totalChunks * 5);
            return LoadPriority.fromLevel(Math.min(LoadPriority.IDLE.level(), section + 1));
        }
    },
    /**
     * The middle of the series first, on the assumption that readers navigate there. Larger chunks.
     */
    PREDICTIVE(1.2) {
        @Override
        public LoadPriority priorityFor(int chunkIndex, int totalChunks) {
            int distance = Math.abs(chunkIndex - totalChunks / 2);
            if (distance <= 1) {
                return LoadPriority.HIGH;
            }
            return distance <= 3 ? LoadPriority.NORMAL : LoadPriority.LOW;
        }
    };

    private final double chunkSizeMultiplier;

    LoadingStrategy(double chunkSizeMultiplier) {
        this.chunkSizeMultiplier = chunkSizeMultiplier;
    }

    public double chunkSizeMultiplier() {
        return chunkSizeMultiplier;
    }

    public abstract LoadPriority priorityFor(int chunkIndex, int totalChunks);
}
