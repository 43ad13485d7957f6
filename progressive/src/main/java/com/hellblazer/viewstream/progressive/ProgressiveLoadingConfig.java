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

/**
 * Configuration for {@link ProgressiveScheduler}.
 *
 * @author hal.hildebrand
 */
public class ProgressiveLoadingConfig {

    private int      chunkSize            = 10;
    private int      maxConcurrentChunks  = 3;
    private int      priorityLevels       = 5;
    private double   memoryThreshold      = 0.8;
    private boolean  adaptiveChunkSize    = true;
    private boolean  networkAdaptation    = true;
    private Duration tickInterval         = Duration.ofMillis(100);
    private Duration chunkTimeout         = Duration.ofSeconds(30);
    private long     bytesPerItemEstimate = 512 * 1024;
    private boolean  autoStart            = true;

    public static ProgressiveLoadingConfig defaultConfig() {
        return new ProgressiveLoadingConfig();
    }

    /**
     * Fixed chunk size and a single worker; chunks load strictly in priority order.
     */
    public static ProgressiveLoadingConfig sequential() {
        return new ProgressiveLoadingConfig().withAdaptiveChunkSize(false).withMaxConcurrentChunks(1);
    }

    /**
     * Base number of items per chunk before adaptive sizing.
     */
    public int getChunkSize() {
        return chunkSize;
    }

    public int getMaxConcurrentChunks() {
        return maxConcurrentChunks;
    }

    public int getPriorityLevels() {
        return priorityLevels;
    }

    /**
     * Memory usage fraction above which completed chunk results are evicted and chunks are sized down.
     */
    public double getMemoryThreshold() {
        return memoryThreshold;
    }

    public boolean isAdaptiveChunkSize() {
        return adaptiveChunkSize;
    }

    public boolean isNetworkAdaptation() {
        return networkAdaptation;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public Duration getChunkTimeout() {
        return chunkTimeout;
    }

    public long getBytesPerItemEstimate() {
        return bytesPerItemEstimate;
    }

    /**
     * Whether the tick loop starts with the scheduler; otherwise {@link ProgressiveScheduler#start()} or manual
     * {@link ProgressiveScheduler#tick()} calls drive dispatch.
     */
    public boolean isAutoStart() {
        return autoStart;
    }

    // Fluent API for configuration

    public ProgressiveLoadingConfig withChunkSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        this.chunkSize = size;
        return this;
    }

    public ProgressiveLoadingConfig withMaxConcurrentChunks(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Max concurrent chunks must be positive");
        }
        this.maxConcurrentChunks = max;
        return this;
    }

    public ProgressiveLoadingConfig withPriorityLevels(int levels) {
        if (levels < 1 || levels > LoadPriority.values().length) {
            throw new IllegalArgumentException("Priority levels must be within [1, 5]: " + levels);
        }
        this.priorityLevels = levels;
        return this;
    }

    public ProgressiveLoadingConfig withMemoryThreshold(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Memory threshold must be within (0, 1]: " + threshold);
        }
        this.memoryThreshold = threshold;
        return this;
    }

    public ProgressiveLoadingConfig withAdaptiveChunkSize(boolean adaptive) {
        this.adaptiveChunkSize = adaptive;
        return this;
    }

    public ProgressiveLoadingConfig withNetworkAdaptation(boolean adapt) {
        this.networkAdaptation = adapt;
        return this;
    }

    public ProgressiveLoadingConfig withTickInterval(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Tick interval must be positive");
        }
        this.tickInterval = interval;
        return this;
    }

    public ProgressiveLoadingConfig withChunkTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Chunk timeout must be positive");
        }
        this.chunkTimeout = timeout;
        return this;
    }

    public ProgressiveLoadingConfig withBytesPerItemEstimate(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Bytes per item estimate must be non-negative");
        }
        this.bytesPerItemEstimate = bytes;
        return this;
    }

    public ProgressiveLoadingConfig withAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
        return this;
    }

    @Override
    public String toString() {
        return String.format(
        "ProgressiveLoadingConfig[chunkSize=%d, maxConcurrent=%d, levels=%d, memoryThreshold=%.2f, adaptive=%s, network=%s, tick=%s, timeout=%s]",
        chunkSize, maxConcurrentChunks, priorityLevels, memoryThreshold, adaptiveChunkSize, networkAdaptation,
        tickInterval, chunkTimeout);
    }
}
