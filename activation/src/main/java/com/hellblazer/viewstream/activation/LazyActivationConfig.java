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
package com.hellblazer.viewstream.activation;

import java.time.Duration;

/**
 * Configuration for {@link LazyActivationLayer}.
 *
 * @author hal.hildebrand
 */
public class LazyActivationConfig {
    private static final long MB = 1024L * 1024;

    private int      maxActiveViewports     = 4;
    private boolean  preloadAdjacent        = true;
    private Duration preloadDelay           = Duration.ofMillis(500);
    private Duration inactivityTimeout      = Duration.ofSeconds(30);
    private long     memoryThreshold        = 500 * MB;
    private long     bytesPerViewport       = 50 * MB;
    private boolean  predictiveLoading      = true;
    private Duration predictionInterval     = Duration.ofSeconds(5);
    private int      predictionWindow       = 10;
    private double   predictionThreshold    = 0.7;
    private Duration predictivePreloadDelay = Duration.ofSeconds(1);
    private Duration activationJoinTimeout  = Duration.ofSeconds(5);
    private Duration memoryCheckInterval    = Duration.ofSeconds(10);
    private int      historyLimit           = 100;
    private int      historyRetain          = 50;

    public static LazyActivationConfig defaultConfig() {
        return new LazyActivationConfig();
    }

    /**
     * Two active viewports, no speculative loading.
     */
    public static LazyActivationConfig lowMemory() {
        return new LazyActivationConfig().withMaxActiveViewports(2)
                                         .withMemoryThreshold(150 * MB)
                                         .withPreloadAdjacent(false)
                                         .withPredictiveLoading(false)
                                         .withInactivityTimeout(Duration.ofSeconds(10));
    }

    public int getMaxActiveViewports() {
        return maxActiveViewports;
    }

    public boolean isPreloadAdjacent() {
        return preloadAdjacent;
    }

    public Duration getPreloadDelay() {
        return preloadDelay;
    }

    /**
     * READY viewports not accessed for this long are deactivated.
     */
    public Duration getInactivityTimeout() {
        return inactivityTimeout;
    }

    public long getMemoryThreshold() {
        return memoryThreshold;
    }

    public long getBytesPerViewport() {
        return bytesPerViewport;
    }

    public boolean isPredictiveLoading() {
        return predictiveLoading;
    }

    public Duration getPredictionInterval() {
        return predictionInterval;
    }

    /**
     * Number of most recent accesses the prediction histogram is computed over.
     */
    public int getPredictionWindow() {
        return predictionWindow;
    }

    public double getPredictionThreshold() {
        return predictionThreshold;
    }

    public Duration getPredictivePreloadDelay() {
        return predictivePreloadDelay;
    }

    /**
     * Upper bound a caller waits when joining an activation already in flight.
     */
    public Duration getActivationJoinTimeout() {
        return activationJoinTimeout;
    }

    public Duration getMemoryCheckInterval() {
        return memoryCheckInterval;
    }

    /**
     * Access history length that triggers trimming down to {@link #getHistoryRetain()} entries.
     */
    public int getHistoryLimit() {
        return historyLimit;
    }

    public int getHistoryRetain() {
        return historyRetain;
    }

    // Fluent API for configuration

    public LazyActivationConfig withMaxActiveViewports(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Max active viewports must be positive");
        }
        this.maxActiveViewports = max;
        return this;
    }

    public LazyActivationConfig withPreloadAdjacent(boolean preload) {
        this.preloadAdjacent = preload;
        return this;
    }

    public LazyActivationConfig withPreloadDelay(Duration delay) {
        this.preloadDelay = requireNonNegative(delay, "Preload delay");
        return this;
    }

    public LazyActivationConfig withInactivityTimeout(Duration timeout) {
        this.inactivityTimeout = requirePositive(timeout, "Inactivity timeout");
        return this;
    }

    public LazyActivationConfig withMemoryThreshold(long bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("Memory threshold must be positive");
        }
        this.memoryThreshold = bytes;
        return this;
    }

    public LazyActivationConfig withBytesPerViewport(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Bytes per viewport must be non-negative");
        }
        this.bytesPerViewport = bytes;
        return this;
    }

    public LazyActivationConfig withPredictiveLoading(boolean enabled) {
        this.predictiveLoading = enabled;
        return this;
    }

    public LazyActivationConfig withPredictionInterval(Duration interval) {
        this.predictionInterval = requirePositive(interval, "Prediction interval");
        return this;
    }

    public LazyActivationConfig withPredictionWindow(int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("Prediction window must be positive");
        }
        this.predictionWindow = window;
        return this;
    }

    public LazyActivationConfig withPredictionThreshold(double threshold) {
        if (threshold < 0.0 || threshold >= 1.0) {
            throw new IllegalArgumentException("Prediction threshold must be within [0, 1): " + threshold);
        }
        this.predictionThreshold = threshold;
        return this;
    }

    public LazyActivationConfig withPredictivePreloadDelay(Duration delay) {
        this.predictivePreloadDelay = requireNonNegative(delay, "Predictive preload delay");
        return this;
    }

    public LazyActivationConfig withActivationJoinTimeout(Duration timeout) {
        this.activationJoinTimeout = requirePositive(timeout, "Activation join timeout");
        return this;
    }

    public LazyActivationConfig withMemoryCheckInterval(Duration interval) {
        this.memoryCheckInterval = requirePositive(interval, "Memory check interval");
        return this;
    }

    public LazyActivationConfig withHistory(int limit, int retain) {
        if (limit <= 0 || retain <= 0 || retain > limit) {
            throw new IllegalArgumentException("History retain must be within (0, limit]: " + retain + "/" + limit);
        }
        this.historyLimit = limit;
        this.historyRetain = retain;
        return this;
    }

    private static Duration requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }

    private static Duration requireNonNegative(Duration duration, String name) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
        return duration;
    }

    @Override
    public String toString() {
        return String.format(
        "LazyActivationConfig[maxActive=%d, preloadAdjacent=%s, inactivity=%s, memoryThreshold=%dMB, predictive=%s, threshold=%.2f]",
        maxActiveViewports, preloadAdjacent, inactivityTimeout, memoryThreshold / MB, predictiveLoading,
        predictionThreshold);
    }
}
