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
package com.hellblazer.viewstream.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Memory pressure estimator over a pluggable {@link ResourcePressureSource}. The monitor does no sampling of its own;
 * every query reads the source, so callers decide the cadence.
 *
 * @author hal.hildebrand
 */
public class MemoryMonitor {
    public static final double DEFAULT_THRESHOLD = 0.8;

    private static final Logger log = LoggerFactory.getLogger(MemoryMonitor.class);

    private final ResourcePressureSource                source;
    private final double                                threshold;
    private final AtomicReference<MemoryPressureLevel> lastLevel = new AtomicReference<>(MemoryPressureLevel.NORMAL);

    public MemoryMonitor() {
        this(ResourcePressureSource.jvmHeap(), DEFAULT_THRESHOLD);
    }

    public MemoryMonitor(ResourcePressureSource source) {
        this(source, DEFAULT_THRESHOLD);
    }

    public MemoryMonitor(ResourcePressureSource source, double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be within (0, 1]: " + threshold);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.threshold = threshold;
    }

    /**
     * Current usage, clamped to [0, 1]. A failing source reads as 0 so that pressure handling never takes down the
     * caller's loop.
     */
    public double getCurrentUsage() {
        double usage;
        try {
            usage = source.currentUsage();
        } catch (RuntimeException e) {
            log.warn("Resource pressure source failed, assuming no pressure", e);
            return 0.0;
        }
        if (Double.isNaN(usage)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, usage));
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isOverThreshold() {
        return getCurrentUsage() > threshold;
    }

    /**
     * Classify the current usage. Level transitions are logged once.
     */
    public MemoryPressureLevel getPressureLevel() {
        var level = MemoryPressureLevel.fromUsage(getCurrentUsage());
        var previous = lastLevel.getAndSet(level);
        if (previous != level) {
            if (level.isAtLeast(MemoryPressureLevel.HIGH)) {
                log.warn("Memory pressure changed from {} to {}", previous, level);
            } else {
                log.debug("Memory pressure changed from {} to {}", previous, level);
            }
        }
        return level;
    }

    public void dispose() {
        lastLevel.set(MemoryPressureLevel.NORMAL);
    }
}
