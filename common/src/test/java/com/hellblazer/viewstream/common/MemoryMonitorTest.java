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

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MemoryMonitor and MemoryPressureLevel
 */
public class MemoryMonitorTest {

    @Test
    void testThresholdCheck() {
        var reading = new AtomicReference<>(0.5);
        var monitor = new MemoryMonitor(reading::get);

        assertEquals(0.5, monitor.getCurrentUsage(), 0.0001);
        assertFalse(monitor.isOverThreshold());

        reading.set(0.85);
        assertTrue(monitor.isOverThreshold());

        // Exactly at the threshold is not over it
        reading.set(0.8);
        assertFalse(monitor.isOverThreshold());
    }

    @Test
    void testUsageIsClamped() {
        var reading = new AtomicReference<>(1.7);
        var monitor = new MemoryMonitor(reading::get);
        assertEquals(1.0, monitor.getCurrentUsage());

        reading.set(-0.3);
        assertEquals(0.0, monitor.getCurrentUsage());

        reading.set(Double.NaN);
        assertEquals(0.0, monitor.getCurrentUsage());
    }

    @Test
    void testFailingSourceReadsAsIdle() {
        var monitor = new MemoryMonitor(() -> {
            throw new IllegalStateException("sensor offline");
        });
        assertEquals(0.0, monitor.getCurrentUsage());
        assertFalse(monitor.isOverThreshold());
        assertEquals(MemoryPressureLevel.NORMAL, monitor.getPressureLevel());
    }

    @Test
    void testPressureLevels() {
        assertEquals(MemoryPressureLevel.NORMAL, MemoryPressureLevel.fromUsage(0.0));
        assertEquals(MemoryPressureLevel.NORMAL, MemoryPressureLevel.fromUsage(0.59));
        assertEquals(MemoryPressureLevel.MODERATE, MemoryPressureLevel.fromUsage(0.60));
        assertEquals(MemoryPressureLevel.HIGH, MemoryPressureLevel.fromUsage(0.80));
        assertEquals(MemoryPressureLevel.CRITICAL, MemoryPressureLevel.fromUsage(0.92));
        assertEquals(MemoryPressureLevel.EMERGENCY, MemoryPressureLevel.fromUsage(0.99));

        assertTrue(MemoryPressureLevel.CRITICAL.isAtLeast(MemoryPressureLevel.HIGH));
        assertFalse(MemoryPressureLevel.MODERATE.isAtLeast(MemoryPressureLevel.HIGH));
    }

    @Test
    void testMonitorReportsLevel() {
        var reading = new AtomicReference<>(0.1);
        var monitor = new MemoryMonitor(reading::get);
        assertEquals(MemoryPressureLevel.NORMAL, monitor.getPressureLevel());

        reading.set(0.96);
        assertEquals(MemoryPressureLevel.EMERGENCY, monitor.getPressureLevel());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(() -> 0.1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new MemoryMonitor(() -> 0.1, 1.5));
        assertThrows(NullPointerException.class, () -> new MemoryMonitor(null, 0.5));
        assertThrows(IllegalArgumentException.class, () -> ResourcePressureSource.fixed(2.0));
    }

    @Test
    void testJvmHeapSourceIsAFraction() {
        double usage = ResourcePressureSource.jvmHeap().currentUsage();
        assertTrue(usage >= 0.0 && usage <= 1.0, "usage " + usage);
    }
}
