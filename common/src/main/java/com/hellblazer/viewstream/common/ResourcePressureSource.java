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

/**
 * A reading of resource pressure as a fraction in [0, 1]. Implementations are supplied by the host (heap, GPU memory,
 * an external monitor) and must be cheap enough to call from a scheduler tick.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ResourcePressureSource {

    /**
     * Pressure derived from the JVM heap: used / max.
     */
    static ResourcePressureSource jvmHeap() {
        return () -> {
            var runtime = Runtime.getRuntime();
            long max = runtime.maxMemory();
            if (max <= 0 || max == Long.MAX_VALUE) {
                max = runtime.totalMemory();
            }
            long used = runtime.totalMemory() - runtime.freeMemory();
            return max <= 0 ? 0.0 : (double) used / max;
        };
    }

    /**
     * A constant reading, mostly useful for tests and for hosts without a meaningful measurement.
     */
    static ResourcePressureSource fixed(double fraction) {
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("Pressure must be within [0, 1]: " + fraction);
        }
        return () -> fraction;
    }

    /**
     * @return the current pressure, 0.0 for idle and 1.0 for exhausted
     */
    double currentUsage();
}
