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
 * Coarse classification of memory pressure, ordered from least to most severe.
 */
public enum MemoryPressureLevel {
    NORMAL("Normal", 0.60),
    MODERATE("Moderate", 0.75),
    HIGH("High", 0.90),
    CRITICAL("Critical", 0.95),
    EMERGENCY("Emergency", Double.POSITIVE_INFINITY);

    private final String displayName;
    private final double upperBound;

    MemoryPressureLevel(String displayName, double upperBound) {
        this.displayName = displayName;
        this.upperBound = upperBound;
    }

    /**
     * Classify a usage fraction. Values below 0 are treated as 0.
     */
    public static MemoryPressureLevel fromUsage(double usage) {
        for (var level : values()) {
            if (usage < level.upperBound) {
                return level;
            }
        }
        return EMERGENCY;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Exclusive upper bound of the usage fraction for this level.
     */
    public double getUpperBound() {
        return upperBound;
    }

    public boolean isAtLeast(MemoryPressureLevel other) {
        return compareTo(other) >= 0;
    }
}
