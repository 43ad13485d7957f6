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
 * Chunk load priority; level 1 is the most urgent bucket.
 *
 * @author hal.hildebrand
 */
public enum LoadPriority {
    /** Needed immediately, e.g. the slice on screen */
    CRITICAL(1),
    HIGH(2),
    NORMAL(3),
    /** Background prefetch */
    LOW(4),
    IDLE(5);

    private final int level;

    LoadPriority(int level) {
        this.level = level;
    }

    public static LoadPriority fromLevel(int level) {
        for (var priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("No priority with level " + level);
    }

    public int level() {
        return level;
    }
}
