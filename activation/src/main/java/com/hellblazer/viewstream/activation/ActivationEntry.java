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

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable state of a registered viewport, guarded by the owning layer's lock.
 */
final class ActivationEntry {
    final String              id;
    final Map<String, Object> metadata;

    ViewportInstanceState      state = ViewportInstanceState.UNINITIALIZED;
    long                       lastAccessTime;
    int                        accessCount;
    int                        priority;
    Object                     surface;
    Materialization            materialization;
    CompletableFuture<Boolean> activation;
    ScheduledFuture<?>         inactivityTimer;
    // Exempt from inactivity expiry and resource freeing
    boolean                    pinned;
    // Bumped on every re-arm so that a stale timer firing late is ignored
    long                       timerGeneration;

    ActivationEntry(String id, Map<String, Object> metadata) {
        this.id = id;
        this.metadata = Map.copyOf(metadata);
    }

    void cancelInactivityTimer() {
        timerGeneration++;
        if (inactivityTimer != null) {
            inactivityTimer.cancel(false);
            inactivityTimer = null;
        }
    }

    ViewportInstance snapshot() {
        return new ViewportInstance(id, state, lastAccessTime, accessCount, priority, surface,
                                    materialization == null ? null : materialization.resourceEngineId(), metadata);
    }
}
