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

/**
 * Snapshot of a logical viewport as seen by callers of {@link LazyActivationLayer}.
 *
 * @param id               logical viewport id
 * @param state            lifecycle state at snapshot time
 * @param lastAccessTime   last activation or access in epoch millis, 0 if never accessed
 * @param accessCount      number of activations and accesses
 * @param priority         caller-assigned priority
 * @param surface          attached drawing surface, may be null
 * @param resourceEngineId id of the backing rendering resource while READY, otherwise null
 * @param metadata         registration metadata
 */
public record ViewportInstance(String id, ViewportInstanceState state, long lastAccessTime, int accessCount,
                               int priority, Object surface, String resourceEngineId, Map<String, Object> metadata) {

    public boolean isActive() {
        return state == ViewportInstanceState.READY;
    }
}
