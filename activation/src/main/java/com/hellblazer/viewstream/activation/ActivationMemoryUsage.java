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
 * Estimated memory held by active viewports.
 *
 * @param total     budget the estimate is measured against
 * @param used      sum of the per-viewport estimates
 * @param viewports estimate per active viewport id
 * @param threshold memory threshold above which resources are freed
 */
public record ActivationMemoryUsage(long total, long used, Map<String, Long> viewports, long threshold) {

    public ActivationMemoryUsage {
        viewports = Map.copyOf(viewports);
    }

    public boolean isOverThreshold() {
        return used > threshold;
    }
}
