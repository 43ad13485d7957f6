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
package com.hellblazer.viewstream.engine;

import com.hellblazer.viewstream.activation.LazyActivationConfig;
import com.hellblazer.viewstream.progressive.ProgressiveLoadingConfig;
import com.hellblazer.viewstream.resource.ViewportPoolConfiguration;

import java.util.Objects;

/**
 * Configuration of every component an engine wires together.
 *
 * @author hal.hildebrand
 */
public record ViewstreamProfile(ViewportPoolConfiguration pool, LazyActivationConfig activation,
                                ProgressiveLoadingConfig progressive) {

    public ViewstreamProfile {
        Objects.requireNonNull(pool, "pool");
        Objects.requireNonNull(activation, "activation");
        Objects.requireNonNull(progressive, "progressive");
    }

    public static ViewstreamProfile defaults() {
        return new ViewstreamProfile(ViewportPoolConfiguration.defaultConfig(), LazyActivationConfig.defaultConfig(),
                                     ProgressiveLoadingConfig.defaultConfig());
    }
}
