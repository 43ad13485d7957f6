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

/**
 * Creates and releases the rendering resources behind a logical viewport. Implementations must not call back into
 * the {@link LazyActivationLayer}; dematerialization runs while the layer holds its lock.
 */
public interface ViewportMaterializer {

    /**
     * Materializer that allocates nothing and completes immediately.
     */
    ViewportMaterializer IMMEDIATE = new ViewportMaterializer() {
        @Override
        public CompletableFuture<Materialization> materialize(String viewportId, Map<String, Object> metadata,
                                                              Object surface) {
            return CompletableFuture.completedFuture(new Materialization("renderingEngine-" + viewportId, surface));
        }

        @Override
        public void dematerialize(String viewportId, Materialization materialization) {
        }
    };

    /**
     * Materialize the viewport. A failed future moves the viewport to ERROR.
     */
    CompletableFuture<Materialization> materialize(String viewportId, Map<String, Object> metadata, Object surface);

    void dematerialize(String viewportId, Materialization materialization);
}
