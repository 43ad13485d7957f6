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

import com.hellblazer.viewstream.resource.ViewportHandle;
import com.hellblazer.viewstream.resource.ViewportPool;
import com.hellblazer.viewstream.resource.ViewportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Materializes a logical viewport by acquiring a slot from a {@link ViewportPool}. The slot type comes from the
 * {@value #TYPE} metadata entry (a {@link ViewportType} or its name, STACK when absent) and the content id from the
 * {@value #CONTENT_ID} entry, defaulting to the viewport id. An exhausted pool surfaces as a failed materialization.
 */
public class PooledViewportMaterializer implements ViewportMaterializer {
    public static final String TYPE       = "type";
    public static final String CONTENT_ID = "contentId";

    private static final Logger log = LoggerFactory.getLogger(PooledViewportMaterializer.class);

    private final ViewportPool pool;

    public PooledViewportMaterializer(ViewportPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public CompletableFuture<Materialization> materialize(String viewportId, Map<String, Object> metadata,
                                                          Object surface) {
        ViewportType type;
        try {
            type = typeOf(metadata);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        var contentId = metadata.get(CONTENT_ID) instanceof String ? (String) metadata.get(CONTENT_ID) : viewportId;

        try {
            var handle = pool.acquire(type, contentId);
            if (handle.isEmpty()) {
                return CompletableFuture.failedFuture(
                new IllegalStateException("No pooled viewport available for " + viewportId));
            }
            log.debug("Viewport {} materialized on pool slot {}", viewportId, handle.get().poolId());
            return CompletableFuture.completedFuture(new Materialization(handle.get().poolId(), handle.get()));
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void dematerialize(String viewportId, Materialization materialization) {
        if (!(materialization.handle() instanceof ViewportHandle)) {
            log.warn("Viewport {} has no pooled slot to release", viewportId);
            return;
        }
        var handle = (ViewportHandle) materialization.handle();
        if (!pool.release(handle.poolId())) {
            log.warn("Pool slot {} of viewport {} was not in use", handle.poolId(), viewportId);
        }
    }

    static ViewportType typeOf(Map<String, Object> metadata) {
        var type = metadata.get(TYPE);
        if (type == null) {
            return ViewportType.STACK;
        }
        if (type instanceof ViewportType) {
            return (ViewportType) type;
        }
        return ViewportType.valueOf(type.toString().trim().toUpperCase(Locale.ROOT));
    }
}
