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

import com.hellblazer.viewstream.activation.LazyActivationLayer;
import com.hellblazer.viewstream.activation.PooledViewportMaterializer;
import com.hellblazer.viewstream.progressive.ViewportBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gives each loading session a viewport through the lazy activation layer. The session's logical viewport
 * {@code session-<sessionId>} is registered, pinned and activated when its first chunk is dispatched, and unregistered
 * when the session completes or is cancelled. Every later dispatch activates it again, which records the access and
 * reacquires a pool slot if the viewport was deactivated in between.
 * <p>
 * Activation bypasses the layer's admission check so that sessions already loading keep their viewports; the pool's
 * capacity is what pushes back.
 *
 * @author hal.hildebrand
 */
public class PooledViewportBinder implements ViewportBinder {
    public static final String VIEWPORT_PREFIX = "session-";

    private static final Logger log = LoggerFactory.getLogger(PooledViewportBinder.class);

    private final LazyActivationLayer layer;
    private final Duration            activationTimeout;
    private final Set<String>         bound = ConcurrentHashMap.newKeySet();

    public PooledViewportBinder(LazyActivationLayer layer, Duration activationTimeout) {
        this.layer = Objects.requireNonNull(layer, "layer");
        this.activationTimeout = Objects.requireNonNull(activationTimeout, "activationTimeout");
    }

    public static String viewportId(String sessionId) {
        return VIEWPORT_PREFIX + sessionId;
    }

    @Override
    public boolean bind(String sessionId) {
        var viewportId = viewportId(sessionId);
        if (bound.contains(sessionId)) {
            if (!activate(sessionId, viewportId)) {
                log.debug("Session {} lost its viewport and none is available", sessionId);
                return false;
            }
            return true;
        }
        layer.registerViewport(viewportId, Map.of(PooledViewportMaterializer.CONTENT_ID, viewportId));
        layer.pinViewport(viewportId);
        if (!activate(sessionId, viewportId)) {
            layer.unregisterViewport(viewportId);
            return false;
        }
        bound.add(sessionId);
        log.debug("Session {} bound to viewport {}", sessionId, viewportId);
        return true;
    }

    private boolean activate(String sessionId, String viewportId) {
        try {
            return layer.activateViewport(viewportId, null, true)
                        .get(activationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Activating viewport for session {} failed: {}", sessionId, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void unbind(String sessionId) {
        if (!bound.remove(sessionId)) {
            return;
        }
        layer.unregisterViewport(viewportId(sessionId));
        log.debug("Session {} released its viewport", sessionId);
    }

    public boolean isBound(String sessionId) {
        return bound.contains(sessionId);
    }

    public int getBoundCount() {
        return bound.size();
    }
}
