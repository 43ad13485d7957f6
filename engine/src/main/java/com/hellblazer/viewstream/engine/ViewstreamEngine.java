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
import com.hellblazer.viewstream.common.HealthStatus;
import com.hellblazer.viewstream.progressive.ItemLoader;
import com.hellblazer.viewstream.progressive.LoadOptions;
import com.hellblazer.viewstream.progressive.ProgressiveScheduler;
import com.hellblazer.viewstream.resource.ViewportPool;
import com.hellblazer.viewstream.resource.ViewportResourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Owns a viewport pool, the lazy activation layer on top of it and a progressive scheduler whose sessions draw
 * viewports from the layer.
 *
 * @author hal.hildebrand
 */
public class ViewstreamEngine implements AutoCloseable {
    private static final Logger log            = LoggerFactory.getLogger(ViewstreamEngine.class);
    private static final int    BACKLOG_FACTOR  = 10;

    private final ViewstreamProfile    profile;
    private final ViewportPool         pool;
    private final LazyActivationLayer  activation;
    private final ProgressiveScheduler scheduler;
    private final PooledViewportBinder binder;

    private volatile boolean closed = false;

    public ViewstreamEngine(ViewstreamProfile profile, ItemLoader itemLoader) {
        this(profile, itemLoader, ViewportResourceFactory.NONE);
    }

    public ViewstreamEngine(ViewstreamProfile profile, ItemLoader itemLoader, ViewportResourceFactory resourceFactory) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.pool = new ViewportPool(profile.pool(), resourceFactory);
        this.activation = new LazyActivationLayer(profile.activation(), new PooledViewportMaterializer(pool));
        this.scheduler = new ProgressiveScheduler(profile.progressive(), itemLoader);
        this.binder = new PooledViewportBinder(activation, profile.activation().getActivationJoinTimeout());
        scheduler.setViewportBinder(binder);
        log.info("Viewstream engine started");
    }

    /**
     * Create, queue and start loading a session.
     *
     * @return the session id
     */
    public String load(List<String> itemIds, LoadOptions options) {
        return scheduler.loadDataset(itemIds, options);
    }

    public boolean cancel(String sessionId) {
        return scheduler.cancelSession(sessionId);
    }

    /**
     * Pool health plus what the activation layer and the scheduler report about load.
     */
    public HealthStatus healthCheck() {
        var health = new HealthStatus.Builder();
        var memory = activation.getMemoryUsage();
        if (memory.isOverThreshold()) {
            health.issue("Active viewports over memory threshold",
                         "Deactivate unused viewports or lower maxActiveViewports");
        }
        int backlog = scheduler.getQueuedChunkCount();
        if (backlog > profile.progressive().getMaxConcurrentChunks() * BACKLOG_FACTOR) {
            health.issue("Progressive loading backlog of " + backlog + " chunks",
                         "Increase maxConcurrentChunks or cancel stale sessions");
        }
        return pool.getHealthStatus().combine(health.build());
    }

    public ViewstreamProfile getProfile() {
        return profile;
    }

    public ViewportPool getPool() {
        return pool;
    }

    public LazyActivationLayer getActivationLayer() {
        return activation;
    }

    public ProgressiveScheduler getScheduler() {
        return scheduler;
    }

    public PooledViewportBinder getBinder() {
        return binder;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the scheduler, then the activation layer, then the pool.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.close();
        activation.close();
        pool.close();
        log.info("Viewstream engine closed");
    }
}
