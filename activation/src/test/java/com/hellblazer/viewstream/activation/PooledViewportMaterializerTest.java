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
import com.hellblazer.viewstream.resource.ViewportPoolConfiguration;
import com.hellblazer.viewstream.resource.ViewportState;
import com.hellblazer.viewstream.resource.ViewportType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for materializing logical viewports on pooled slots
 */
public class PooledViewportMaterializerTest {

    private ViewportPool        pool;
    private LazyActivationLayer layer;

    @BeforeEach
    void setUp() {
        pool = new ViewportPool(new ViewportPoolConfiguration.Builder().withMinPoolSize(1)
                                                                       .withMaxPoolSize(1)
                                                                       .withInitialPoolSize(1)
                                                                       .withGarbageCollection(false)
                                                                       .withCleanupDelay(Duration.ofMinutes(1))
                                                                       .build());
        layer = new LazyActivationLayer(new LazyActivationConfig().withPreloadAdjacent(false)
                                                                  .withPredictiveLoading(false),
                                        new PooledViewportMaterializer(pool));
    }

    @AfterEach
    void tearDown() {
        layer.close();
        pool.close();
    }

    @Test
    void testActivationAcquiresPoolSlot() throws Exception {
        layer.registerViewport("vp-1", Map.of(PooledViewportMaterializer.TYPE, "volume",
                                              PooledViewportMaterializer.CONTENT_ID, "series-1"));

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));

        var slot = pool.findByContent("series-1").orElseThrow();
        assertEquals(ViewportType.VOLUME, slot.type());
        assertEquals(slot.poolId(), layer.getViewportState("vp-1").orElseThrow().resourceEngineId());
    }

    @Test
    void testExhaustedPoolFailsActivation() throws Exception {
        layer.registerViewport("vp-1", Map.of());
        layer.registerViewport("vp-2", Map.of());

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertFalse(layer.activateViewport("vp-2").get(1, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.ERROR, layer.getViewportState("vp-2").orElseThrow().state());
    }

    @Test
    void testDeactivationReleasesSlot() throws Exception {
        layer.registerViewport("vp-1", Map.of(PooledViewportMaterializer.TYPE, ViewportType.STACK));
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        var poolId = pool.findByContent("vp-1").orElseThrow().poolId();

        assertTrue(layer.deactivateViewport("vp-1"));

        assertTrue(pool.findByContent("vp-1").isEmpty());
        assertEquals(ViewportState.PENDING_CLEANUP, pool.getViewport(poolId).orElseThrow().state());
        // Re-activation reclaims the slot before its cleanup ran
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertEquals(poolId, pool.findByContent("vp-1").orElseThrow().poolId());
        assertEquals(1, pool.getStatistics().getReclaimCount());
    }

    @Test
    void testUnknownTypeFails() {
        var materializer = new PooledViewportMaterializer(pool);
        var future = materializer.materialize("vp-9", Map.of(PooledViewportMaterializer.TYPE, "hologram"), null);

        var error = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void testMaterializationCarriesHandle() throws Exception {
        var materializer = new PooledViewportMaterializer(pool);
        var materialization = materializer.materialize("vp-3", Map.of(), null).get(1, TimeUnit.SECONDS);

        var handle = assertInstanceOf(ViewportHandle.class, materialization.handle());
        assertEquals("vp-3", handle.contentId());
        assertEquals(ViewportState.IN_USE, handle.state());

        materializer.dematerialize("vp-3", materialization);
        assertEquals(ViewportState.PENDING_CLEANUP, pool.getViewport(handle.poolId()).orElseThrow().state());
    }
}
