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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for lazy activation, admission, inactivity and preloading
 */
public class LazyActivationLayerTest {

    private ManualClock          clock;
    private ViewportMaterializer materializer;
    private LazyActivationLayer  layer;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(10_000L);
        materializer = mock(ViewportMaterializer.class);
        when(materializer.materialize(anyString(), any(), any())).thenAnswer(
        inv -> CompletableFuture.completedFuture(new Materialization("engine-" + inv.getArgument(0), null)));
    }

    @AfterEach
    void tearDown() {
        if (layer != null) {
            layer.close();
        }
    }

    private static LazyActivationConfig quiet() {
        return new LazyActivationConfig().withPreloadAdjacent(false)
                                         .withPredictiveLoading(false)
                                         .withMemoryCheckInterval(Duration.ofHours(1));
    }

    private LazyActivationLayer create(LazyActivationConfig config) {
        layer = new LazyActivationLayer(config, materializer, clock);
        return layer;
    }

    private ViewportInstanceState stateOf(String id) {
        return layer.getViewportState(id).orElseThrow().state();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testRegistration() {
        create(quiet());
        layer.registerViewport("vp-1", Map.of("series", "1.2.3"));
        layer.registerViewport("vp-1", Map.of("series", "other"));

        var instance = layer.getViewportState("vp-1").orElseThrow();
        assertEquals(ViewportInstanceState.UNINITIALIZED, instance.state());
        assertEquals("1.2.3", instance.metadata().get("series"));
        assertEquals(0, instance.accessCount());
        assertTrue(layer.getViewportState("missing").isEmpty());
    }

    @Test
    void testActivateUnknownViewport() throws Exception {
        create(quiet());
        assertFalse(layer.activateViewport("nope").get(1, TimeUnit.SECONDS));
        verifyNoInteractions(materializer);
    }

    @Test
    void testActivateAndAccess() throws Exception {
        create(quiet());
        var ready = new CopyOnWriteArrayList<String>();
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportReady(String viewportId) {
                ready.add(viewportId);
            }
        });
        layer.registerViewport("vp-1", null);
        var surface = new Object();

        assertTrue(layer.activateViewport("vp-1", surface, false).get(1, TimeUnit.SECONDS));
        var instance = layer.getViewportState("vp-1").orElseThrow();
        assertEquals(ViewportInstanceState.READY, instance.state());
        assertTrue(instance.isActive());
        assertEquals("engine-vp-1", instance.resourceEngineId());
        assertSame(surface, instance.surface());
        assertEquals(1, instance.accessCount());
        assertEquals(clock.millis(), instance.lastAccessTime());

        clock.advance(Duration.ofSeconds(3));
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        instance = layer.getViewportState("vp-1").orElseThrow();
        assertEquals(2, instance.accessCount());
        assertEquals(clock.millis(), instance.lastAccessTime());

        verify(materializer, times(1)).materialize(eq("vp-1"), any(), any());
        assertEquals(List.of("vp-1"), layer.getActiveViewports());
        assertEquals(List.of("vp-1"), ready);
    }

    @Test
    void testConcurrentActivationsShareOneMaterialization() throws Exception {
        var pending = new CompletableFuture<Materialization>();
        when(materializer.materialize(eq("vp-1"), any(), any())).thenReturn(pending);
        create(quiet());
        layer.registerViewport("vp-1", Map.of());

        var executor = Executors.newFixedThreadPool(4);
        try {
            var results = new ArrayList<Future<CompletableFuture<Boolean>>>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> layer.activateViewport("vp-1")));
            }
            var futures = new ArrayList<CompletableFuture<Boolean>>();
            for (var result : results) {
                futures.add(result.get(5, TimeUnit.SECONDS));
            }

            assertEquals(ViewportInstanceState.INITIALIZING, stateOf("vp-1"));
            assertEquals(List.of("vp-1"), layer.getLoadingQueue());

            pending.complete(new Materialization("engine-vp-1", null));
            for (var future : futures) {
                assertTrue(future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        verify(materializer, times(1)).materialize(eq("vp-1"), any(), any());
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
        assertTrue(layer.getLoadingQueue().isEmpty());
    }

    @Test
    void testJoinTimesOut() throws Exception {
        when(materializer.materialize(eq("slow"), any(), any())).thenReturn(new CompletableFuture<>());
        create(quiet().withActivationJoinTimeout(Duration.ofMillis(100)));
        layer.registerViewport("slow", Map.of());

        var leader = layer.activateViewport("slow");
        var joiner = layer.activateViewport("slow");

        assertFalse(joiner.get(5, TimeUnit.SECONDS));
        assertFalse(leader.isDone());
        assertEquals(ViewportInstanceState.INITIALIZING, stateOf("slow"));
    }

    @Test
    void testFailedMaterializationThenRetry() throws Exception {
        when(materializer.materialize(eq("vp-1"), any(), any())).thenReturn(
        CompletableFuture.failedFuture(new IllegalStateException("no GL context")))
                                                                .thenReturn(CompletableFuture.completedFuture(
                                                                new Materialization("engine-vp-1", null)));
        create(quiet());
        var failures = new CopyOnWriteArrayList<String>();
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportFailed(String viewportId, Throwable error) {
                failures.add(viewportId);
            }
        });
        layer.registerViewport("vp-1", Map.of());

        assertFalse(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.ERROR, stateOf("vp-1"));
        assertTrue(layer.getActiveViewports().isEmpty());
        assertEquals(List.of("vp-1"), failures);

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
    }

    @Test
    void testMaterializerThrowingIsAFailure() throws Exception {
        when(materializer.materialize(eq("vp-1"), any(), any())).thenThrow(new IllegalArgumentException("bad"));
        create(quiet());
        layer.registerViewport("vp-1", Map.of());

        assertFalse(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.ERROR, stateOf("vp-1"));
    }

    @Test
    void testLeastRecentlyUsedIsFreedForAdmission() throws Exception {
        create(quiet().withMaxActiveViewports(2));
        var deactivated = new CopyOnWriteArrayList<String>();
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportDeactivated(String viewportId) {
                deactivated.add(viewportId);
            }
        });
        for (var id : List.of("a", "b", "c")) {
            layer.registerViewport(id, Map.of());
        }

        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));

        assertTrue(layer.activateViewport("c").get(1, TimeUnit.SECONDS));

        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("b"));
        assertEquals(List.of("b"), deactivated);
        assertTrue(layer.getActiveViewports().containsAll(List.of("a", "c")));
        assertEquals(2, layer.getActiveViewports().size());
        verify(materializer).dematerialize(eq("b"), any());
    }

    @Test
    void testInadmissibleWhenMemoryCannotBeFreed() throws Exception {
        create(quiet().withMaxActiveViewports(4).withBytesPerViewport(100).withMemoryThreshold(150));
        for (var id : List.of("a", "b", "c")) {
            layer.registerViewport(id, Map.of());
        }

        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        assertFalse(layer.activateViewport("c").get(1, TimeUnit.SECONDS));

        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("c"));
        assertEquals(2, layer.getActiveViewports().size());
    }

    @Test
    void testImmediateBypassesAdmission() throws Exception {
        create(quiet().withMaxActiveViewports(1));
        layer.registerViewport("a", Map.of());
        layer.registerViewport("b", Map.of());

        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        assertTrue(layer.activateViewport("b", null, true).get(1, TimeUnit.SECONDS));
        assertEquals(2, layer.getActiveViewports().size());
    }

    @Test
    void testInactivityDeactivationThenFreshActivation() throws Exception {
        create(quiet().withInactivityTimeout(Duration.ofMillis(200)));
        var deactivated = new CountDownLatch(1);
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportDeactivated(String viewportId) {
                deactivated.countDown();
            }
        });
        layer.registerViewport("vp-1", Map.of());

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertTrue(deactivated.await(5, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("vp-1"));
        assertNull(layer.getViewportState("vp-1").orElseThrow().resourceEngineId());
        assertTrue(layer.getActiveViewports().isEmpty());

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
        verify(materializer, times(2)).materialize(eq("vp-1"), any(), any());
        verify(materializer).dematerialize(eq("vp-1"), any());
    }

    @Test
    void testAccessResetsInactivityTimer() throws Exception {
        create(quiet().withInactivityTimeout(Duration.ofMillis(400)));
        layer.registerViewport("vp-1", Map.of());
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));

        for (int i = 0; i < 4; i++) {
            Thread.sleep(150);
            assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        }
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
        await(() -> stateOf("vp-1") == ViewportInstanceState.UNINITIALIZED);
    }

    @Test
    void testPinnedViewportOutlivesInactivityTimeout() throws Exception {
        create(quiet().withInactivityTimeout(Duration.ofMillis(100)));
        layer.registerViewport("vp-1", Map.of());
        assertTrue(layer.pinViewport("vp-1"));
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));

        Thread.sleep(400);
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
        verify(materializer, never()).dematerialize(anyString(), any());

        assertTrue(layer.unpinViewport("vp-1"));
        assertFalse(layer.isPinned("vp-1"));
        await(() -> stateOf("vp-1") == ViewportInstanceState.UNINITIALIZED);
    }

    @Test
    void testPinnedViewportIsNotFreedForAdmission() throws Exception {
        create(quiet().withMaxActiveViewports(2));
        for (var id : List.of("a", "b", "c")) {
            layer.registerViewport(id, Map.of());
        }
        layer.pinViewport("a");

        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));

        assertTrue(layer.activateViewport("c").get(1, TimeUnit.SECONDS));

        assertEquals(ViewportInstanceState.READY, stateOf("a"));
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("b"));
        assertFalse(layer.pinViewport("unknown"));
    }

    @Test
    void testDeactivateOnlyFromReady() throws Exception {
        create(quiet());
        layer.registerViewport("vp-1", Map.of());

        assertFalse(layer.deactivateViewport("vp-1"));
        assertFalse(layer.deactivateViewport("missing"));
        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        assertTrue(layer.deactivateViewport("vp-1"));
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("vp-1"));
    }

    @Test
    void testAdjacentViewportsArePreloaded() throws Exception {
        create(quiet().withPreloadAdjacent(true).withPreloadDelay(Duration.ofMillis(20)));
        var preloaded = new CopyOnWriteArrayList<String>();
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportPreloaded(String viewportId) {
                preloaded.add(viewportId);
            }
        });
        for (var id : List.of("vp-1", "vp-2", "vp-3", "vp-4")) {
            layer.registerViewport(id, Map.of());
        }

        assertTrue(layer.activateViewport("vp-2").get(1, TimeUnit.SECONDS));

        await(() -> preloaded.size() == 2);
        assertTrue(preloaded.containsAll(List.of("vp-1", "vp-3")));
        assertEquals(ViewportInstanceState.READY, stateOf("vp-1"));
        assertEquals(ViewportInstanceState.READY, stateOf("vp-3"));
        // Preloads do not chain into their own neighbours
        Thread.sleep(100);
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("vp-4"));
    }

    @Test
    void testPreloadRespectsAdmission() throws Exception {
        create(quiet().withPreloadAdjacent(true).withPreloadDelay(Duration.ZERO).withMaxActiveViewports(1));
        layer.registerViewport("vp-1", Map.of());
        layer.registerViewport("vp-2", Map.of());

        assertTrue(layer.activateViewport("vp-1").get(1, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("vp-2"));
        assertEquals(List.of("vp-1"), layer.getActiveViewports());
    }

    @Test
    void testAdjacentIds() {
        assertEquals(List.of("vp-2", "vp-4"), LazyActivationLayer.adjacentIds("vp-3"));
        assertEquals(List.of("viewport-1"), LazyActivationLayer.adjacentIds("viewport-0"));
        assertEquals(List.of("s9", "s11"), LazyActivationLayer.adjacentIds("s10"));
        assertTrue(LazyActivationLayer.adjacentIds("main").isEmpty());
    }

    @Test
    void testPredictionsFromAccessHistory() throws Exception {
        create(quiet());
        for (var id : List.of("a", "b", "c")) {
            layer.registerViewport(id, Map.of());
        }
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        for (int i = 0; i < 3; i++) {
            layer.activateViewport("b").get(1, TimeUnit.SECONDS);
        }
        layer.deactivateViewport("b");
        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));

        var predictions = layer.predictNextViewports();

        // Active "a" is excluded, "c" was never accessed
        assertEquals(1, predictions.size());
        assertEquals("b", predictions.get(0).viewportId());
        assertEquals(0.8, predictions.get(0).probability(), 0.0001);
        assertEquals(Duration.ofSeconds(1), predictions.get(0).suggestedPreloadDelay());
    }

    @Test
    void testPredictionWindowUsesRecentAccessesOnly() throws Exception {
        create(quiet().withPredictionWindow(2));
        layer.registerViewport("a", Map.of());
        layer.registerViewport("b", Map.of());
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        layer.deactivateViewport("b");
        for (int i = 0; i < 3; i++) {
            layer.activateViewport("a").get(1, TimeUnit.SECONDS);
        }
        layer.deactivateViewport("a");

        var predictions = layer.predictNextViewports();
        assertEquals(1, predictions.size());
        assertEquals("a", predictions.get(0).viewportId());
        assertEquals(1.0, predictions.get(0).probability(), 0.0001);
    }

    @Test
    void testPredictivePreloading() throws Exception {
        create(quiet().withPredictiveLoading(true)
                      .withPredictionInterval(Duration.ofMillis(50))
                      .withPredictivePreloadDelay(Duration.ZERO));
        var preloaded = new CountDownLatch(1);
        layer.addListener(new ActivationListener() {
            @Override
            public void viewportPreloaded(String viewportId) {
                if (viewportId.equals("b")) {
                    preloaded.countDown();
                }
            }
        });
        layer.registerViewport("b", Map.of());
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        layer.activateViewport("b").get(1, TimeUnit.SECONDS);
        layer.deactivateViewport("b");

        assertTrue(preloaded.await(5, TimeUnit.SECONDS));
        assertEquals(ViewportInstanceState.READY, stateOf("b"));
    }

    @Test
    void testPredictiveLoadingToggle() throws Exception {
        create(quiet().withPredictiveLoading(true).withPredictionInterval(Duration.ofMillis(50)));
        assertTrue(layer.isPredictiveLoading());
        layer.setPredictiveLoading(false);
        layer.registerViewport("b", Map.of());
        assertTrue(layer.activateViewport("b").get(1, TimeUnit.SECONDS));
        layer.deactivateViewport("b");

        Thread.sleep(300);
        assertEquals(ViewportInstanceState.UNINITIALIZED, stateOf("b"));
    }

    @Test
    void testMemoryMonitorFreesResources() throws Exception {
        create(quiet().withMaxActiveViewports(2)
                      .withBytesPerViewport(100)
                      .withMemoryThreshold(150)
                      .withMemoryCheckInterval(Duration.ofMillis(50)));
        layer.registerViewport("a", Map.of());
        layer.registerViewport("b", Map.of());
        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(1));
        assertTrue(layer.activateViewport("b", null, true).get(1, TimeUnit.SECONDS));

        await(() -> layer.getActiveViewports().size() == 1);
        assertEquals(List.of("b"), layer.getActiveViewports());
    }

    @Test
    void testMemoryUsage() throws Exception {
        create(quiet().withBytesPerViewport(1000).withMemoryThreshold(10_000));
        layer.registerViewport("a", Map.of());
        layer.registerViewport("b", Map.of());
        layer.activateViewport("a").get(1, TimeUnit.SECONDS);
        layer.activateViewport("b").get(1, TimeUnit.SECONDS);

        var usage = layer.getMemoryUsage();
        assertEquals(2000, usage.used());
        assertEquals(10_000, usage.threshold());
        assertEquals(Map.of("a", 1000L, "b", 1000L), usage.viewports());
        assertFalse(usage.isOverThreshold());
    }

    @Test
    void testPriority() {
        create(quiet());
        layer.registerViewport("a", Map.of());
        layer.setViewportPriority("a", 7);
        layer.setViewportPriority("missing", 3);
        assertEquals(7, layer.getViewportState("a").orElseThrow().priority());
    }

    @Test
    void testUnregisterReleasesResources() throws Exception {
        create(quiet());
        layer.registerViewport("a", Map.of());
        assertTrue(layer.activateViewport("a").get(1, TimeUnit.SECONDS));

        assertTrue(layer.unregisterViewport("a"));
        assertFalse(layer.unregisterViewport("a"));
        assertTrue(layer.getViewportState("a").isEmpty());
        assertTrue(layer.getActiveViewports().isEmpty());
        verify(materializer).dematerialize(eq("a"), any());
    }

    @Test
    void testUnregisterWhileInitializingDiscardsMaterialization() throws Exception {
        var pending = new CompletableFuture<Materialization>();
        when(materializer.materialize(eq("a"), any(), any())).thenReturn(pending);
        create(quiet());
        layer.registerViewport("a", Map.of());

        var activation = layer.activateViewport("a");
        layer.unregisterViewport("a");
        pending.complete(new Materialization("engine-a", null));

        assertFalse(activation.get(1, TimeUnit.SECONDS));
        verify(materializer).dematerialize(eq("a"), any());
        assertTrue(layer.getActiveViewports().isEmpty());
    }

    @Test
    void testClose() throws Exception {
        create(quiet());
        layer.registerViewport("a", Map.of());
        layer.registerViewport("b", Map.of());
        layer.activateViewport("a").get(1, TimeUnit.SECONDS);
        layer.activateViewport("b").get(1, TimeUnit.SECONDS);

        layer.close();
        layer.close();

        verify(materializer, times(2)).dematerialize(anyString(), any());
        assertTrue(layer.getActiveViewports().isEmpty());
        assertThrows(IllegalStateException.class, () -> layer.activateViewport("a"));
        assertThrows(IllegalStateException.class, () -> layer.registerViewport("c", Map.of()));
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new LazyActivationConfig().withMaxActiveViewports(0));
        assertThrows(IllegalArgumentException.class,
                     () -> new LazyActivationConfig().withInactivityTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new LazyActivationConfig().withPredictionThreshold(1.0));
        assertThrows(IllegalArgumentException.class, () -> new LazyActivationConfig().withHistory(10, 20));

        var defaults = LazyActivationConfig.defaultConfig();
        assertEquals(4, defaults.getMaxActiveViewports());
        assertEquals(Duration.ofSeconds(30), defaults.getInactivityTimeout());
        assertEquals(500L * 1024 * 1024, defaults.getMemoryThreshold());
        assertEquals(0.7, defaults.getPredictionThreshold());
    }
}
