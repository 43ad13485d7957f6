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
import com.hellblazer.viewstream.progressive.*;
import com.hellblazer.viewstream.resource.ViewportPoolConfiguration;
import com.hellblazer.viewstream.resource.ViewportState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the wired pool, activation layer and scheduler
 */
public class ViewstreamEngineTest {

    private static final ItemLoader IMMEDIATE = id -> CompletableFuture.completedFuture(new LoadedItem(id, 64, null));

    private ViewstreamEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static ViewstreamProfile profile(int maxPoolSize, boolean autoStart) {
        var pool = new ViewportPoolConfiguration.Builder().withMinPoolSize(1)
                                                          .withMaxPoolSize(maxPoolSize)
                                                          .withInitialPoolSize(1)
                                                          .withGarbageCollection(false)
                                                          .withCleanupDelay(Duration.ofMillis(50))
                                                          .build();
        var activation = new LazyActivationConfig().withPreloadAdjacent(false).withPredictiveLoading(false);
        var progressive = new ProgressiveLoadingConfig().withAutoStart(autoStart)
                                                        .withAdaptiveChunkSize(false)
                                                        .withChunkSize(5)
                                                        .withTickInterval(Duration.ofMillis(10));
        return new ViewstreamProfile(pool, activation, progressive);
    }

    private static List<String> items(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> prefix + i).collect(Collectors.toList());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not reached in time");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void testSessionLoadsThroughPooledViewport() throws Exception {
        engine = new ViewstreamEngine(profile(2, true), IMMEDIATE);
        var done = new CountDownLatch(1);
        var bytes = new long[1];

        engine.load(items("img-", 12), LoadOptions.defaults().withSessionId("ds").withOnComplete((id, results) -> {
            bytes[0] = results.values()
                              .stream()
                              .flatMap(List::stream)
                              .mapToLong(r -> r.item().sizeBytes())
                              .sum();
            done.countDown();
        }));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(12 * 64, bytes[0]);
        assertFalse(engine.getBinder().isBound("ds"));
        assertTrue(engine.getActivationLayer().getViewportState(PooledViewportBinder.viewportId("ds")).isEmpty());
        assertTrue(engine.getPool().findByContent(PooledViewportBinder.viewportId("ds")).isEmpty());
    }

    @Test
    void testExhaustedPoolDefersSecondSession() throws Exception {
        var pending = new ConcurrentHashMap<String, CompletableFuture<LoadedItem>>();
        engine = new ViewstreamEngine(profile(1, true),
                                      id -> pending.computeIfAbsent(id, k -> new CompletableFuture<>()));
        var scheduler = engine.getScheduler();

        engine.load(items("a-", 2), LoadOptions.defaults().withSessionId("a"));
        awaitCondition(() -> pending.containsKey("a-0"));
        engine.load(items("b-", 2), LoadOptions.defaults().withSessionId("b"));
        Thread.sleep(100);

        assertTrue(engine.getBinder().isBound("a"));
        assertFalse(engine.getBinder().isBound("b"));
        assertEquals(SessionStatus.PENDING, scheduler.getSessionProgress("b").orElseThrow().status());
        assertEquals(ViewportState.IN_USE, engine.getPool()
                                                 .findByContent(PooledViewportBinder.viewportId("a"))
                                                 .orElseThrow()
                                                 .state());

        awaitCondition(() -> {
            pending.forEach((id, future) -> future.complete(new LoadedItem(id, 1, null)));
            return scheduler.getSessionProgress("b").orElseThrow().status() == SessionStatus.COMPLETED;
        });
        assertEquals(SessionStatus.COMPLETED, scheduler.getSessionProgress("a").orElseThrow().status());
        assertEquals(1, engine.getPool().size());
    }

    @Test
    void testSessionKeepsViewportPastInactivityTimeout() throws Exception {
        var pool = new ViewportPoolConfiguration.Builder().withMinPoolSize(1)
                                                          .withMaxPoolSize(2)
                                                          .withInitialPoolSize(1)
                                                          .withGarbageCollection(false)
                                                          .withCleanupDelay(Duration.ofMillis(50))
                                                          .build();
        var activation = new LazyActivationConfig().withPreloadAdjacent(false)
                                                   .withPredictiveLoading(false)
                                                   .withInactivityTimeout(Duration.ofMillis(200));
        var progressive = new ProgressiveLoadingConfig().withAdaptiveChunkSize(false)
                                                        .withChunkSize(4)
                                                        .withMaxConcurrentChunks(1)
                                                        .withTickInterval(Duration.ofMillis(10));
        var slow = CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS);
        engine = new ViewstreamEngine(new ViewstreamProfile(pool, activation, progressive),
                                      id -> CompletableFuture.supplyAsync(() -> new LoadedItem(id, 8, null), slow));
        var viewportId = PooledViewportBinder.viewportId("slow");

        engine.load(items("img-", 8), LoadOptions.defaults().withSessionId("slow"));
        awaitCondition(() -> engine.getBinder().isBound("slow"));
        Thread.sleep(500);

        assertEquals(SessionStatus.LOADING, engine.getScheduler().getSessionProgress("slow").orElseThrow().status());
        assertEquals(List.of(viewportId), engine.getActivationLayer().getActiveViewports());
        assertEquals(1, engine.getPool().getStatistics().getInUseViewports());
        assertEquals(ViewportState.IN_USE, engine.getPool().findByContent(viewportId).orElseThrow().state());

        awaitCondition(() -> engine.getScheduler().getSessionProgress("slow").orElseThrow().status()
                             == SessionStatus.COMPLETED);
        awaitCondition(() -> engine.getPool().findByContent(viewportId).isEmpty());
    }

    @Test
    void testCancelReleasesViewport() throws Exception {
        var pending = new ConcurrentHashMap<String, CompletableFuture<LoadedItem>>();
        engine = new ViewstreamEngine(profile(2, true),
                                      id -> pending.computeIfAbsent(id, k -> new CompletableFuture<>()));

        var sessionId = engine.load(items("a-", 10), LoadOptions.defaults());
        awaitCondition(() -> engine.getBinder().isBound(sessionId));

        assertTrue(engine.cancel(sessionId));

        assertFalse(engine.getBinder().isBound(sessionId));
        assertTrue(engine.getActivationLayer().getViewportState(PooledViewportBinder.viewportId(sessionId)).isEmpty());
        assertEquals(SessionStatus.CANCELLED,
                     engine.getScheduler().getSessionProgress(sessionId).orElseThrow().status());
    }

    @Test
    void testHealthCheckReportsBacklog() {
        engine = new ViewstreamEngine(profile(2, false), IMMEDIATE);
        assertTrue(engine.healthCheck().isHealthy());

        engine.load(items("img-", 200), LoadOptions.defaults());

        var health = engine.healthCheck();
        assertFalse(health.isHealthy());
        assertTrue(health.issues().stream().anyMatch(issue -> issue.startsWith("Progressive loading backlog")));
        assertTrue(health.recommendations().contains("Increase maxConcurrentChunks or cancel stale sessions"));
    }

    @Test
    void testCloseShutsDownComponents() {
        engine = new ViewstreamEngine(profile(2, true), IMMEDIATE);

        engine.close();
        engine.close();

        assertTrue(engine.isClosed());
        assertTrue(engine.getScheduler().isClosed());
        assertTrue(engine.getPool().isClosed());
        assertThrows(IllegalStateException.class, () -> engine.load(items("img-", 1), LoadOptions.defaults()));
    }
}
