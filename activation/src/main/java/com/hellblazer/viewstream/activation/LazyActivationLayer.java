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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Defers materializing a viewport until it is needed, and masks activation latency by preloading neighbours and
 * viewports that recent access history predicts.
 * <p>
 * State machine per registered id: UNINITIALIZED to INITIALIZING to READY or ERROR; READY returns to UNINITIALIZED
 * on deactivation or inactivity; ERROR is retried on the next activation. At most one materialization per id is in
 * flight; concurrent callers join it.
 *
 * @author hal.hildebrand
 */
public class LazyActivationLayer implements AutoCloseable {
    private static final Logger  log            = LoggerFactory.getLogger(LazyActivationLayer.class);
    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("(\\d+)$");
    private static final int     MAX_FREED      = 2;

    private final LazyActivationConfig         config;
    private final ViewportMaterializer         materializer;
    private final Clock                        clock;
    private final ScheduledExecutorService     scheduler;
    private final ReentrantLock                lock          = new ReentrantLock();
    private final Map<String, ActivationEntry> instances     = new LinkedHashMap<>();
    private final Set<String>                  active        = new LinkedHashSet<>();
    private final Set<String>                  loadingQueue  = new LinkedHashSet<>();
    private final List<String>                 accessHistory = new ArrayList<>();
    private final List<ActivationListener>     listeners     = new CopyOnWriteArrayList<>();

    private volatile boolean predictiveLoading;
    private volatile boolean closed = false;

    public LazyActivationLayer(ViewportMaterializer materializer) {
        this(LazyActivationConfig.defaultConfig(), materializer);
    }

    public LazyActivationLayer(LazyActivationConfig config, ViewportMaterializer materializer) {
        this(config, materializer, Clock.systemUTC());
    }

    public LazyActivationLayer(LazyActivationConfig config, ViewportMaterializer materializer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.materializer = Objects.requireNonNull(materializer, "materializer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.predictiveLoading = config.isPredictiveLoading();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "lazy-activation");
            thread.setDaemon(true);
            return thread;
        });

        long memoryMillis = config.getMemoryCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::checkMemory, memoryMillis, memoryMillis, TimeUnit.MILLISECONDS);
        if (config.isPredictiveLoading()) {
            long predictionMillis = config.getPredictionInterval().toMillis();
            scheduler.scheduleAtFixedRate(this::analyzePredictivePatterns, predictionMillis, predictionMillis,
                                          TimeUnit.MILLISECONDS);
        }
        log.info("Lazy activation layer initialized: {}", config);
    }

    public void addListener(ActivationListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ActivationListener listener) {
        listeners.remove(listener);
    }

    // Registration

    /**
     * Register a viewport in UNINITIALIZED. Registering an id twice is a no-op.
     */
    public void registerViewport(String viewportId, Map<String, Object> metadata) {
        Objects.requireNonNull(viewportId, "viewportId");
        ensureNotClosed();
        lock.lock();
        try {
            if (instances.containsKey(viewportId)) {
                log.warn("Viewport already registered: {}", viewportId);
                return;
            }
            instances.put(viewportId, new ActivationEntry(viewportId, metadata == null ? Map.of() : metadata));
        } finally {
            lock.unlock();
        }
        log.info("Viewport registered for lazy activation: {}", viewportId);
    }

    /**
     * Remove a viewport, releasing its resources if it is active.
     *
     * @return false if the id was not registered
     */
    public boolean unregisterViewport(String viewportId) {
        boolean wasActive;
        lock.lock();
        try {
            var entry = instances.remove(viewportId);
            if (entry == null) {
                return false;
            }
            wasActive = entry.state == ViewportInstanceState.READY;
            if (wasActive) {
                releaseLocked(entry);
            }
            entry.cancelInactivityTimer();
            entry.state = ViewportInstanceState.DISPOSED;
            active.remove(viewportId);
            loadingQueue.remove(viewportId);
        } finally {
            lock.unlock();
        }
        if (wasActive) {
            notifyListeners(l -> l.viewportDeactivated(viewportId));
        }
        log.info("Viewport unregistered: {}", viewportId);
        return true;
    }

    /**
     * Keep a viewport active once it is READY: a pinned viewport never expires from inactivity and is never chosen
     * when resources are freed. It can still be deactivated or unregistered explicitly.
     *
     * @return false if the id was not registered
     */
    public boolean pinViewport(String viewportId) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            if (entry == null) {
                return false;
            }
            entry.pinned = true;
            entry.cancelInactivityTimer();
        } finally {
            lock.unlock();
        }
        log.debug("Viewport pinned: {}", viewportId);
        return true;
    }

    /**
     * Return a pinned viewport to the normal inactivity and freeing rules.
     *
     * @return false if the id was not registered
     */
    public boolean unpinViewport(String viewportId) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            if (entry == null) {
                return false;
            }
            entry.pinned = false;
            if (entry.state == ViewportInstanceState.READY) {
                armInactivityTimerLocked(entry);
            }
        } finally {
            lock.unlock();
        }
        log.debug("Viewport unpinned: {}", viewportId);
        return true;
    }

    public boolean isPinned(String viewportId) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            return entry != null && entry.pinned;
        } finally {
            lock.unlock();
        }
    }

    // Activation

    public CompletableFuture<Boolean> activateViewport(String viewportId) {
        return activateViewport(viewportId, null, false);
    }

    /**
     * Activate a viewport, materializing it if needed.
     *
     * @param viewportId registered viewport id
     * @param surface    drawing surface to attach, may be null
     * @param immediate  bypass the admission check on active count and memory
     * @return completes with true once the viewport is READY; false if unknown, inadmissible, failed, or when a joined
     * activation does not finish within the join timeout
     */
    public CompletableFuture<Boolean> activateViewport(String viewportId, Object surface, boolean immediate) {
        Objects.requireNonNull(viewportId, "viewportId");
        ensureNotClosed();

        var deactivated = new ArrayList<String>();
        CompletableFuture<Boolean> joined = null;
        CompletableFuture<Boolean> started = null;
        ActivationEntry entry;
        lock.lock();
        try {
            entry = instances.get(viewportId);
            if (entry == null) {
                log.error("Viewport not registered: {}", viewportId);
                return CompletableFuture.completedFuture(false);
            }
            switch (entry.state) {
                case READY:
                    recordAccessLocked(entry);
                    return CompletableFuture.completedFuture(true);
                case INITIALIZING:
                    log.info("Viewport {} already initializing, joining", viewportId);
                    joined = entry.activation;
                    break;
                case DISPOSED:
                    return CompletableFuture.completedFuture(false);
                default:
                    if (!immediate && !canActivateLocked()) {
                        log.warn("Cannot activate viewport {} due to resource constraints: active={}, max={}",
                                 viewportId, active.size(), config.getMaxActiveViewports());
                        deactivated.addAll(freeUpResourcesLocked());
                    }
                    if (immediate || canActivateLocked()) {
                        started = beginActivationLocked(entry, surface);
                    }
            }
        } finally {
            lock.unlock();
        }

        deactivated.forEach(id -> notifyListeners(l -> l.viewportDeactivated(id)));
        if (joined != null) {
            return joined.copy()
                         .completeOnTimeout(false, config.getActivationJoinTimeout().toMillis(),
                                            TimeUnit.MILLISECONDS);
        }
        if (started == null) {
            return CompletableFuture.completedFuture(false);
        }
        materialize(entry, surface, started, false);
        return started;
    }

    /**
     * Release a READY viewport's resources and return it to UNINITIALIZED.
     *
     * @return false if the viewport was not READY
     */
    public boolean deactivateViewport(String viewportId) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            if (entry == null || !deactivateLocked(entry)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(l -> l.viewportDeactivated(viewportId));
        return true;
    }

    /**
     * Deactivate up to two least recently used active viewports when the active count is at or over the maximum.
     *
     * @return the ids deactivated
     */
    public List<String> freeUpResources() {
        List<String> deactivated;
        lock.lock();
        try {
            deactivated = freeUpResourcesLocked();
        } finally {
            lock.unlock();
        }
        deactivated.forEach(id -> notifyListeners(l -> l.viewportDeactivated(id)));
        return deactivated;
    }

    // Prediction

    /**
     * Inactive viewports ranked by how often they appear in the most recent accesses.
     */
    public List<ViewportPrediction> predictNextViewports() {
        lock.lock();
        try {
            int from = Math.max(0, accessHistory.size() - config.getPredictionWindow());
            var recent = accessHistory.subList(from, accessHistory.size());
            var counts = new HashMap<String, Integer>();
            for (var id : recent) {
                counts.merge(id, 1, Integer::sum);
            }

            var predictions = new ArrayList<ViewportPrediction>();
            for (var id : instances.keySet()) {
                if (active.contains(id)) {
                    continue;
                }
                double probability = (double) counts.getOrDefault(id, 0) / Math.max(recent.size(), 1);
                if (probability > 0) {
                    predictions.add(new ViewportPrediction(id, probability, "Historical access pattern",
                                                           config.getPredictivePreloadDelay()));
                }
            }
            predictions.sort(Comparator.comparingDouble(ViewportPrediction::probability).reversed());
            return predictions;
        } finally {
            lock.unlock();
        }
    }

    public void setPredictiveLoading(boolean enabled) {
        this.predictiveLoading = enabled;
        log.info("Predictive loading {}", enabled ? "enabled" : "disabled");
    }

    public boolean isPredictiveLoading() {
        return predictiveLoading;
    }

    // Queries

    public ActivationMemoryUsage getMemoryUsage() {
        lock.lock();
        try {
            var perViewport = new LinkedHashMap<String, Long>();
            long used = 0;
            for (var id : active) {
                perViewport.put(id, config.getBytesPerViewport());
                used += config.getBytesPerViewport();
            }
            return new ActivationMemoryUsage(config.getMemoryThreshold(), used, perViewport,
                                             config.getMemoryThreshold());
        } finally {
            lock.unlock();
        }
    }

    public Optional<ViewportInstance> getViewportState(String viewportId) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public List<String> getActiveViewports() {
        lock.lock();
        try {
            return new ArrayList<>(active);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids currently materializing.
     */
    public List<String> getLoadingQueue() {
        lock.lock();
        try {
            return new ArrayList<>(loadingQueue);
        } finally {
            lock.unlock();
        }
    }

    public void setViewportPriority(String viewportId, int priority) {
        lock.lock();
        try {
            var entry = instances.get(viewportId);
            if (entry != null) {
                entry.priority = priority;
            }
        } finally {
            lock.unlock();
        }
    }

    public LazyActivationConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdownNow();

        var deactivated = new ArrayList<String>();
        lock.lock();
        try {
            for (var entry : instances.values()) {
                if (deactivateLocked(entry)) {
                    deactivated.add(entry.id);
                }
                entry.cancelInactivityTimer();
                entry.state = ViewportInstanceState.DISPOSED;
            }
            instances.clear();
            active.clear();
            loadingQueue.clear();
            accessHistory.clear();
        } finally {
            lock.unlock();
        }
        deactivated.forEach(id -> notifyListeners(l -> l.viewportDeactivated(id)));
        listeners.clear();
        log.info("Lazy activation layer closed, deactivated {} viewports", deactivated.size());
    }

    // Internals

    private CompletableFuture<Boolean> beginActivationLocked(ActivationEntry entry, Object surface) {
        entry.state = ViewportInstanceState.INITIALIZING;
        if (surface != null) {
            entry.surface = surface;
        }
        entry.activation = new CompletableFuture<>();
        loadingQueue.add(entry.id);
        log.info("Initializing viewport {}", entry.id);
        return entry.activation;
    }

    private void materialize(ActivationEntry entry, Object surface, CompletableFuture<Boolean> result,
                             boolean preload) {
        CompletableFuture<Materialization> pending;
        try {
            pending = materializer.materialize(entry.id, entry.metadata, surface);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        pending.whenComplete((materialization, error) -> completeActivation(entry, materialization, error, result,
                                                                            preload));
    }

    private void completeActivation(ActivationEntry entry, Materialization materialization, Throwable error,
                                    CompletableFuture<Boolean> result, boolean preload) {
        boolean ready = false;
        boolean stale = false;
        lock.lock();
        try {
            loadingQueue.remove(entry.id);
            entry.activation = null;
            if (entry.state != ViewportInstanceState.INITIALIZING || instances.get(entry.id) != entry) {
                stale = true;
            } else if (error != null) {
                entry.state = ViewportInstanceState.ERROR;
            } else {
                entry.state = ViewportInstanceState.READY;
                entry.materialization = materialization;
                active.add(entry.id);
                if (preload) {
                    armInactivityTimerLocked(entry);
                } else {
                    recordAccessLocked(entry);
                }
                ready = true;
            }
        } finally {
            lock.unlock();
        }

        if (stale) {
            log.debug("Viewport {} removed while initializing, discarding materialization", entry.id);
            if (error == null && materialization != null) {
                dematerialize(entry.id, materialization);
            }
        } else if (ready) {
            log.info("Viewport {} ready ({})", entry.id, preload ? "preloaded" : "activated");
            if (preload) {
                notifyListeners(l -> l.viewportPreloaded(entry.id));
            } else {
                notifyListeners(l -> l.viewportReady(entry.id));
                if (config.isPreloadAdjacent()) {
                    scheduleAdjacentPreload(entry.id);
                }
            }
        } else {
            log.error("Failed to initialize viewport {}", entry.id, error);
            notifyListeners(l -> l.viewportFailed(entry.id, error));
        }
        result.complete(ready);
    }

    private boolean canActivateLocked() {
        long estimated = (long) active.size() * config.getBytesPerViewport();
        return active.size() < config.getMaxActiveViewports() && estimated < config.getMemoryThreshold();
    }

    private List<String> freeUpResourcesLocked() {
        int toDeactivate = Math.min(MAX_FREED, Math.max(0, active.size() - config.getMaxActiveViewports() + 1));
        var lru = active.stream()
                        .map(instances::get)
                        .filter(entry -> !entry.pinned)
                        .sorted(Comparator.comparingLong(e -> e.lastAccessTime))
                        .limit(toDeactivate)
                        .collect(Collectors.toList());
        var deactivated = new ArrayList<String>();
        for (var entry : lru) {
            if (deactivateLocked(entry)) {
                deactivated.add(entry.id);
            }
        }
        return deactivated;
    }

    private boolean deactivateLocked(ActivationEntry entry) {
        if (entry.state != ViewportInstanceState.READY) {
            return false;
        }
        log.info("Deactivating viewport {}", entry.id);
        releaseLocked(entry);
        entry.state = ViewportInstanceState.UNINITIALIZED;
        active.remove(entry.id);
        return true;
    }

    private void releaseLocked(ActivationEntry entry) {
        entry.cancelInactivityTimer();
        if (entry.materialization != null) {
            dematerialize(entry.id, entry.materialization);
        }
        entry.materialization = null;
        entry.surface = null;
    }

    private void dematerialize(String viewportId, Materialization materialization) {
        try {
            materializer.dematerialize(viewportId, materialization);
        } catch (RuntimeException e) {
            log.error("Failed to release resources of viewport {}", viewportId, e);
        }
    }

    private void recordAccessLocked(ActivationEntry entry) {
        entry.lastAccessTime = clock.millis();
        entry.accessCount++;
        accessHistory.add(entry.id);
        if (accessHistory.size() > config.getHistoryLimit()) {
            accessHistory.subList(0, accessHistory.size() - config.getHistoryRetain()).clear();
        }
        if (entry.state == ViewportInstanceState.READY) {
            armInactivityTimerLocked(entry);
        }
    }

    private void armInactivityTimerLocked(ActivationEntry entry) {
        entry.cancelInactivityTimer();
        if (closed || entry.pinned) {
            return;
        }
        long generation = entry.timerGeneration;
        try {
            entry.inactivityTimer = scheduler.schedule(() -> handleInactive(entry, generation),
                                                       config.getInactivityTimeout().toMillis(),
                                                       TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Inactivity timer for {} not armed, layer closing", entry.id);
        }
    }

    private void handleInactive(ActivationEntry entry, long generation) {
        lock.lock();
        try {
            if (entry.timerGeneration != generation || instances.get(entry.id) != entry) {
                return;
            }
            entry.inactivityTimer = null;
            log.info("Viewport {} inactive for {}, deactivating", entry.id, config.getInactivityTimeout());
            if (!deactivateLocked(entry)) {
                return;
            }
        } finally {
            lock.unlock();
        }
        notifyListeners(l -> l.viewportDeactivated(entry.id));
    }

    private void scheduleAdjacentPreload(String viewportId) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            for (var adjacent : adjacentIds(viewportId)) {
                if (instances.containsKey(adjacent) && !active.contains(adjacent)) {
                    scheduler.schedule(() -> preloadViewport(adjacent), config.getPreloadDelay().toMillis(),
                                       TimeUnit.MILLISECONDS);
                }
            }
        } catch (RejectedExecutionException e) {
            log.debug("Adjacent preload of {} skipped, layer closing", viewportId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Best-effort activation: only from UNINITIALIZED, only when admissible, never frees other viewports.
     */
    void preloadViewport(String viewportId) {
        ActivationEntry entry;
        CompletableFuture<Boolean> started;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            entry = instances.get(viewportId);
            if (entry == null || entry.state != ViewportInstanceState.UNINITIALIZED || !canActivateLocked()) {
                return;
            }
            log.info("Preloading viewport {}", viewportId);
            started = beginActivationLocked(entry, null);
        } finally {
            lock.unlock();
        }
        materialize(entry, null, started, true);
    }

    /**
     * Ids whose trailing number differs by one, e.g. {@code vp-3} yields {@code vp-2} and {@code vp-4}.
     */
    static List<String> adjacentIds(String viewportId) {
        var matcher = NUMERIC_SUFFIX.matcher(viewportId);
        if (!matcher.find()) {
            return List.of();
        }
        var digits = matcher.group(1);
        var prefix = viewportId.substring(0, viewportId.length() - digits.length());
        long number;
        try {
            number = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return List.of();
        }
        var adjacent = new ArrayList<String>(2);
        if (number > 0) {
            adjacent.add(prefix + (number - 1));
        }
        if (number < Long.MAX_VALUE) {
            adjacent.add(prefix + (number + 1));
        }
        return adjacent;
    }

    private void analyzePredictivePatterns() {
        if (!predictiveLoading || closed) {
            return;
        }
        try {
            for (var prediction : predictNextViewports()) {
                if (prediction.probability() > config.getPredictionThreshold()) {
                    log.debug("Scheduling predictive preload of {} (p={})", prediction.viewportId(),
                              prediction.probability());
                    scheduler.schedule(() -> preloadViewport(prediction.viewportId()),
                                       prediction.suggestedPreloadDelay().toMillis(), TimeUnit.MILLISECONDS);
                }
            }
        } catch (RejectedExecutionException e) {
            log.debug("Predictive preload skipped, layer closing");
        } catch (RuntimeException e) {
            log.error("Predictive analysis failed", e);
        }
    }

    private void checkMemory() {
        try {
            var usage = getMemoryUsage();
            if (usage.isOverThreshold()) {
                log.warn("Memory threshold exceeded: used={} threshold={}", usage.used(), usage.threshold());
                freeUpResources();
            }
        } catch (RuntimeException e) {
            log.error("Memory check failed", e);
        }
    }

    private void notifyListeners(Consumer<ActivationListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Activation listener failed", e);
            }
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Lazy activation layer is closed");
        }
    }
}
