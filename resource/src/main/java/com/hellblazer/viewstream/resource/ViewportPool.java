package com.hellblazer.viewstream.resource;

import com.hellblazer.viewstream.common.HealthStatus;
import com.hellblazer.viewstream.common.MemoryMonitor;
import com.hellblazer.viewstream.common.MemoryPressureLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Thread-safe pool of reusable viewport slots. Slots are acquired for a piece of content, released back with a
 * deferred cleanup, recycled across viewport types when the pool cannot grow, and reclaimed by a periodic garbage
 * collection pass or an immediate pass under memory pressure.
 * <p>
 * Acquisition failure is backpressure, not an error: {@link #acquire} returns an empty result and the caller retries
 * or queues.
 */
public class ViewportPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ViewportPool.class);

    // Pool storage - insertion ordered so that scans are deterministic
    private final Map<String, PooledViewport> pool           = new LinkedHashMap<>();
    private final List<String>                availableQueue = new ArrayList<>();
    private final Map<String, String>         contentIndex   = new HashMap<>();
    private final ReentrantLock               lock           = new ReentrantLock();

    // Configuration and collaborators
    private final ViewportPoolConfiguration  config;
    private final ViewportResourceFactory    resourceFactory;
    private final MemoryMonitor              memoryMonitor;
    private final Clock                      clock;
    private final ScheduledExecutorService   scheduler;
    private final List<ViewportPoolListener> listeners = new CopyOnWriteArrayList<>();

    // Statistics
    private final AtomicInteger nextPoolId       = new AtomicInteger(1);
    private final AtomicLong    recycleCount     = new AtomicLong(0);
    private final AtomicLong    reclaimCount     = new AtomicLong(0);
    private final AtomicLong    disposedCount    = new AtomicLong(0);
    private final AtomicLong    gcRunCount       = new AtomicLong(0);
    private final AtomicLong    lastGcTime       = new AtomicLong(0);
    private final AtomicLong    memoryEstimate   = new AtomicLong(0);

    private volatile boolean closed = false;

    /**
     * Create a viewport pool with default configuration
     */
    public ViewportPool() {
        this(ViewportPoolConfiguration.defaultConfig());
    }

    public ViewportPool(ViewportPoolConfiguration config) {
        this(config, ViewportResourceFactory.NONE);
    }

    public ViewportPool(ViewportPoolConfiguration config, ViewportResourceFactory resourceFactory) {
        this(config, resourceFactory, null, Clock.systemUTC());
    }

    /**
     * Create a viewport pool.
     *
     * @param config          pool configuration
     * @param resourceFactory creates and tears down the rendering resource behind each slot
     * @param memoryMonitor   optional out-of-band pressure reading that can trigger burst collection, may be null
     * @param clock           time source for idle and usage stamps
     */
    public ViewportPool(ViewportPoolConfiguration config, ViewportResourceFactory resourceFactory,
                        MemoryMonitor memoryMonitor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.resourceFactory = Objects.requireNonNull(resourceFactory, "resourceFactory");
        this.memoryMonitor = memoryMonitor;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "viewport-pool");
            thread.setDaemon(true);
            return thread;
        });

        lock.lock();
        try {
            for (int i = 0; i < config.getInitialPoolSize(); i++) {
                createViewportLocked(ViewportType.STACK);
            }
        } finally {
            lock.unlock();
        }

        if (config.isGarbageCollection()) {
            long gcMillis = config.getGcInterval().toMillis();
            scheduler.scheduleAtFixedRate(this::scheduledGarbageCollection, gcMillis, gcMillis,
                                          TimeUnit.MILLISECONDS);
        }
        long memoryMillis = config.getMemoryCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::scheduledMemoryCheck, memoryMillis, memoryMillis,
                                      TimeUnit.MILLISECONDS);

        log.info("Viewport pool initialized with {} slots, config: {}", config.getInitialPoolSize(), config);
    }

    public void addListener(ViewportPoolListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ViewportPoolListener listener) {
        listeners.remove(listener);
    }

    /**
     * Acquire a slot of the given type for the content. Resolution order: a slot of this type still pending cleanup
     * from the same content, an available slot of the type, a freshly created slot when utilization has reached the
     * expand threshold, and finally the least recently used available slot of another type, re-tagged.
     *
     * @return the acquired slot, or empty when the pool is exhausted or the content is already being presented
     */
    public Optional<ViewportHandle> acquire(ViewportType type, String contentId) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(contentId, "contentId");
        ensureNotClosed();

        ViewportHandle acquired;
        lock.lock();
        try {
            var existing = contentIndex.get(contentId);
            if (existing != null) {
                log.warn("Content {} is already assigned to viewport {}", contentId, existing);
                return Optional.empty();
            }

            var viewport = reclaimPendingLocked(type, contentId);
            if (viewport == null) {
                viewport = findAvailableLocked(type);
            }
            if (viewport == null && shouldExpandLocked()) {
                viewport = createViewportLocked(type);
                log.info("Pool expanded to {} slots for {}", pool.size(), type);
            }
            if (viewport == null) {
                viewport = recycleLocked(type);
            }
            if (viewport == null) {
                log.warn("No viewport available in pool: type={}, size={}, inUse={}", type, pool.size(),
                         countLocked(ViewportState.IN_USE));
                return Optional.empty();
            }

            availableQueue.remove(viewport.poolId);
            viewport.recordAcquire(contentId, clock.millis());
            contentIndex.put(contentId, viewport.poolId);
            acquired = viewport.snapshot();
        } finally {
            lock.unlock();
        }

        log.debug("Viewport {} acquired for {} ({} uses)", acquired.poolId(), contentId, acquired.usageCount());
        notifyListeners(l -> l.onViewportAcquired(acquired));
        return Optional.of(acquired);
    }

    /**
     * Release an in-use slot. The slot moves to pending cleanup and becomes available after the configured cleanup
     * delay.
     *
     * @return false if the slot is unknown or not in use; pool state is unchanged in that case
     */
    public boolean release(String poolId) {
        if (closed) {
            log.debug("Ignoring release of {} on closed pool", poolId);
            return false;
        }

        ViewportHandle released;
        lock.lock();
        try {
            var viewport = pool.get(poolId);
            if (viewport == null) {
                log.warn("Viewport not found in pool: {}", poolId);
                return false;
            }
            if (viewport.state != ViewportState.IN_USE) {
                log.warn("Viewport {} not in use: {}", poolId, viewport.state);
                return false;
            }

            contentIndex.remove(viewport.contentId);
            viewport.releasedContentId = viewport.contentId;
            viewport.contentId = null;
            viewport.state = ViewportState.PENDING_CLEANUP;
            viewport.pendingCleanup = scheduler.schedule(() -> completeCleanup(poolId),
                                                         config.getCleanupDelay().toMillis(),
                                                         TimeUnit.MILLISECONDS);
            released = viewport.snapshot();
        } finally {
            lock.unlock();
        }

        log.debug("Viewport {} released, cleanup in {}", poolId, config.getCleanupDelay());
        notifyListeners(l -> l.onViewportReleased(released));
        return true;
    }

    /**
     * Run a garbage collection pass: remove available slots idle longer than the max idle time, then shrink the pool
     * if utilization is at or below the shrink threshold. Never goes below the minimum pool size and never touches a
     * slot that is in use or pending cleanup.
     */
    public GarbageCollectionResult runGarbageCollection() {
        if (closed) {
            return new GarbageCollectionResult(0, 0, 0, List.of());
        }
        long start = System.nanoTime();
        var removed = new ArrayList<PooledViewport>();

        lock.lock();
        try {
            long now = clock.millis();
            long maxIdle = config.getMaxIdleTime().toMillis();
            var idle = pool.values()
                           .stream()
                           .filter(v -> v.isIdle(now, maxIdle))
                           .sorted(Comparator.comparingLong(v -> v.lastUsedAt))
                           .collect(Collectors.toList());
            for (var viewport : idle) {
                if (pool.size() <= config.getMinPoolSize()) {
                    break;
                }
                removeLocked(viewport);
                removed.add(viewport);
            }

            removed.addAll(shrinkLocked());

            gcRunCount.incrementAndGet();
            lastGcTime.set(now);
            memoryEstimate.set(estimateMemoryUsageLocked());
        } finally {
            lock.unlock();
        }

        var errors = disposeAll(removed);
        var result = new GarbageCollectionResult(removed.size(), removed.size() * config.getBytesPerViewport(),
                                                 TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), errors);

        if (result.getCleanedViewports() > 0) {
            log.info("Garbage collection removed {} viewports in {} ms, pool size {}", result.getCleanedViewports(),
                     result.getDurationMillis(), size());
        } else {
            log.debug("Garbage collection found nothing to remove");
        }
        notifyListeners(l -> l.onGarbageCollection(result));
        return result;
    }

    /**
     * Out-of-band memory check. When the pool's memory estimate exceeds the configured maximum, or the memory monitor
     * reports high pressure, every available slot above the minimum pool size is removed immediately, followed by a
     * regular garbage collection pass.
     *
     * @return true if a burst collection ran
     */
    public boolean checkMemoryPressure() {
        if (closed) {
            return false;
        }
        long usage = estimateMemoryUsage();
        memoryEstimate.set(usage);

        var level = memoryMonitor == null ? MemoryPressureLevel.NORMAL : memoryMonitor.getPressureLevel();
        boolean overBudget = usage > config.getMaxMemoryUsage();
        if (!overBudget && !level.isAtLeast(MemoryPressureLevel.HIGH)) {
            return false;
        }

        log.warn("Memory pressure detected (estimate {} MB of {} MB, level {}), performing aggressive cleanup",
                 usage / (1024 * 1024), config.getMaxMemoryUsage() / (1024 * 1024), level);

        var removed = new ArrayList<PooledViewport>();
        lock.lock();
        try {
            var available = pool.values()
                                .stream()
                                .filter(v -> v.state == ViewportState.AVAILABLE)
                                .sorted(Comparator.comparingLong(v -> v.lastUsedAt))
                                .collect(Collectors.toList());
            for (var viewport : available) {
                if (pool.size() <= config.getMinPoolSize()) {
                    break;
                }
                removeLocked(viewport);
                removed.add(viewport);
            }
        } finally {
            lock.unlock();
        }
        disposeAll(removed);

        runGarbageCollection();
        return true;
    }

    /**
     * Estimated memory held by the pool: in-use slots count double, all others half of the per-viewport estimate.
     */
    public long estimateMemoryUsage() {
        lock.lock();
        try {
            return estimateMemoryUsageLocked();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ViewportHandle> getViewport(String poolId) {
        lock.lock();
        try {
            var viewport = pool.get(poolId);
            return viewport == null ? Optional.empty() : Optional.of(viewport.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Find the in-use slot presenting the content.
     */
    public Optional<ViewportHandle> findByContent(String contentId) {
        lock.lock();
        try {
            var poolId = contentIndex.get(contentId);
            return poolId == null ? Optional.empty() : Optional.of(pool.get(poolId).snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of every slot, in creation order.
     */
    public List<ViewportHandle> getViewports() {
        lock.lock();
        try {
            return pool.values().stream().map(PooledViewport::snapshot).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pool.size();
        } finally {
            lock.unlock();
        }
    }

    public PoolStatistics getStatistics() {
        lock.lock();
        try {
            long recycled = recycleCount.get();
            long disposed = disposedCount.get();
            double efficiency = recycled + disposed == 0 ? 100.0 : recycled * 100.0 / (recycled + disposed);
            return new PoolStatistics(pool.size(), countLocked(ViewportState.AVAILABLE),
                                      countLocked(ViewportState.IN_USE), countLocked(ViewportState.PENDING_CLEANUP),
                                      recycled, reclaimCount.get(), disposed, gcRunCount.get(),
                                      estimateMemoryUsageLocked(), lastGcTime.get(), efficiency);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluate pool health from current statistics.
     */
    public HealthStatus getHealthStatus() {
        var stats = getStatistics();
        var health = new HealthStatus.Builder();

        if (stats.getPoolEfficiency() < 50.0) {
            health.issue("Low pool efficiency - many viewports being disposed instead of recycled",
                         "Consider adjusting pool size or idle timeout settings");
        }
        if (stats.getMemoryUsage() > config.getMaxMemoryUsage() * 0.9) {
            health.issue("High memory usage approaching limit",
                         "Reduce pool size or trigger manual garbage collection");
        }
        double utilization = stats.getUtilization();
        if (utilization > 0.9) {
            health.issue("High pool utilization", "Consider increasing pool size");
        } else if (utilization < 0.1 && stats.getTotalViewports() > config.getMinPoolSize()) {
            health.issue("Low pool utilization", "Consider decreasing pool size");
        }
        return health.build();
    }

    public ViewportPoolConfiguration getConfiguration() {
        return config;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.shutdownNow();

        List<PooledViewport> all;
        lock.lock();
        try {
            all = new ArrayList<>(pool.values());
            for (var viewport : all) {
                if (viewport.pendingCleanup != null) {
                    viewport.pendingCleanup.cancel(false);
                }
                viewport.state = ViewportState.DISPOSED;
                viewport.contentId = null;
            }
            pool.clear();
            availableQueue.clear();
            contentIndex.clear();
        } finally {
            lock.unlock();
        }

        disposeAll(all);
        listeners.clear();
        log.info("Viewport pool closed, disposed {} viewports", all.size());
    }

    // Slot transitions, all called with the lock held

    private PooledViewport createViewportLocked(ViewportType type) {
        var poolId = "pool-vp-" + nextPoolId.getAndIncrement();
        var viewportId = "viewport-" + UUID.randomUUID();
        Object resource = null;
        try {
            resource = resourceFactory.createResource(poolId, type);
        } catch (RuntimeException e) {
            log.error("Failed to create rendering resource for {}", poolId, e);
        }
        var viewport = new PooledViewport(poolId, viewportId, type, clock.millis(), resource);
        pool.put(poolId, viewport);
        availableQueue.add(poolId);
        log.debug("Created pooled viewport {} ({})", poolId, type);
        return viewport;
    }

    private PooledViewport reclaimPendingLocked(ViewportType type, String contentId) {
        for (var viewport : pool.values()) {
            if (viewport.state == ViewportState.PENDING_CLEANUP && !viewport.cleaning && viewport.type == type
            && contentId.equals(viewport.releasedContentId)) {
                if (viewport.pendingCleanup != null) {
                    viewport.pendingCleanup.cancel(false);
                    viewport.pendingCleanup = null;
                }
                reclaimCount.incrementAndGet();
                log.debug("Reclaimed viewport {} before cleanup for {}", viewport.poolId, contentId);
                return viewport;
            }
        }
        return null;
    }

    private PooledViewport findAvailableLocked(ViewportType type) {
        for (var poolId : availableQueue) {
            var viewport = pool.get(poolId);
            if (viewport != null && viewport.type == type && viewport.state == ViewportState.AVAILABLE) {
                return viewport;
            }
        }
        return null;
    }

    private boolean shouldExpandLocked() {
        if (!config.isAutoScaling() || pool.size() >= config.getMaxPoolSize()) {
            return false;
        }
        if (pool.isEmpty()) {
            return true;
        }
        double utilization = (double) countLocked(ViewportState.IN_USE) / pool.size();
        return utilization >= config.getExpandThreshold();
    }

    private PooledViewport recycleLocked(ViewportType type) {
        PooledViewport oldest = null;
        for (var poolId : availableQueue) {
            var viewport = pool.get(poolId);
            if (viewport != null && viewport.state == ViewportState.AVAILABLE && (oldest == null
                                                                                  || viewport.lastUsedAt
                                                                                     < oldest.lastUsedAt)) {
                oldest = viewport;
            }
        }
        if (oldest == null) {
            return null;
        }

        var previousType = oldest.type;
        if (previousType != type) {
            try {
                resourceFactory.disposeResource(oldest.poolId, oldest.resource);
            } catch (Exception e) {
                log.error("Failed to dispose rendering resource of {} while recycling", oldest.poolId, e);
            }
            oldest.resource = null;
            try {
                oldest.resource = resourceFactory.createResource(oldest.poolId, type);
            } catch (RuntimeException e) {
                log.error("Failed to create rendering resource for recycled {}", oldest.poolId, e);
            }
            oldest.type = type;
        }
        oldest.metadata.clear();
        recycleCount.incrementAndGet();
        log.info("Viewport {} recycled from {} to {}", oldest.poolId, previousType, type);
        return oldest;
    }

    private List<PooledViewport> shrinkLocked() {
        if (!config.isAutoScaling() || pool.size() <= config.getMinPoolSize()) {
            return List.of();
        }
        int inUse = countLocked(ViewportState.IN_USE);
        double utilization = (double) inUse / pool.size();
        if (utilization > config.getShrinkThreshold()) {
            return List.of();
        }

        int target = Math.max(config.getMinPoolSize(), (int) Math.ceil(inUse / config.getShrinkThreshold()));
        int toRemove = Math.max(0, pool.size() - target);
        var candidates = pool.values()
                             .stream()
                             .filter(v -> v.state == ViewportState.AVAILABLE)
                             .sorted(Comparator.<PooledViewport>comparingInt(v -> v.usageCount)
                                               .thenComparingLong(v -> v.createdAt))
                             .limit(toRemove)
                             .collect(Collectors.toList());
        for (var viewport : candidates) {
            removeLocked(viewport);
        }
        if (!candidates.isEmpty()) {
            log.info("Pool shrunk by {} to {} slots", candidates.size(), pool.size());
        }
        return candidates;
    }

    private void removeLocked(PooledViewport viewport) {
        if (viewport.state == ViewportState.IN_USE) {
            throw new IllegalStateException("Cannot remove in-use viewport " + viewport.poolId);
        }
        pool.remove(viewport.poolId);
        availableQueue.remove(viewport.poolId);
        if (viewport.pendingCleanup != null) {
            viewport.pendingCleanup.cancel(false);
            viewport.pendingCleanup = null;
        }
        viewport.state = ViewportState.DISPOSED;
        disposedCount.incrementAndGet();
    }

    private int countLocked(ViewportState state) {
        int count = 0;
        for (var viewport : pool.values()) {
            if (viewport.state == state) {
                count++;
            }
        }
        return count;
    }

    private long estimateMemoryUsageLocked() {
        long perViewport = config.getBytesPerViewport();
        long total = 0;
        for (var viewport : pool.values()) {
            total += viewport.state == ViewportState.IN_USE ? perViewport * 2 : perViewport / 2;
        }
        return total;
    }

    // Deferred work

    private void completeCleanup(String poolId) {
        PooledViewport viewport;
        Object resource;
        lock.lock();
        try {
            viewport = pool.get(poolId);
            if (viewport == null || viewport.state != ViewportState.PENDING_CLEANUP) {
                return;
            }
            viewport.cleaning = true;
            resource = viewport.resource;
        } finally {
            lock.unlock();
        }

        try {
            resourceFactory.cleanResource(poolId, resource);
        } catch (Exception e) {
            // The slot still returns to the pool, otherwise a failing resource would starve it
            log.error("Failed to clean viewport {}", poolId, e);
        }

        ViewportHandle available;
        lock.lock();
        try {
            viewport.cleaning = false;
            if (viewport.state != ViewportState.PENDING_CLEANUP || pool.get(poolId) != viewport) {
                return;
            }
            viewport.state = ViewportState.AVAILABLE;
            viewport.pendingCleanup = null;
            viewport.releasedContentId = null;
            viewport.metadata.clear();
            availableQueue.add(poolId);
            available = viewport.snapshot();
        } finally {
            lock.unlock();
        }

        log.debug("Viewport cleanup completed: {}", poolId);
        notifyListeners(l -> l.onViewportAvailable(available));
    }

    private List<String> disposeAll(List<PooledViewport> removed) {
        var errors = new ArrayList<String>();
        for (var viewport : removed) {
            try {
                resourceFactory.disposeResource(viewport.poolId, viewport.resource);
            } catch (Exception e) {
                log.error("Failed to dispose viewport {}", viewport.poolId, e);
                errors.add("Failed to clean viewport " + viewport.poolId + ": " + e.getMessage());
            }
            viewport.resource = null;
            var handle = viewport.snapshot();
            notifyListeners(l -> l.onViewportRemoved(handle));
        }
        return errors;
    }

    private void scheduledGarbageCollection() {
        try {
            runGarbageCollection();
        } catch (RuntimeException e) {
            log.error("Scheduled garbage collection failed", e);
        }
    }

    private void scheduledMemoryCheck() {
        try {
            checkMemoryPressure();
        } catch (RuntimeException e) {
            log.error("Scheduled memory check failed", e);
        }
    }

    private void notifyListeners(Consumer<ViewportPoolListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Pool listener failed", e);
            }
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Viewport pool is closed");
        }
    }

    /**
     * Outcome of a garbage collection pass
     */
    public static class GarbageCollectionResult {
        private final int          cleanedViewports;
        private final long         freedMemory;
        private final long         durationMillis;
        private final List<String> errors;

        public GarbageCollectionResult(int cleanedViewports, long freedMemory, long durationMillis,
                                       List<String> errors) {
            this.cleanedViewports = cleanedViewports;
            this.freedMemory = freedMemory;
            this.durationMillis = durationMillis;
            this.errors = List.copyOf(errors);
        }

        public int getCleanedViewports() {
            return cleanedViewports;
        }

        /**
         * Estimated bytes freed, derived from the per-viewport estimate.
         */
        public long getFreedMemory() {
            return freedMemory;
        }

        public long getDurationMillis() {
            return durationMillis;
        }

        public List<String> getErrors() {
            return errors;
        }

        @Override
        public String toString() {
            return String.format("GarbageCollectionResult[cleaned=%d, freed=%d bytes, duration=%d ms, errors=%d]",
                                 cleanedViewports, freedMemory, durationMillis, errors.size());
        }
    }

    /**
     * Statistics for the viewport pool
     */
    public static class PoolStatistics {
        private final int    totalViewports;
        private final int    availableViewports;
        private final int    inUseViewports;
        private final int    pendingCleanup;
        private final long   recycleCount;
        private final long   reclaimCount;
        private final long   disposedCount;
        private final long   gcRunCount;
        private final long   memoryUsage;
        private final long   lastGcTime;
        private final double poolEfficiency;

        public PoolStatistics(int totalViewports, int availableViewports, int inUseViewports, int pendingCleanup,
                              long recycleCount, long reclaimCount, long disposedCount, long gcRunCount,
                              long memoryUsage, long lastGcTime, double poolEfficiency) {
            this.totalViewports = totalViewports;
            this.availableViewports = availableViewports;
            this.inUseViewports = inUseViewports;
            this.pendingCleanup = pendingCleanup;
            this.recycleCount = recycleCount;
            this.reclaimCount = reclaimCount;
            this.disposedCount = disposedCount;
            this.gcRunCount = gcRunCount;
            this.memoryUsage = memoryUsage;
            this.lastGcTime = lastGcTime;
            this.poolEfficiency = poolEfficiency;
        }

        public int getTotalViewports() { return totalViewports; }
        public int getAvailableViewports() { return availableViewports; }
        public int getInUseViewports() { return inUseViewports; }
        public int getPendingCleanup() { return pendingCleanup; }
        public long getRecycleCount() { return recycleCount; }
        public long getReclaimCount() { return reclaimCount; }
        public long getDisposedCount() { return disposedCount; }
        public long getGcRunCount() { return gcRunCount; }
        public long getMemoryUsage() { return memoryUsage; }
        public long getLastGcTime() { return lastGcTime; }

        /**
         * Percentage of slot turnover served by recycling rather than disposal.
         */
        public double getPoolEfficiency() { return poolEfficiency; }

        public double getUtilization() {
            return totalViewports == 0 ? 0.0 : (double) inUseViewports / totalViewports;
        }

        @Override
        public String toString() {
            return String.format(
            "PoolStatistics[size=%d, available=%d, inUse=%d, pending=%d, recycled=%d, reclaimed=%d, disposed=%d, gcRuns=%d, memory=%d bytes, efficiency=%.1f%%]",
            totalViewports, availableViewports, inUseViewports, pendingCleanup, recycleCount, reclaimCount,
            disposedCount, gcRunCount, memoryUsage, poolEfficiency);
        }
    }
}
