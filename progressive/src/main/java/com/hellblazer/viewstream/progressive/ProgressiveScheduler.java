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
package com.hellblazer.viewstream.progressive;

import com.hellblazer.viewstream.common.MemoryMonitor;
import com.hellblazer.viewstream.common.NetworkMonitor;
import com.hellblazer.viewstream.common.ResourcePressureSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Splits large item lists into prioritized chunks and loads them with bounded concurrency.
 * <p>
 * Chunks wait in one FIFO bucket per priority level. Every tick the scheduler first evicts retained results if
 * memory is over threshold, then dispatches chunks from the most urgent bucket down while fewer than
 * {@link ProgressiveLoadingConfig#getMaxConcurrentChunks()} chunks are loading. Items of a chunk are fetched one
 * after another on a worker thread; the chunk's abort flag is polled between items.
 *
 * @author hal.hildebrand
 */
public class ProgressiveScheduler implements AutoCloseable {
    private static final Logger log               = LoggerFactory.getLogger(ProgressiveScheduler.class);
    private static final double MB                = 1024.0 * 1024.0;
    private static final double FAST_NETWORK      = 10 * MB;
    private static final double SLOW_NETWORK      = MB;
    private static final double HIGH_MEMORY       = 0.8;
    private static final double LOW_MEMORY        = 0.4;
    private static final int    MAX_CHUNK_SIZE    = 50;
    private static final double EVICTION_FRACTION = 0.25;

    private final ProgressiveLoadingConfig                 config;
    private final ItemLoader                               itemLoader;
    private final MemoryMonitor                            memoryMonitor;
    private final NetworkMonitor                           networkMonitor;
    private final Clock                                    clock;
    private final ExecutorService                          workers;
    private final ScheduledExecutorService                 ticker;
    private final ReentrantLock                            lock           = new ReentrantLock();
    private final List<LinkedList<ProgressiveLoadRequest>> buckets        = new ArrayList<>();
    private final Map<String, LoadingSession>              sessions       = new LinkedHashMap<>();
    private final Map<String, LoadOptions>                 sessionOptions = new HashMap<>();
    private final Map<String, ChunkTracker>                trackers       = new HashMap<>();
    private final Map<String, ChunkTracker>                active         = new LinkedHashMap<>();
    private final Map<String, List<ItemResult>>            retained       = new LinkedHashMap<>();
    // Chunks queued again while their aborted load is still unwinding
    private final Map<String, ProgressiveLoadRequest>      requeue        = new HashMap<>();
    private final Set<String>                              cancelled      = new HashSet<>();
    private final Set<String>                              reported       = new HashSet<>();
    private final Set<String>                              bound          = new HashSet<>();
    private final List<ProgressiveLoadListener>            listeners      = new CopyOnWriteArrayList<>();
    private final AtomicBoolean                            ticking        = new AtomicBoolean();
    private final AtomicBoolean                            started        = new AtomicBoolean();

    private volatile ViewportBinder binder;
    private volatile boolean        closed = false;

    public ProgressiveScheduler(ProgressiveLoadingConfig config, ItemLoader itemLoader) {
        this(config, itemLoader, new MemoryMonitor(ResourcePressureSource.jvmHeap(), config.getMemoryThreshold()),
             new NetworkMonitor(), Clock.systemUTC());
    }

    public ProgressiveScheduler(ProgressiveLoadingConfig config, ItemLoader itemLoader, MemoryMonitor memoryMonitor,
                                NetworkMonitor networkMonitor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.itemLoader = Objects.requireNonNull(itemLoader, "itemLoader");
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor");
        this.networkMonitor = Objects.requireNonNull(networkMonitor, "networkMonitor");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (int i = 0; i < LoadPriority.values().length; i++) {
            buckets.add(new LinkedList<>());
        }
        var workerCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(config.getMaxConcurrentChunks(), r -> {
            var thread = new Thread(r, "progressive-loader-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "progressive-tick");
            thread.setDaemon(true);
            return thread;
        });
        log.info("Progressive scheduler initialized: {}", config);
        if (config.isAutoStart()) {
            start();
        }
    }

    /**
     * Start the periodic tick. Calling it again has no effect.
     */
    public void start() {
        ensureNotClosed();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long millis = config.getTickInterval().toMillis();
        ticker.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Tick loop started every {}ms", millis);
    }

    public void setViewportBinder(ViewportBinder binder) {
        this.binder = binder;
    }

    public void addListener(ProgressiveLoadListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ProgressiveLoadListener listener) {
        listeners.remove(listener);
    }

    // Sessions

    /**
     * Partition the items into chunks and store the session. Chunks are not queued until
     * {@link #queueSession(String)} is called.
     *
     * @return the session id
     * @throws IllegalArgumentException if the item list is empty or the session id is already in use
     */
    public String createLoadingSession(String sessionId, List<String> itemIds, SessionMetadata metadata,
                                       LoadingStrategy strategy) {
        Objects.requireNonNull(sessionId, "sessionId");
        ensureNotClosed();
        if (itemIds == null || itemIds.isEmpty()) {
            throw new IllegalArgumentException("Session " + sessionId + " has no items");
        }
        var effectiveStrategy = strategy == null ? LoadingStrategy.ADAPTIVE : strategy;
        int total = itemIds.size();
        int chunkSize = calculateOptimalChunkSize(total, effectiveStrategy);
        int totalChunks = (total + chunkSize - 1) / chunkSize;
        long now = clock.millis();

        var chunks = new ArrayList<ProgressiveLoadRequest>(totalChunks);
        for (int i = 0; i < totalChunks; i++) {
            var items = itemIds.subList(i * chunkSize, Math.min(total, (i + 1) * chunkSize));
            chunks.add(new ProgressiveLoadRequest(ProgressiveLoadRequest.chunkId(sessionId, i), sessionId, items,
                                                  effectiveStrategy.priorityFor(i, totalChunks), i, totalChunks,
                                                  items.size() * config.getBytesPerItemEstimate(), now,
                                                  config.getChunkTimeout()));
        }
        var session = new LoadingSession(sessionId, chunks, total, effectiveStrategy,
                                         metadata == null ? SessionMetadata.UNKNOWN : metadata, now);
        lock.lock();
        try {
            if (sessions.containsKey(sessionId)) {
                throw new IllegalArgumentException("Session already exists: " + sessionId);
            }
            sessions.put(sessionId, session);
        } finally {
            lock.unlock();
        }
        log.info("Created loading session {}: {} items in {} chunks of {} ({})", sessionId, total, totalChunks,
                 chunkSize, effectiveStrategy);
        return sessionId;
    }

    /**
     * Chunk size for a dataset of the given size under current network and memory conditions.
     */
    public int calculateOptimalChunkSize(int totalItems, LoadingStrategy strategy) {
        int base = config.getChunkSize();
        if (!config.isAdaptiveChunkSize()) {
            return base;
        }
        double multiplier = 1.0;
        if (config.isNetworkAdaptation()) {
            double speed = networkMonitor.getAverageSpeed();
            if (speed > FAST_NETWORK) {
                multiplier *= 1.5;
            } else if (speed < SLOW_NETWORK) {
                multiplier *= 0.5;
            }
        }
        double memory = memoryMonitor.getCurrentUsage();
        if (memory > HIGH_MEMORY) {
            multiplier *= 0.6;
        } else if (memory < LOW_MEMORY) {
            multiplier *= 1.3;
        }
        multiplier *= strategy.chunkSizeMultiplier();

        int adjusted = Math.max(1, (int) Math.floor(base * multiplier));
        int cap = Math.min(MAX_CHUNK_SIZE, (int) Math.ceil(totalItems / 10.0));
        return Math.max(1, Math.min(adjusted, cap));
    }

    /**
     * Queue every chunk of the session at the priority its strategy assigned.
     */
    public void queueSession(String sessionId) {
        queueSession(sessionId, null);
    }

    /**
     * Queue every chunk of the session, rewriting each chunk's priority when one is given.
     *
     * @throws IllegalArgumentException if the session is unknown
     */
    public void queueSession(String sessionId, LoadPriority priority) {
        ensureNotClosed();
        LoadingSession session;
        lock.lock();
        try {
            session = sessions.get(sessionId);
            if (session == null) {
                throw new IllegalArgumentException("Unknown session: " + sessionId);
            }
            cancelled.remove(sessionId);
            reported.remove(sessionId);
            session.touch(clock.millis());
        } finally {
            lock.unlock();
        }
        for (var chunk : session.getChunks()) {
            if (priority != null) {
                chunk.setPriority(priority);
            }
            queueChunk(chunk);
        }
        log.info("Queued session {} ({} chunks{})", sessionId, session.getChunks().size(),
                 priority == null ? "" : " at " + priority);
    }

    /**
     * Insert a single chunk into its priority bucket, after every chunk created no later than it. A chunk whose
     * cancelled load has not stopped yet is queued as soon as that load finishes.
     *
     * @return false if the scheduler is closed or the chunk is loading right now
     */
    public boolean queueChunk(ProgressiveLoadRequest request) {
        Objects.requireNonNull(request, "request");
        if (closed) {
            return false;
        }
        if (request.getPriority().level() > config.getPriorityLevels()) {
            var clamped = LoadPriority.fromLevel(config.getPriorityLevels());
            log.debug("Chunk {} priority {} folded into {}", request.getId(), request.getPriority(), clamped);
            request.setPriority(clamped);
        }
        lock.lock();
        try {
            var running = active.get(request.getId());
            if (running != null) {
                if (!running.isAborted()) {
                    log.warn("Chunk already loading, not queued: {}", request.getId());
                    return false;
                }
                requeue.put(request.getId(), request);
                log.debug("Chunk {} still stopping, queued once its load ends", request.getId());
                return true;
            }
            for (var bucket : buckets) {
                bucket.removeIf(queued -> queued.getId().equals(request.getId()));
            }
            var bucket = buckets.get(request.getPriority().level() - 1);
            int index = 0;
            while (index < bucket.size() && bucket.get(index).getCreatedAt() <= request.getCreatedAt()) {
                index++;
            }
            bucket.add(index, request);
            retained.remove(request.getId());
            trackers.put(request.getId(), new ChunkTracker(request, networkMonitor.getAverageSpeed()));
        } finally {
            lock.unlock();
        }
        notifyListeners(l -> l.chunkQueued(request));
        return true;
    }

    /**
     * Create and queue a session in one step, wiring the option callbacks.
     *
     * @return the session id, generated when the options carry none
     */
    public String loadDataset(List<String> itemIds, LoadOptions options) {
        var opts = options == null ? LoadOptions.defaults() : options;
        var sessionId = opts.getSessionId() != null ? opts.getSessionId() : generateSessionId();
        createLoadingSession(sessionId, itemIds, opts.getMetadata(), opts.getStrategy());
        lock.lock();
        try {
            sessionOptions.put(sessionId, opts);
        } finally {
            lock.unlock();
        }
        queueSession(sessionId, opts.getPriority());
        return sessionId;
    }

    /**
     * Abort the session's in-flight chunks and drop its queued ones. Cancelling twice has no further effect.
     *
     * @return false if the session is unknown
     */
    public boolean cancelSession(String sessionId) {
        boolean wasBound;
        int purged = 0;
        lock.lock();
        try {
            var session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            if (!cancelled.add(sessionId)) {
                return true;
            }
            for (var bucket : buckets) {
                int before = bucket.size();
                bucket.removeIf(queued -> sessionId.equals(queued.getSessionId()));
                purged += before - bucket.size();
            }
            requeue.values().removeIf(queued -> sessionId.equals(queued.getSessionId()));
            for (var chunk : session.getChunks()) {
                var tracker = trackers.get(chunk.getId());
                if (tracker != null) {
                    tracker.abort();
                }
            }
            wasBound = bound.remove(sessionId);
        } finally {
            lock.unlock();
        }
        if (wasBound) {
            unbind(sessionId);
        }
        notifyListeners(l -> l.sessionCancelled(sessionId));
        log.info("Cancelled session {} ({} queued chunks purged)", sessionId, purged);
        return true;
    }

    /**
     * Forget a session that is no longer loading, along with its progress and retained results.
     *
     * @return false if the session is unknown or still has chunks loading
     */
    public boolean releaseSession(String sessionId) {
        lock.lock();
        try {
            var session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            for (var chunk : session.getChunks()) {
                if (active.containsKey(chunk.getId())) {
                    return false;
                }
            }
            for (var bucket : buckets) {
                bucket.removeIf(queued -> sessionId.equals(queued.getSessionId()));
            }
            for (var chunk : session.getChunks()) {
                trackers.remove(chunk.getId());
                retained.remove(chunk.getId());
            }
            sessions.remove(sessionId);
            sessionOptions.remove(sessionId);
            cancelled.remove(sessionId);
            reported.remove(sessionId);
        } finally {
            lock.unlock();
        }
        log.debug("Released session {}", sessionId);
        return true;
    }

    // Scheduling

    /**
     * One scheduling pass. Overlapping calls return immediately.
     */
    public void tick() {
        if (closed || !ticking.compareAndSet(false, true)) {
            return;
        }
        try {
            evictUnderPressure();
            dispatch();
        } catch (RuntimeException e) {
            log.error("Scheduling pass failed", e);
        } finally {
            ticking.set(false);
        }
    }

    private void evictUnderPressure() {
        if (!memoryMonitor.isOverThreshold()) {
            return;
        }
        List<String> evicted;
        lock.lock();
        try {
            if (retained.isEmpty()) {
                return;
            }
            var oldest = new ArrayList<>(retained.keySet());
            oldest.sort(Comparator.comparingInt(this::chunkIndexOf));
            int count = (int) Math.ceil(oldest.size() * EVICTION_FRACTION);
            evicted = oldest.subList(0, count);
            evicted.forEach(retained::remove);
        } finally {
            lock.unlock();
        }
        log.info("Memory usage {} over threshold, evicted {} chunk results", memoryMonitor.getCurrentUsage(),
                 evicted.size());
        for (var chunkId : evicted) {
            notifyListeners(l -> l.chunkEvicted(chunkId));
        }
    }

    private int chunkIndexOf(String chunkId) {
        var tracker = trackers.get(chunkId);
        return tracker == null ? Integer.MAX_VALUE : tracker.request.getChunkIndex();
    }

    private void dispatch() {
        while (!closed) {
            ProgressiveLoadRequest next;
            lock.lock();
            try {
                if (active.size() >= config.getMaxConcurrentChunks()) {
                    return;
                }
                next = pollLocked();
            } finally {
                lock.unlock();
            }
            if (next == null) {
                return;
            }
            var sessionId = next.getSessionId();
            if (sessionId != null && !bindSession(sessionId)) {
                lock.lock();
                try {
                    if (!cancelled.contains(sessionId)) {
                        buckets.get(next.getPriority().level() - 1).addFirst(next);
                    }
                } finally {
                    lock.unlock();
                }
                log.debug("Viewport unavailable for session {}, deferring {}", sessionId, next.getId());
                return;
            }
            ChunkTracker tracker;
            lock.lock();
            try {
                if (sessionId != null && cancelled.contains(sessionId)) {
                    continue;
                }
                tracker = trackers.get(next.getId());
                active.put(next.getId(), tracker);
            } finally {
                lock.unlock();
            }
            try {
                workers.execute(() -> processChunk(next, tracker));
            } catch (RejectedExecutionException e) {
                log.debug("Worker pool shut down, dropping {}", next.getId());
                removeActive(next.getId());
                return;
            }
            log.debug("Dispatched {} at {}", next.getId(), next.getPriority());
        }
    }

    private ProgressiveLoadRequest pollLocked() {
        for (var bucket : buckets) {
            if (!bucket.isEmpty()) {
                return bucket.removeFirst();
            }
        }
        return null;
    }

    /**
     * @return true if the session holds a viewport, or no binder is installed
     */
    private boolean bindSession(String sessionId) {
        var currentBinder = binder;
        if (currentBinder == null) {
            return true;
        }
        boolean ok;
        try {
            ok = currentBinder.bind(sessionId);
        } catch (RuntimeException e) {
            log.warn("Binding viewport for session {} failed", sessionId, e);
            ok = false;
        }
        if (!ok) {
            return false;
        }
        boolean drop;
        lock.lock();
        try {
            drop = cancelled.contains(sessionId) || !sessions.containsKey(sessionId);
            if (!drop) {
                bound.add(sessionId);
            }
        } finally {
            lock.unlock();
        }
        if (drop) {
            unbind(sessionId);
        }
        return true;
    }

    private void unbind(String sessionId) {
        var currentBinder = binder;
        if (currentBinder == null) {
            return;
        }
        try {
            currentBinder.unbind(sessionId);
        } catch (RuntimeException e) {
            log.warn("Releasing viewport for session {} failed", sessionId, e);
        }
    }

    // Chunk processing

    private void processChunk(ProgressiveLoadRequest request, ChunkTracker tracker) {
        var results = new ArrayList<ItemResult>(request.getItemIds().size());
        if (!tracker.start()) {
            finishChunk(request, tracker, results, null);
            return;
        }
        networkMonitor.startTransfer(request.getId());
        var initial = tracker.snapshot();
        notifyListeners(l -> l.chunkStarted(initial));

        long deadline = System.nanoTime() + request.getTimeout().toNanos();
        Throwable failure = null;
        try {
            for (var itemId : request.getItemIds()) {
                if (tracker.isAborted()) {
                    break;
                }
                if (!loadItem(request, tracker, itemId, deadline, results)) {
                    break;
                }
                reportItemProgress(request, tracker);
            }
        } catch (TimeoutException e) {
            log.warn("Chunk {} timed out after {}", request.getId(), request.getTimeout());
            failure = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (RuntimeException e) {
            log.error("Chunk {} failed", request.getId(), e);
            failure = e;
        }
        finishChunk(request, tracker, results, failure);
    }

    /**
     * @return false if the chunk was aborted while the item loaded
     */
    private boolean loadItem(ProgressiveLoadRequest request, ChunkTracker tracker, String itemId, long deadline,
                             List<ItemResult> results) throws TimeoutException, InterruptedException {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new TimeoutException("Chunk " + request.getId() + " exceeded " + request.getTimeout());
        }
        var fetch = fetch(itemId);
        tracker.setCurrent(fetch);
        try {
            var item = fetch.get(remaining, TimeUnit.NANOSECONDS);
            if (item == null) {
                results.add(ItemResult.failed(itemId, new IllegalStateException("No item loaded for " + itemId)));
                tracker.itemFailed();
            } else {
                results.add(ItemResult.loaded(itemId, item));
                tracker.itemLoaded(item.sizeBytes());
                log.trace("Loaded {} ({} bytes) in {}", itemId, item.sizeBytes(), request.getId());
            }
        } catch (ExecutionException e) {
            log.warn("Failed to load item {} in {}: {}", itemId, request.getId(), e.getCause().toString());
            results.add(ItemResult.failed(itemId, e.getCause()));
            tracker.itemFailed();
        } catch (CancellationException e) {
            if (tracker.isAborted()) {
                return false;
            }
            results.add(ItemResult.failed(itemId, e));
            tracker.itemFailed();
        } catch (TimeoutException e) {
            fetch.cancel(true);
            throw new TimeoutException("Chunk " + request.getId() + " exceeded " + request.getTimeout());
        } finally {
            tracker.setCurrent(null);
        }
        return true;
    }

    private CompletableFuture<LoadedItem> fetch(String itemId) {
        try {
            return Objects.requireNonNull(itemLoader.load(itemId), "Item loader returned no future");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void reportItemProgress(ProgressiveLoadRequest request, ChunkTracker tracker) {
        var progress = tracker.snapshot();
        var callback = request.getOnProgress();
        if (callback != null) {
            safely(() -> callback.accept(progress), request.getId());
        }
        notifyListeners(l -> l.chunkProgress(progress));
        reportSessionProgress(request.getSessionId());
    }

    private void finishChunk(ProgressiveLoadRequest request, ChunkTracker tracker, List<ItemResult> results,
                             Throwable failure) {
        var status = tracker.finish(failure);
        networkMonitor.endTransfer(request.getId(), tracker.bytesLoaded());
        var chunkResults = List.copyOf(results);
        ProgressiveLoadRequest again;
        lock.lock();
        try {
            active.remove(request.getId());
            again = requeue.remove(request.getId());
            if (status == ChunkStatus.COMPLETED && trackers.get(request.getId()) == tracker) {
                retained.put(request.getId(), chunkResults);
            }
            var session = request.getSessionId() == null ? null : sessions.get(request.getSessionId());
            if (session != null) {
                session.touch(clock.millis());
            }
        } finally {
            lock.unlock();
        }

        var progress = tracker.snapshot();
        switch (status) {
            case COMPLETED -> {
                log.debug("Chunk {} completed: {} loaded, {} failed", request.getId(), progress.loadedItems(),
                          progress.failedItems());
                var callback = request.getOnComplete();
                if (callback != null) {
                    safely(() -> callback.accept(chunkResults), request.getId());
                }
                notifyListeners(l -> l.chunkCompleted(progress, chunkResults));
            }
            case ERROR -> {
                log.error("Chunk {} failed", request.getId(), failure);
                var callback = request.getOnError();
                if (callback != null) {
                    safely(() -> callback.accept(failure), request.getId());
                }
                notifyListeners(l -> l.chunkFailed(progress, failure));
            }
            default -> log.debug("Chunk {} cancelled", request.getId());
        }
        if (again != null) {
            queueChunk(again);
        }
        reportSessionProgress(request.getSessionId());
        checkSessionCompletion(request.getSessionId());
    }

    private void reportSessionProgress(String sessionId) {
        if (sessionId == null) {
            return;
        }
        LoadOptions options;
        lock.lock();
        try {
            options = sessionOptions.get(sessionId);
        } finally {
            lock.unlock();
        }
        if (options == null || options.getOnProgress() == null) {
            return;
        }
        getSessionProgress(sessionId).ifPresent(
        progress -> safely(() -> options.getOnProgress().accept(progress), sessionId));
    }

    private void checkSessionCompletion(String sessionId) {
        if (sessionId == null) {
            return;
        }
        SessionProgress progress;
        LoadOptions options;
        Map<String, List<ItemResult>> results = new LinkedHashMap<>();
        boolean wasBound;
        lock.lock();
        try {
            var session = sessions.get(sessionId);
            if (session == null || reported.contains(sessionId) || cancelled.contains(sessionId)) {
                return;
            }
            for (var chunk : session.getChunks()) {
                var tracker = trackers.get(chunk.getId());
                if (tracker == null || !tracker.status().isTerminal()) {
                    return;
                }
            }
            progress = progressLocked(session);
            if (progress.status() != SessionStatus.COMPLETED && progress.status() != SessionStatus.ERROR) {
                return;
            }
            reported.add(sessionId);
            wasBound = bound.remove(sessionId);
            options = sessionOptions.get(sessionId);
            for (var chunk : session.getChunks()) {
                var chunkResults = retained.get(chunk.getId());
                if (chunkResults != null) {
                    results.put(chunk.getId(), chunkResults);
                }
            }
        } finally {
            lock.unlock();
        }
        if (wasBound) {
            unbind(sessionId);
        }
        log.info("Session {} finished {}: {}/{} items loaded", sessionId, progress.status(), progress.loadedItems(),
                 progress.totalItems());
        notifyListeners(l -> l.sessionCompleted(progress));
        if (progress.status() == SessionStatus.COMPLETED && options != null && options.getOnComplete() != null) {
            safely(() -> options.getOnComplete().accept(sessionId, Collections.unmodifiableMap(results)), sessionId);
        }
    }

    // Queries

    public Optional<SessionProgress> getSessionProgress(String sessionId) {
        lock.lock();
        try {
            var session = sessions.get(sessionId);
            return session == null ? Optional.empty() : Optional.of(progressLocked(session));
        } finally {
            lock.unlock();
        }
    }

    private SessionProgress progressLocked(LoadingSession session) {
        int completed = 0, loading = 0, errors = 0, cancelledChunks = 0, loadedItems = 0, failedItems = 0;
        long totalBytes = 0, loadedBytes = 0;
        for (var chunk : session.getChunks()) {
            totalBytes += chunk.getEstimatedSize();
            var tracker = trackers.get(chunk.getId());
            if (tracker == null) {
                continue;
            }
            var progress = tracker.snapshot();
            switch (progress.status()) {
                case COMPLETED -> completed++;
                case LOADING -> loading++;
                case ERROR -> errors++;
                case CANCELLED -> cancelledChunks++;
                default -> {
                }
            }
            loadedItems += progress.loadedItems();
            failedItems += progress.failedItems();
            loadedBytes += progress.bytesLoaded();
        }
        int totalChunks = session.getChunks().size();
        SessionStatus status;
        if (cancelled.contains(session.getSessionId())) {
            status = SessionStatus.CANCELLED;
        } else if (completed == totalChunks) {
            status = SessionStatus.COMPLETED;
        } else if (loading > 0) {
            status = SessionStatus.LOADING;
        } else if (errors > 0) {
            status = SessionStatus.ERROR;
        } else if (completed == 0 && cancelledChunks == 0 && loadedItems + failedItems == 0) {
            status = SessionStatus.PENDING;
        } else {
            status = SessionStatus.LOADING;
        }
        int percentage = (int) Math.round((loadedItems + failedItems) * 100.0 / session.getTotalItems());
        return new SessionProgress(session.getSessionId(), totalChunks, completed, loading, errors, cancelledChunks,
                                   session.getTotalItems(), loadedItems, failedItems, totalBytes, loadedBytes,
                                   percentage, status);
    }

    public Optional<ChunkProgress> getChunkProgress(String chunkId) {
        lock.lock();
        try {
            var tracker = trackers.get(chunkId);
            return tracker == null ? Optional.empty() : Optional.of(tracker.snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Results of a completed chunk, until they are evicted under memory pressure.
     */
    public Optional<List<ItemResult>> getChunkResults(String chunkId) {
        lock.lock();
        try {
            return Optional.ofNullable(retained.get(chunkId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<LoadingSession> getSession(String sessionId) {
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    public int getQueuedChunkCount() {
        lock.lock();
        try {
            int count = 0;
            for (var bucket : buckets) {
                count += bucket.size();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int getActiveChunkCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    public ProgressiveLoadingConfig getConfig() {
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
        ticker.shutdownNow();
        List<ChunkTracker> inflight;
        List<String> boundSessions;
        lock.lock();
        try {
            inflight = new ArrayList<>(active.values());
            boundSessions = new ArrayList<>(bound);
            buckets.forEach(List::clear);
            requeue.clear();
            bound.clear();
        } finally {
            lock.unlock();
        }
        inflight.forEach(ChunkTracker::abort);
        workers.shutdownNow();
        boundSessions.forEach(this::unbind);
        memoryMonitor.dispose();
        networkMonitor.dispose();
        lock.lock();
        try {
            sessions.clear();
            sessionOptions.clear();
            trackers.clear();
            active.clear();
            retained.clear();
            cancelled.clear();
            reported.clear();
        } finally {
            lock.unlock();
        }
        listeners.clear();
        log.info("Progressive scheduler closed, {} chunks aborted", inflight.size());
    }

    private void removeActive(String chunkId) {
        lock.lock();
        try {
            active.remove(chunkId);
        } finally {
            lock.unlock();
        }
    }

    private String generateSessionId() {
        return "session-" + clock.millis() + "-" + Long.toString(ThreadLocalRandom.current().nextLong(1L << 46), 36);
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Progressive scheduler is closed");
        }
    }

    private void notifyListeners(Consumer<ProgressiveLoadListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Progressive load listener failed", e);
            }
        }
    }

    private void safely(Runnable callback, String source) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Callback for {} failed", source, e);
        }
    }
}
