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
package com.hellblazer.viewstream.common;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling estimator of transfer speed. Each completed transfer contributes one bytes/second sample; the estimate is
 * the mean of the most recent samples.
 *
 * @author hal.hildebrand
 */
public class NetworkMonitor {
    public static final double DEFAULT_SPEED       = 1024 * 1024; // 1 MiB/s with no history
    public static final int    DEFAULT_MAX_HISTORY = 10;

    private final Map<String, Long> transfers = new ConcurrentHashMap<>();
    private final Deque<Double>     speedHistory = new ArrayDeque<>();
    private final int               maxHistory;

    public NetworkMonitor() {
        this(DEFAULT_MAX_HISTORY);
    }

    public NetworkMonitor(int maxHistory) {
        if (maxHistory <= 0) {
            throw new IllegalArgumentException("History size must be positive");
        }
        this.maxHistory = maxHistory;
    }

    public void startTransfer(String id) {
        transfers.put(id, System.nanoTime());
    }

    /**
     * Complete a transfer and record its speed. Unknown ids are ignored.
     */
    public void endTransfer(String id, long bytesTransferred) {
        var start = transfers.remove(id);
        if (start == null) {
            return;
        }
        double seconds = Math.max(System.nanoTime() - start, 1L) / 1_000_000_000.0;
        recordSample(bytesTransferred / seconds);
    }

    /**
     * Record an externally measured speed in bytes/second.
     */
    public void recordSample(double bytesPerSecond) {
        if (Double.isNaN(bytesPerSecond) || bytesPerSecond < 0) {
            return;
        }
        synchronized (speedHistory) {
            speedHistory.addLast(bytesPerSecond);
            while (speedHistory.size() > maxHistory) {
                speedHistory.removeFirst();
            }
        }
    }

    public double getAverageSpeed() {
        synchronized (speedHistory) {
            if (speedHistory.isEmpty()) {
                return DEFAULT_SPEED;
            }
            double sum = 0;
            for (var speed : speedHistory) {
                sum += speed;
            }
            return sum / speedHistory.size();
        }
    }

    public int getActiveTransfers() {
        return transfers.size();
    }

    public void dispose() {
        transfers.clear();
        synchronized (speedHistory) {
            speedHistory.clear();
        }
    }
}
