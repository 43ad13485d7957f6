package com.hellblazer.viewstream.resource;

import java.time.Duration;

/**
 * Immutable configuration for {@link ViewportPool}. Use the {@link Builder} or one of the presets.
 */
public final class ViewportPoolConfiguration {
    private static final long MB = 1024L * 1024;

    private final int      minPoolSize;
    private final int      maxPoolSize;
    private final int      initialPoolSize;
    private final double   expandThreshold;
    private final double   shrinkThreshold;
    private final Duration gcInterval;
    private final Duration maxIdleTime;
    private final Duration cleanupDelay;
    private final Duration memoryCheckInterval;
    private final long     maxMemoryUsage;
    private final long     bytesPerViewport;
    private final boolean  autoScaling;
    private final boolean  garbageCollection;

    private ViewportPoolConfiguration(Builder builder) {
        this.minPoolSize = builder.minPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.initialPoolSize = Math.max(builder.minPoolSize, Math.min(builder.initialPoolSize, builder.maxPoolSize));
        this.expandThreshold = builder.expandThreshold;
        this.shrinkThreshold = builder.shrinkThreshold;
        this.gcInterval = builder.gcInterval;
        this.maxIdleTime = builder.maxIdleTime;
        this.cleanupDelay = builder.cleanupDelay;
        this.memoryCheckInterval = builder.memoryCheckInterval;
        this.maxMemoryUsage = builder.maxMemoryUsage;
        this.bytesPerViewport = builder.bytesPerViewport;
        this.autoScaling = builder.autoScaling;
        this.garbageCollection = builder.garbageCollection;
    }

    public static ViewportPoolConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Small pool for constrained hosts: one to four slots, quick idle reclamation.
     */
    public static ViewportPoolConfiguration minimalConfig() {
        return new Builder().withMinPoolSize(1)
                            .withMaxPoolSize(4)
                            .withInitialPoolSize(1)
                            .withMaxIdleTime(Duration.ofMinutes(1))
                            .withMaxMemoryUsage(256 * MB)
                            .build();
    }

    /**
     * Large pool for multi-monitor reading stations.
     */
    public static ViewportPoolConfiguration productionConfig() {
        return new Builder().withMinPoolSize(4)
                            .withMaxPoolSize(32)
                            .withInitialPoolSize(8)
                            .withMaxIdleTime(Duration.ofMinutes(10))
                            .withMaxMemoryUsage(4096 * MB)
                            .build();
    }

    public Builder toBuilder() {
        return new Builder().withMinPoolSize(minPoolSize)
                            .withMaxPoolSize(maxPoolSize)
                            .withInitialPoolSize(initialPoolSize)
                            .withExpandThreshold(expandThreshold)
                            .withShrinkThreshold(shrinkThreshold)
                            .withGcInterval(gcInterval)
                            .withMaxIdleTime(maxIdleTime)
                            .withCleanupDelay(cleanupDelay)
                            .withMemoryCheckInterval(memoryCheckInterval)
                            .withMaxMemoryUsage(maxMemoryUsage)
                            .withBytesPerViewport(bytesPerViewport)
                            .withAutoScaling(autoScaling)
                            .withGarbageCollection(garbageCollection);
    }

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public int getInitialPoolSize() {
        return initialPoolSize;
    }

    /**
     * Fraction of slots in use at or above which the pool grows.
     */
    public double getExpandThreshold() {
        return expandThreshold;
    }

    /**
     * Fraction of slots in use at or below which the pool shrinks.
     */
    public double getShrinkThreshold() {
        return shrinkThreshold;
    }

    public Duration getGcInterval() {
        return gcInterval;
    }

    public Duration getMaxIdleTime() {
        return maxIdleTime;
    }

    /**
     * Delay between release and the slot becoming available again.
     */
    public Duration getCleanupDelay() {
        return cleanupDelay;
    }

    public Duration getMemoryCheckInterval() {
        return memoryCheckInterval;
    }

    public long getMaxMemoryUsage() {
        return maxMemoryUsage;
    }

    /**
     * Memory estimate for one idle-sized viewport; in-use slots count double, idle ones half.
     */
    public long getBytesPerViewport() {
        return bytesPerViewport;
    }

    public boolean isAutoScaling() {
        return autoScaling;
    }

    public boolean isGarbageCollection() {
        return garbageCollection;
    }

    @Override
    public String toString() {
        return String.format(
        "ViewportPoolConfiguration[min=%d, max=%d, initial=%d, expand=%.2f, shrink=%.2f, gc=%s, idle=%s, cleanup=%s, maxMemory=%dMB, autoScaling=%s, gcEnabled=%s]",
        minPoolSize, maxPoolSize, initialPoolSize, expandThreshold, shrinkThreshold, gcInterval, maxIdleTime,
        cleanupDelay, maxMemoryUsage / MB, autoScaling, garbageCollection);
    }

    public static class Builder {
        private int      minPoolSize         = 2;
        private int      maxPoolSize         = 16;
        private int      initialPoolSize     = 4;
        private double   expandThreshold     = 0.8;
        private double   shrinkThreshold     = 0.2;
        private Duration gcInterval          = Duration.ofMinutes(1);
        private Duration maxIdleTime         = Duration.ofMinutes(5);
        private Duration cleanupDelay        = Duration.ofSeconds(1);
        private Duration memoryCheckInterval = Duration.ofSeconds(30);
        private long     maxMemoryUsage      = 1024 * MB;
        private long     bytesPerViewport    = 50 * MB;
        private boolean  autoScaling         = true;
        private boolean  garbageCollection   = true;

        public Builder withMinPoolSize(int size) {
            this.minPoolSize = size;
            return this;
        }

        public Builder withMaxPoolSize(int size) {
            this.maxPoolSize = size;
            return this;
        }

        public Builder withInitialPoolSize(int size) {
            this.initialPoolSize = size;
            return this;
        }

        public Builder withExpandThreshold(double threshold) {
            this.expandThreshold = threshold;
            return this;
        }

        public Builder withShrinkThreshold(double threshold) {
            this.shrinkThreshold = threshold;
            return this;
        }

        public Builder withGcInterval(Duration interval) {
            this.gcInterval = interval;
            return this;
        }

        public Builder withMaxIdleTime(Duration idleTime) {
            this.maxIdleTime = idleTime;
            return this;
        }

        public Builder withCleanupDelay(Duration delay) {
            this.cleanupDelay = delay;
            return this;
        }

        public Builder withMemoryCheckInterval(Duration interval) {
            this.memoryCheckInterval = interval;
            return this;
        }

        public Builder withMaxMemoryUsage(long bytes) {
            this.maxMemoryUsage = bytes;
            return this;
        }

        public Builder withBytesPerViewport(long bytes) {
            this.bytesPerViewport = bytes;
            return this;
        }

        public Builder withAutoScaling(boolean enabled) {
            this.autoScaling = enabled;
            return this;
        }

        public Builder withGarbageCollection(boolean enabled) {
            this.garbageCollection = enabled;
            return this;
        }

        public ViewportPoolConfiguration build() {
            if (minPoolSize < 0) {
                throw new IllegalArgumentException("Min pool size must be non-negative: " + minPoolSize);
            }
            if (maxPoolSize <= 0) {
                throw new IllegalArgumentException("Max pool size must be positive: " + maxPoolSize);
            }
            if (minPoolSize > maxPoolSize) {
                throw new IllegalArgumentException(
                "Min pool size " + minPoolSize + " exceeds max pool size " + maxPoolSize);
            }
            if (expandThreshold <= 0.0 || expandThreshold > 1.0) {
                throw new IllegalArgumentException("Expand threshold must be within (0, 1]: " + expandThreshold);
            }
            if (shrinkThreshold <= 0.0 || shrinkThreshold > 1.0) {
                throw new IllegalArgumentException("Shrink threshold must be within (0, 1]: " + shrinkThreshold);
            }
            if (shrinkThreshold > expandThreshold) {
                throw new IllegalArgumentException("Shrink threshold must not exceed expand threshold");
            }
            requirePositive(gcInterval, "GC interval");
            requireNonNegative(maxIdleTime, "Max idle time");
            requireNonNegative(cleanupDelay, "Cleanup delay");
            requirePositive(memoryCheckInterval, "Memory check interval");
            if (maxMemoryUsage <= 0) {
                throw new IllegalArgumentException("Max memory usage must be positive");
            }
            if (bytesPerViewport < 0) {
                throw new IllegalArgumentException("Bytes per viewport must be non-negative");
            }
            return new ViewportPoolConfiguration(this);
        }

        private static void requirePositive(Duration duration, String name) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static void requireNonNegative(Duration duration, String name) {
            if (duration == null || duration.isNegative()) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
        }
    }
}
