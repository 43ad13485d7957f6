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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.viewstream.activation.LazyActivationConfig;
import com.hellblazer.viewstream.progressive.ProgressiveLoadingConfig;
import com.hellblazer.viewstream.resource.ViewportPoolConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Reads a {@link ViewstreamProfile} from JSON.
 * <p>
 * The document has optional {@code pool}, {@code activation} and {@code progressive} sections. Each section may name
 * a {@code preset} to start from; fields then override the preset. Missing fields keep their defaults and unknown
 * fields are ignored. Durations are either milliseconds or ISO-8601 strings such as {@code "PT30S"}.
 *
 * @author hal.hildebrand
 */
public class ViewstreamProfileLoader {
    public static final String DEFAULT_PROFILE = "/viewstream-profile.json";

    private static final Logger log = LoggerFactory.getLogger(ViewstreamProfileLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Load the profile bundled on the classpath, or the defaults if there is none.
     */
    public ViewstreamProfile loadDefault() {
        try (InputStream is = getClass().getResourceAsStream(DEFAULT_PROFILE)) {
            if (is == null) {
                log.warn("Profile resource not found: {}, using defaults", DEFAULT_PROFILE);
                return ViewstreamProfile.defaults();
            }
            var profile = load(is);
            log.info("Loaded profile {}", DEFAULT_PROFILE);
            return profile;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULT_PROFILE, e);
        }
    }

    /**
     * @throws IOException              if the stream is not a JSON object
     * @throws IllegalArgumentException if a field has the wrong type or an invalid value
     */
    public ViewstreamProfile load(InputStream in) throws IOException {
        var root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Profile must be a JSON object");
        }
        return new ViewstreamProfile(parsePool(root.path("pool")), parseActivation(root.path("activation")),
                                     parseProgressive(root.path("progressive")));
    }

    private ViewportPoolConfiguration parsePool(JsonNode node) {
        var preset = preset(node, "pool");
        var builder = switch (preset) {
            case "default" -> ViewportPoolConfiguration.defaultConfig().toBuilder();
            case "minimal" -> ViewportPoolConfiguration.minimalConfig().toBuilder();
            case "production" -> ViewportPoolConfiguration.productionConfig().toBuilder();
            default -> throw new IllegalArgumentException("Unknown pool preset: " + preset);
        };
        readInt(node, "pool", "minPoolSize", builder::withMinPoolSize);
        readInt(node, "pool", "maxPoolSize", builder::withMaxPoolSize);
        readInt(node, "pool", "initialPoolSize", builder::withInitialPoolSize);
        readDouble(node, "pool", "expandThreshold", builder::withExpandThreshold);
        readDouble(node, "pool", "shrinkThreshold", builder::withShrinkThreshold);
        readDuration(node, "pool", "gcInterval", builder::withGcInterval);
        readDuration(node, "pool", "maxIdleTime", builder::withMaxIdleTime);
        readDuration(node, "pool", "cleanupDelay", builder::withCleanupDelay);
        readDuration(node, "pool", "memoryCheckInterval", builder::withMemoryCheckInterval);
        readLong(node, "pool", "maxMemoryUsage", builder::withMaxMemoryUsage);
        readLong(node, "pool", "bytesPerViewport", builder::withBytesPerViewport);
        readBoolean(node, "pool", "autoScaling", builder::withAutoScaling);
        readBoolean(node, "pool", "garbageCollection", builder::withGarbageCollection);
        return builder.build();
    }

    private LazyActivationConfig parseActivation(JsonNode node) {
        var preset = preset(node, "activation");
        var config = switch (preset) {
            case "default" -> LazyActivationConfig.defaultConfig();
            case "lowmemory" -> LazyActivationConfig.lowMemory();
            default -> throw new IllegalArgumentException("Unknown activation preset: " + preset);
        };
        readInt(node, "activation", "maxActiveViewports", config::withMaxActiveViewports);
        readBoolean(node, "activation", "preloadAdjacent", config::withPreloadAdjacent);
        readDuration(node, "activation", "preloadDelay", config::withPreloadDelay);
        readDuration(node, "activation", "inactivityTimeout", config::withInactivityTimeout);
        readLong(node, "activation", "memoryThreshold", config::withMemoryThreshold);
        readLong(node, "activation", "bytesPerViewport", config::withBytesPerViewport);
        readBoolean(node, "activation", "predictiveLoading", config::withPredictiveLoading);
        readDuration(node, "activation", "predictionInterval", config::withPredictionInterval);
        readInt(node, "activation", "predictionWindow", config::withPredictionWindow);
        readDouble(node, "activation", "predictionThreshold", config::withPredictionThreshold);
        readDuration(node, "activation", "predictivePreloadDelay", config::withPredictivePreloadDelay);
        readDuration(node, "activation", "activationJoinTimeout", config::withActivationJoinTimeout);
        readDuration(node, "activation", "memoryCheckInterval", config::withMemoryCheckInterval);
        if (node.has("historyLimit") || node.has("historyRetain")) {
            int[] history = { config.getHistoryLimit(), config.getHistoryRetain() };
            readInt(node, "activation", "historyLimit", limit -> history[0] = limit);
            readInt(node, "activation", "historyRetain", retain -> history[1] = retain);
            config.withHistory(history[0], history[1]);
        }
        return config;
    }

    private ProgressiveLoadingConfig parseProgressive(JsonNode node) {
        var preset = preset(node, "progressive");
        var config = switch (preset) {
            case "default" -> ProgressiveLoadingConfig.defaultConfig();
            case "sequential" -> ProgressiveLoadingConfig.sequential();
            default -> throw new IllegalArgumentException("Unknown progressive preset: " + preset);
        };
        readInt(node, "progressive", "chunkSize", config::withChunkSize);
        readInt(node, "progressive", "maxConcurrentChunks", config::withMaxConcurrentChunks);
        readInt(node, "progressive", "priorityLevels", config::withPriorityLevels);
        readDouble(node, "progressive", "memoryThreshold", config::withMemoryThreshold);
        readBoolean(node, "progressive", "adaptiveChunkSize", config::withAdaptiveChunkSize);
        readBoolean(node, "progressive", "networkAdaptation", config::withNetworkAdaptation);
        readDuration(node, "progressive", "tickInterval", config::withTickInterval);
        readDuration(node, "progressive", "chunkTimeout", config::withChunkTimeout);
        readLong(node, "progressive", "bytesPerItemEstimate", config::withBytesPerItemEstimate);
        readBoolean(node, "progressive", "autoStart", config::withAutoStart);
        return config;
    }

    private static String preset(JsonNode section, String sectionName) {
        if (!section.isMissingNode() && !section.isNull() && !section.isObject()) {
            throw new IllegalArgumentException(sectionName + " must be an object");
        }
        var preset = section.path("preset");
        if (preset.isMissingNode() || preset.isNull()) {
            return "default";
        }
        if (!preset.isTextual()) {
            throw new IllegalArgumentException(sectionName + ".preset must be a string");
        }
        return preset.asText().toLowerCase(Locale.ROOT);
    }

    private static JsonNode field(JsonNode section, String name) {
        var value = section.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static void readInt(JsonNode section, String sectionName, String name, IntConsumer setter) {
        var value = field(section, name);
        if (value == null) {
            return;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(sectionName + "." + name + " must be an integer");
        }
        setter.accept(value.intValue());
    }

    private static void readLong(JsonNode section, String sectionName, String name, LongConsumer setter) {
        var value = field(section, name);
        if (value == null) {
            return;
        }
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException(sectionName + "." + name + " must be an integer");
        }
        setter.accept(value.longValue());
    }

    private static void readDouble(JsonNode section, String sectionName, String name, DoubleConsumer setter) {
        var value = field(section, name);
        if (value == null) {
            return;
        }
        if (!value.isNumber()) {
            throw new IllegalArgumentException(sectionName + "." + name + " must be a number");
        }
        setter.accept(value.doubleValue());
    }

    private static void readBoolean(JsonNode section, String sectionName, String name, Consumer<Boolean> setter) {
        var value = field(section, name);
        if (value == null) {
            return;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException(sectionName + "." + name + " must be a boolean");
        }
        setter.accept(value.booleanValue());
    }

    private static void readDuration(JsonNode section, String sectionName, String name, Consumer<Duration> setter) {
        var value = field(section, name);
        if (value == null) {
            return;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            setter.accept(Duration.ofMillis(value.longValue()));
        } else if (value.isTextual()) {
            try {
                setter.accept(Duration.parse(value.asText()));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(sectionName + "." + name + " is not an ISO-8601 duration", e);
            }
        } else {
            throw new IllegalArgumentException(sectionName + "." + name + " must be milliseconds or a duration");
        }
    }
}
