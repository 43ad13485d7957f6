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

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Options for {@link ProgressiveScheduler#loadDataset}. Unset values default to a generated session id, ADAPTIVE,
 * NORMAL and unknown metadata.
 */
public class LoadOptions {
    private String                                            sessionId;
    private LoadingStrategy                                   strategy = LoadingStrategy.ADAPTIVE;
    private LoadPriority                                      priority = LoadPriority.NORMAL;
    private SessionMetadata                                   metadata = SessionMetadata.UNKNOWN;
    private Consumer<SessionProgress>                         onProgress;
    private BiConsumer<String, Map<String, List<ItemResult>>> onComplete;

    public static LoadOptions defaults() {
        return new LoadOptions();
    }

    public String getSessionId() {
        return sessionId;
    }

    public LoadingStrategy getStrategy() {
        return strategy;
    }

    public LoadPriority getPriority() {
        return priority;
    }

    public SessionMetadata getMetadata() {
        return metadata;
    }

    public Consumer<SessionProgress> getOnProgress() {
        return onProgress;
    }

    /**
     * Called once all chunks completed, with the retained results per chunk id.
     */
    public BiConsumer<String, Map<String, List<ItemResult>>> getOnComplete() {
        return onComplete;
    }

    public LoadOptions withSessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public LoadOptions withStrategy(LoadingStrategy strategy) {
        this.strategy = strategy == null ? LoadingStrategy.ADAPTIVE : strategy;
        return this;
    }

    public LoadOptions withPriority(LoadPriority priority) {
        this.priority = priority == null ? LoadPriority.NORMAL : priority;
        return this;
    }

    public LoadOptions withMetadata(SessionMetadata metadata) {
        this.metadata = metadata == null ? SessionMetadata.UNKNOWN : metadata;
        return this;
    }

    public LoadOptions withOnProgress(Consumer<SessionProgress> callback) {
        this.onProgress = callback;
        return this;
    }

    public LoadOptions withOnComplete(BiConsumer<String, Map<String, List<ItemResult>>> callback) {
        this.onComplete = callback;
        return this;
    }
}
