package dev.mars.rehab.projections;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.rehab.api.checkpoint.CheckpointStore;
import dev.mars.rehab.api.store.StreamStore;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators and tuning shared by every projector.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public final class ProjectorContext {

    public static final int DEFAULT_REBUILD_PAGE_SIZE = 500;
    public static final int DEFAULT_QUALITY_SAMPLE_WINDOW = 50;

    private final StreamStore streamStore;
    private final CheckpointStore checkpointStore;
    private final Executor rebuildExecutor;
    private final Clock clock;
    private final int rebuildPageSize;
    private final int qualitySampleWindow;

    private ProjectorContext(Builder builder) {
        this.streamStore = Objects.requireNonNull(builder.streamStore, "streamStore cannot be null");
        this.checkpointStore = Objects.requireNonNull(builder.checkpointStore, "checkpointStore cannot be null");
        this.rebuildExecutor = Objects.requireNonNull(builder.rebuildExecutor, "rebuildExecutor cannot be null");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        if (builder.rebuildPageSize <= 0) {
            throw new IllegalArgumentException("rebuildPageSize must be > 0");
        }
        if (builder.qualitySampleWindow <= 0) {
            throw new IllegalArgumentException("qualitySampleWindow must be > 0");
        }
        this.rebuildPageSize = builder.rebuildPageSize;
        this.qualitySampleWindow = builder.qualitySampleWindow;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StreamStore getStreamStore() { return streamStore; }
    public CheckpointStore getCheckpointStore() { return checkpointStore; }
    public Executor getRebuildExecutor() { return rebuildExecutor; }
    public Clock getClock() { return clock; }
    public int getRebuildPageSize() { return rebuildPageSize; }
    public int getQualitySampleWindow() { return qualitySampleWindow; }

    public static class Builder {
        private StreamStore streamStore;
        private CheckpointStore checkpointStore;
        private Executor rebuildExecutor;
        private Clock clock;
        private int rebuildPageSize = DEFAULT_REBUILD_PAGE_SIZE;
        private int qualitySampleWindow = DEFAULT_QUALITY_SAMPLE_WINDOW;

        public Builder streamStore(StreamStore streamStore) { this.streamStore = streamStore; return this; }
        public Builder checkpointStore(CheckpointStore checkpointStore) { this.checkpointStore = checkpointStore; return this; }
        public Builder rebuildExecutor(Executor rebuildExecutor) { this.rebuildExecutor = rebuildExecutor; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder rebuildPageSize(int rebuildPageSize) { this.rebuildPageSize = rebuildPageSize; return this; }
        public Builder qualitySampleWindow(int qualitySampleWindow) { this.qualitySampleWindow = qualitySampleWindow; return this; }

        public ProjectorContext build() {
            return new ProjectorContext(this);
        }
    }
}
