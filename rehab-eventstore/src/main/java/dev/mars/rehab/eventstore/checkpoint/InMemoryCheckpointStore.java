package dev.mars.rehab.eventstore.checkpoint;

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

import dev.mars.rehab.api.checkpoint.Checkpoint;
import dev.mars.rehab.api.checkpoint.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint store for projectors whose views are held in memory.
 *
 * <p>Checkpoints live exactly as long as the views they describe, so after a
 * restart both start empty and the views are rebuilt by replaying the streams.</p>
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final Map<String, Map<String, Checkpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Checkpoint> load(String projectorId, String subjectId) {
        Map<String, Checkpoint> byProjector = checkpoints.get(projectorId);
        return byProjector == null ? Optional.empty() : Optional.ofNullable(byProjector.get(subjectId));
    }

    @Override
    public Map<String, Checkpoint> loadAll(String projectorId) {
        Map<String, Checkpoint> byProjector = checkpoints.get(projectorId);
        return byProjector == null ? Map.of() : Map.copyOf(byProjector);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "checkpoint cannot be null");
        checkpoints.computeIfAbsent(checkpoint.getProjectorId(), id -> new ConcurrentHashMap<>())
            .put(checkpoint.getSubjectId(), checkpoint);
        logger.trace("Saved {}", checkpoint);
    }

    @Override
    public void clear(String projectorId) {
        Map<String, Checkpoint> removed = checkpoints.remove(projectorId);
        if (removed != null) {
            logger.debug("Cleared {} checkpoints of projector {}", removed.size(), projectorId);
        }
    }
}
