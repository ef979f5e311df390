package dev.mars.rehab.api.checkpoint;

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

import java.util.Map;
import java.util.Optional;

/**
 * Durable record of per-(projector, subject) progress.
 *
 * <p>A projector saves a checkpoint only together with the view change it covers,
 * so after a crash the checkpoint never claims more than the view contains.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public interface CheckpointStore {

    Optional<Checkpoint> load(String projectorId, String subjectId);

    /**
     * @return the last applied version, or 0 if the projector has never applied the subject
     */
    default long lastAppliedVersion(String projectorId, String subjectId) {
        return load(projectorId, subjectId).map(Checkpoint::getLastAppliedVersion).orElse(0L);
    }

    /**
     * @return every checkpoint of the projector keyed by subject id
     */
    Map<String, Checkpoint> loadAll(String projectorId);

    void save(Checkpoint checkpoint);

    /**
     * Removes every checkpoint of a projector. Used before rebuilding it from scratch.
     */
    void clear(String projectorId);
}
