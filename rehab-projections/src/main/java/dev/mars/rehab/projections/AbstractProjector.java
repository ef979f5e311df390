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

import dev.mars.rehab.api.checkpoint.Checkpoint;
import dev.mars.rehab.api.checkpoint.CheckpointStore;
import dev.mars.rehab.api.error.ProjectorFailureException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.projection.ApplyPhase;
import dev.mars.rehab.api.projection.Projector;
import dev.mars.rehab.api.projection.RebuildHandle;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Base class for projectors that keep one state object per subject.
 *
 * <p>Subclasses supply a pure fold: {@link #initialState(String)} and
 * {@link #fold(Object, Event)}. This class provides the rest of the contract:</p>
 * <ul>
 *   <li><b>Atomic apply.</b> A batch is folded into a copy of the installed state.
 *       The checkpoint is saved and the copy installed under the subject lock; if
 *       anything fails before that, the installed state and checkpoint are unchanged.</li>
 *   <li><b>Idempotence.</b> Events at or below the subject's checkpoint are skipped,
 *       so redelivered batches have no effect.</li>
 *   <li><b>Shadow rebuild.</b> Streams are replayed into fresh states without
 *       holding any lock. The rebuild then takes the subject locks, folds in events
 *       appended in the meantime and swaps the shadows in. A cancelled rebuild
 *       leaves the installed states untouched.</li>
 * </ul>
 *
 * <p>Installed states are never mutated once installed, so queries read them
 * without locking.</p>
 *
 * @param <S> the per-subject state type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-05
 * @version 1.0
 */
public abstract class AbstractProjector<S> implements Projector {

    private static final Logger logger = LoggerFactory.getLogger(AbstractProjector.class);

    private final String id;
    private final StreamStore streamStore;
    private final CheckpointStore checkpointStore;
    private final Executor rebuildExecutor;
    private final Clock clock;
    private final int rebuildPageSize;
    private final Map<String, SubjectSlot<S>> slots = new ConcurrentHashMap<>();

    protected AbstractProjector(String id, ProjectorContext context) {
        this.id = id;
        this.streamStore = context.getStreamStore();
        this.checkpointStore = context.getCheckpointStore();
        this.rebuildExecutor = context.getRebuildExecutor();
        this.clock = context.getClock();
        this.rebuildPageSize = context.getRebuildPageSize();

        Map<String, Checkpoint> stale = checkpointStore.loadAll(id);
        if (!stale.isEmpty()) {
            logger.info("Projector {} discards {} checkpoint(s) left without in-memory state; streams will be replayed",
                id, stale.size());
            checkpointStore.clear(id);
        }
    }

    /**
     * A new, empty state for a subject.
     */
    protected abstract S initialState(String subjectId);

    /**
     * A deep copy that can be folded into without affecting the original.
     */
    protected abstract S copyState(S state);

    /**
     * Folds one event into the state. Must be deterministic and depend only on
     * the state and the event.
     */
    protected abstract void fold(S state, Event event);

    @Override
    public final String id() {
        return id;
    }

    @Override
    public void applyBatch(String subjectId, List<Event> events) {
        if (events.isEmpty()) {
            return;
        }
        long fromVersion = events.get(0).getStreamVersion();
        long toVersion = events.get(events.size() - 1).getStreamVersion();
        SubjectSlot<S> slot = slot(subjectId);

        slot.lock.lock();
        try {
            ApplyPhase previousPhase = slot.phase;
            slot.phase = ApplyPhase.APPLYING;
            long last = slot.version;
            S working = null;
            try {
                for (Event event : events) {
                    if (!subjectId.equals(event.getSubjectId())) {
                        throw new IllegalArgumentException("Event " + event.getEventId() + " belongs to "
                            + event.getSubjectId());
                    }
                    long version = event.getStreamVersion();
                    if (version <= last) {
                        continue;
                    }
                    if (version != last + 1) {
                        throw new IllegalArgumentException("Version gap: expected " + (last + 1) + " but got " + version);
                    }
                    if (working == null) {
                        working = copyState(slot.state);
                    }
                    fold(working, event);
                    last = version;
                }
                if (working == null) {
                    slot.phase = previousPhase;
                    logger.debug("Projector {} skipped already applied {}[{}..{}]", id, subjectId, fromVersion, toVersion);
                    return;
                }
                checkpointStore.save(new Checkpoint(id, subjectId, last, clock.instant()));
            } catch (RuntimeException e) {
                slot.phase = previousPhase;
                throw new ProjectorFailureException(id, subjectId, fromVersion, toVersion, e.getMessage(), e);
            }
            slot.state = working;
            slot.version = last;
            slot.phase = ApplyPhase.CHECKPOINTED;
            logger.debug("Projector {} applied {}[{}..{}], checkpoint {}", id, subjectId, fromVersion, toVersion, last);
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public boolean skip(String subjectId, long fromVersion, long toVersion) {
        SubjectSlot<S> slot = slot(subjectId);
        slot.lock.lock();
        try {
            if (slot.version < fromVersion - 1 || slot.version >= toVersion) {
                logger.debug("Projector {} not skipping {}[{}..{}], checkpoint is {}", id, subjectId, fromVersion,
                    toVersion, slot.version);
                return false;
            }
            checkpointStore.save(new Checkpoint(id, subjectId, toVersion, clock.instant()));
            slot.version = toVersion;
            slot.phase = ApplyPhase.CHECKPOINTED;
            logger.warn("Projector {} skipped {}[{}..{}] without applying it, checkpoint {}", id, subjectId,
                fromVersion, toVersion, toVersion);
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public long checkpoint(String subjectId) {
        SubjectSlot<S> slot = slots.get(subjectId);
        return slot == null ? 0 : slot.version;
    }

    @Override
    public ApplyPhase phase(String subjectId) {
        SubjectSlot<S> slot = slots.get(subjectId);
        return slot == null ? ApplyPhase.IDLE : slot.phase;
    }

    @Override
    public Set<String> subjects() {
        return slots.entrySet().stream()
            .filter(entry -> entry.getValue().version > 0)
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * A copy of the installed state for a subject, if the projector has applied any of its events.
     */
    public Optional<S> snapshot(String subjectId) {
        S state = installedState(subjectId);
        return state == null ? Optional.empty() : Optional.of(copyState(state));
    }

    /**
     * The installed state of a subject, or {@code null}. Callers must not modify it.
     */
    protected S installedState(String subjectId) {
        SubjectSlot<S> slot = slots.get(subjectId);
        return slot == null || slot.version == 0 ? null : slot.state;
    }

    /**
     * Installed states of all subjects with applied events. Callers must not modify them.
     */
    protected Map<String, S> installedStates() {
        Map<String, S> states = new HashMap<>();
        slots.forEach((subjectId, slot) -> {
            if (slot.version > 0) {
                states.put(subjectId, slot.state);
            }
        });
        return states;
    }

    protected Clock clock() {
        return clock;
    }

    @Override
    public RebuildHandle rebuild(String subjectId) {
        RebuildTask task = new RebuildTask(id, subjectId);
        submit(task, () -> List.of(subjectId));
        return task;
    }

    @Override
    public RebuildHandle rebuildAll() {
        RebuildTask task = new RebuildTask(id, null);
        submit(task, () -> {
            Set<String> subjects = new LinkedHashSet<>(streamStore.subjects().join());
            subjects.addAll(subjects());
            return new ArrayList<>(subjects);
        });
        return task;
    }

    private void submit(RebuildTask task, Supplier<List<String>> subjects) {
        logger.info("Starting rebuild of {}", task.describe());
        try {
            rebuildExecutor.execute(() -> {
                try {
                    runRebuild(task, subjects.get());
                } catch (RuntimeException e) {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    logger.error("Rebuild of {} failed: {}", task.describe(), cause.getMessage(), cause);
                    task.fail(cause);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.error("Rebuild of {} could not be scheduled: {}", task.describe(), e.getMessage());
            task.fail(e);
        }
    }

    private void runRebuild(RebuildTask task, List<String> subjects) {
        long total = 0;
        for (String subjectId : subjects) {
            total += streamStore.tailVersion(subjectId).join();
        }
        task.setTotal(total);

        Map<String, Shadow<S>> shadows = new LinkedHashMap<>();
        for (String subjectId : subjects) {
            Shadow<S> shadow = new Shadow<>(initialState(subjectId));
            for (Event event : streamStore.cursor(subjectId, 1, rebuildPageSize)) {
                if (task.isCancelled()) {
                    logger.info("Rebuild of {} cancelled after {} events", task.describe(), task.eventsProcessed());
                    return;
                }
                shadow.fold(this, event);
                task.recordProcessed();
            }
            shadows.put(subjectId, shadow);
        }
        install(task, shadows);
    }

    private void install(RebuildTask task, Map<String, Shadow<S>> shadows) {
        List<String> ordered = new ArrayList<>(shadows.keySet());
        Collections.sort(ordered);
        List<SubjectSlot<S>> locked = new ArrayList<>(ordered.size());
        try {
            for (String subjectId : ordered) {
                SubjectSlot<S> slot = slot(subjectId);
                slot.lock.lock();
                locked.add(slot);
            }
            for (String subjectId : ordered) {
                catchUp(task, subjectId, shadows.get(subjectId));
            }
            if (!task.beginCommit()) {
                logger.info("Rebuild of {} cancelled before install", task.describe());
                return;
            }
            saveCheckpoints(ordered, shadows);
            for (int i = 0; i < ordered.size(); i++) {
                SubjectSlot<S> slot = locked.get(i);
                Shadow<S> shadow = shadows.get(ordered.get(i));
                slot.state = shadow.state;
                slot.version = shadow.version;
                slot.phase = shadow.version > 0 ? ApplyPhase.CHECKPOINTED : ApplyPhase.IDLE;
            }
            task.complete();
            logger.info("Rebuild of {} installed {} subject(s) after {} events", task.describe(), ordered.size(),
                task.eventsProcessed());
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).lock.unlock();
            }
        }
    }

    private void catchUp(RebuildTask task, String subjectId, Shadow<S> shadow) {
        while (true) {
            List<Event> tail = streamStore.read(subjectId, ReadOptions.of(shadow.version + 1, rebuildPageSize)).join();
            if (tail.isEmpty()) {
                return;
            }
            for (Event event : tail) {
                shadow.fold(this, event);
                task.recordProcessed();
            }
        }
    }

    private void saveCheckpoints(List<String> ordered, Map<String, Shadow<S>> shadows) {
        Instant now = clock.instant();
        List<String> saved = new ArrayList<>();
        try {
            for (String subjectId : ordered) {
                checkpointStore.save(new Checkpoint(id, subjectId, shadows.get(subjectId).version, now));
                saved.add(subjectId);
            }
        } catch (RuntimeException e) {
            for (String subjectId : saved) {
                checkpointStore.save(new Checkpoint(id, subjectId, slots.get(subjectId).version, now));
            }
            throw e;
        }
    }

    private SubjectSlot<S> slot(String subjectId) {
        return slots.computeIfAbsent(subjectId, s -> new SubjectSlot<>(initialState(s)));
    }

    private static final class SubjectSlot<S> {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile S state;
        private volatile long version;
        private volatile ApplyPhase phase = ApplyPhase.IDLE;

        SubjectSlot(S state) {
            this.state = state;
        }
    }

    private static final class Shadow<S> {
        private final S state;
        private long version;

        Shadow(S state) {
            this.state = state;
        }

        void fold(AbstractProjector<S> projector, Event event) {
            if (event.getStreamVersion() <= version) {
                return;
            }
            projector.fold(state, event);
            version = event.getStreamVersion();
        }
    }
}
