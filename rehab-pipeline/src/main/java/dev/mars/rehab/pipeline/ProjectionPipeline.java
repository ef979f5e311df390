package dev.mars.rehab.pipeline;

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

import dev.mars.rehab.api.deadletter.DeadLetterQueue;
import dev.mars.rehab.api.error.InvalidQueryException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.projection.ProjectionStatus;
import dev.mars.rehab.api.projection.Projector;
import dev.mars.rehab.api.projection.RebuildHandle;
import dev.mars.rehab.api.store.AppendListener;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStore;
import dev.mars.rehab.pipeline.config.PipelineConfig;
import dev.mars.rehab.pipeline.metrics.PipelineMetrics;
import dev.mars.rehab.pipeline.resilience.CircuitBreakerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers appended events to every projector, per subject in stream order.
 *
 * <p>Append notifications only mark a subject dirty; events are always read back
 * from the store, so delivery is gapless even when notifications are lost, and a
 * periodic catch-up sweep signals every known subject. Subject {@code S} is pumped
 * by worker {@code floorMod(S.hashCode(), concurrency)} only. Each (projector,
 * subject) lane buffers events into batches of {@code batchSize}, flushed early
 * after {@code batchTimeout}, and applies them one after another on the apply
 * executor under {@code applyTimeout}. Failed batches are retried with exponential
 * backoff up to {@code maxAttempts}, then dead-lettered and skipped, so later batches
 * of the subject keep applying; a rebuild of the subject redrives the skipped range.
 * A lane holding {@code queueCapacity}
 * unapplied events stops reading for its subject until a batch completes, without
 * holding up other lanes or subjects.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-07
 * @version 1.0
 */
public class ProjectionPipeline implements AppendListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionPipeline.class);

    private final StreamStore streamStore;
    private final Map<String, Projector> projectors;
    private final DeadLetterQueue deadLetterQueue;
    private final PipelineConfig config;
    private final CircuitBreakerManager circuitBreakers;
    private final PipelineMetrics metrics;

    private final Map<String, List<ProjectorLane>> lanesBySubject = new ConcurrentHashMap<>();
    private final Map<String, Long> knownTails = new ConcurrentHashMap<>();
    private final Worker[] workers;
    private volatile ScheduledExecutorService scheduler;
    private volatile ExecutorService applyExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger restarts = new AtomicInteger(0);
    private volatile ScheduledFuture<?> supervisorTask;
    private volatile ScheduledFuture<?> catchUpTask;

    public ProjectionPipeline(StreamStore streamStore, List<? extends Projector> projectors,
                              DeadLetterQueue deadLetterQueue, PipelineConfig config,
                              CircuitBreakerManager circuitBreakers, PipelineMetrics metrics) {
        this.streamStore = streamStore;
        this.deadLetterQueue = deadLetterQueue;
        this.config = config;
        this.circuitBreakers = circuitBreakers;
        this.metrics = metrics;

        Map<String, Projector> byId = new LinkedHashMap<>();
        for (Projector projector : projectors) {
            if (byId.put(projector.id(), projector) != null) {
                throw new IllegalArgumentException("Duplicate projector id: " + projector.id());
            }
        }
        this.projectors = Collections.unmodifiableMap(byId);

        this.workers = new Worker[config.getConcurrency()];
        for (int i = 0; i < workers.length; i++) {
            workers[i] = new Worker(i);
        }
        for (Projector projector : this.projectors.values()) {
            metrics.trackLag(projector.id(), () -> lag(projector));
        }
    }

    /**
     * Starts the workers, subscribes to appends and schedules the supervisor and catch-up sweep.
     * A stopped pipeline can be started again; delivery resumes from the projectors' checkpoints.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Projection pipeline already running");
            return;
        }
        scheduler = Executors.newScheduledThreadPool(2, daemonThreads("rehab-pipeline-scheduler-"));
        applyExecutor = Executors.newFixedThreadPool(config.getApplyThreads(), daemonThreads("rehab-pipeline-apply-"));
        for (Map.Entry<String, List<ProjectorLane>> entry : lanesBySubject.entrySet()) {
            for (ProjectorLane lane : entry.getValue()) {
                lane.resume(lane.projector().checkpoint(entry.getKey()));
            }
        }
        for (Worker worker : workers) {
            worker.start();
        }
        streamStore.addAppendListener(this);
        long interval = config.getCatchUpInterval().toMillis();
        supervisorTask = scheduler.scheduleWithFixedDelay(this::supervise, interval, interval, TimeUnit.MILLISECONDS);
        catchUpTask = scheduler.scheduleWithFixedDelay(this::catchUp, 0, interval, TimeUnit.MILLISECONDS);
        logger.info("Projection pipeline started with {} projector(s): {}", projectors.size(), config);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping projection pipeline");
        streamStore.removeAppendListener(this);
        cancel(supervisorTask);
        cancel(catchUpTask);
        for (Worker worker : workers) {
            worker.interrupt();
        }
        ScheduledExecutorService scheduler = this.scheduler;
        ExecutorService applyExecutor = this.applyExecutor;
        scheduler.shutdown();
        applyExecutor.shutdown();
        try {
            for (Worker worker : workers) {
                worker.join(TimeUnit.SECONDS.toMillis(5));
            }
            if (!applyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                applyExecutor.shutdownNow();
            }
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            applyExecutor.shutdownNow();
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Projection pipeline stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void onAppended(Event event) {
        knownTails.merge(event.getSubjectId(), event.getStreamVersion(), Math::max);
        signal(event.getSubjectId());
    }

    /**
     * Marks a subject as having events to deliver.
     */
    public void signal(String subjectId) {
        if (running.get()) {
            workerFor(subjectId).signal(subjectId);
        }
    }

    public Collection<Projector> projectors() {
        return projectors.values();
    }

    public Optional<Projector> projector(String projectorId) {
        return Optional.ofNullable(projectors.get(projectorId));
    }

    /**
     * Rebuilds one subject, or every subject when {@code subjectId} is null, and
     * realigns delivery with the rebuilt checkpoint. This is also how dead-lettered
     * batches are redriven.
     *
     * @throws InvalidQueryException if no projector has that id
     */
    public RebuildHandle rebuild(String projectorId, String subjectId) {
        Projector projector = projector(projectorId)
            .orElseThrow(() -> new InvalidQueryException("Unknown projection: " + projectorId));
        RebuildHandle handle = subjectId == null ? projector.rebuildAll() : projector.rebuild(subjectId);
        handle.completion().whenComplete((ignored, error) -> {
            if (error == null) {
                resumeAfterRebuild(projector, subjectId);
            }
        });
        return handle;
    }

    /**
     * Lag and dead letters of one projector, computed from the latest known stream tails.
     */
    public ProjectionStatus status(String projectorId) {
        Projector projector = projector(projectorId)
            .orElseThrow(() -> new InvalidQueryException("Unknown projection: " + projectorId));
        long lag = 0;
        long maxLag = 0;
        String maxLagSubject = null;
        for (Map.Entry<String, Long> tail : knownTails.entrySet()) {
            long subjectLag = Math.max(0, tail.getValue() - projector.checkpoint(tail.getKey()));
            lag += subjectLag;
            if (subjectLag > maxLag) {
                maxLag = subjectLag;
                maxLagSubject = tail.getKey();
            }
        }
        return new ProjectionStatus(projectorId, lag, maxLagSubject, deadLetterQueue.count(projectorId),
            projector.subjects().size());
    }

    public List<ProjectionStatus> status() {
        List<ProjectionStatus> statuses = new ArrayList<>();
        for (String projectorId : projectors.keySet()) {
            statuses.add(status(projectorId));
        }
        return statuses;
    }

    /**
     * Events of a lane read from the store but not yet applied.
     */
    public int pendingEvents(String projectorId, String subjectId) {
        List<ProjectorLane> lanes = lanesBySubject.get(subjectId);
        if (lanes == null) {
            return 0;
        }
        for (ProjectorLane lane : lanes) {
            if (lane.projectorId().equals(projectorId)) {
                return lane.unapplied();
            }
        }
        return 0;
    }

    public int getWorkerRestarts() {
        return restarts.get();
    }

    public PipelineConfig getConfig() {
        return config;
    }

    Thread workerThread(int index) {
        return workers[index].thread;
    }

    // Pumping, on the subject's worker thread

    void pump(String subjectId) {
        long tail;
        try {
            tail = circuitBreakers.executeStoreOperation("tail",
                () -> streamStore.tailVersion(subjectId).join());
        } catch (RuntimeException e) {
            deferAfterStoreFailure(subjectId, e);
            return;
        }
        knownTails.merge(subjectId, tail, Math::max);

        for (ProjectorLane lane : lanes(subjectId)) {
            try {
                pumpLane(lane, tail);
            } catch (RuntimeException e) {
                deferAfterStoreFailure(subjectId, e);
                return;
            }
        }
    }

    private void pumpLane(ProjectorLane lane, long tail) {
        while (true) {
            long emitted = lane.emitted();
            if (emitted >= tail) {
                break;
            }
            int room = lane.reserve(config.getQueueCapacity());
            if (room <= 0) {
                logger.debug("Lane {} is full, pausing subject until a batch completes", lane);
                break;
            }
            int limit = Math.min(room, config.getBatchSize());
            List<Event> events = circuitBreakers.executeStoreOperation("read",
                () -> streamStore.read(lane.subjectId(), ReadOptions.of(emitted + 1, limit)).join());
            if (events.isEmpty()) {
                break;
            }
            List<Event> batch = lane.accept(events, config.getBatchSize());
            if (batch != null && !batch.isEmpty()) {
                dispatch(lane, batch);
            }
        }
        lane.armFlushTimer(() -> scheduler.schedule(() -> flush(lane),
            config.getBatchTimeout().toMillis(), TimeUnit.MILLISECONDS));
    }

    private void flush(ProjectorLane lane) {
        List<Event> batch = lane.drain();
        if (!batch.isEmpty()) {
            dispatch(lane, batch);
        }
    }

    private void dispatch(ProjectorLane lane, List<Event> batch) {
        lane.enqueue(ignored -> attempt(lane, batch, 1))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.error("Delivery to lane {} failed unexpectedly: {}", lane, error.getMessage(), error);
                }
                if (lane.release(batch.size())) {
                    signal(lane.subjectId());
                }
            });
    }

    // Applying, retrying and dead-lettering

    private CompletableFuture<Void> attempt(ProjectorLane lane, List<Event> batch, int attemptNumber) {
        long started = System.nanoTime();
        CompletableFuture<Void> apply;
        try {
            apply = CompletableFuture.runAsync(() -> lane.projector().applyBatch(lane.subjectId(), batch), applyExecutor)
                .orTimeout(config.getApplyTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            apply = CompletableFuture.failedFuture(e);
        }

        return apply.handle((ignored, error) -> {
            if (error == null) {
                metrics.recordBatchApplied(lane.projectorId(), batch.size(), Duration.ofNanos(System.nanoTime() - started));
                logger.debug("Projector {} applied {}[{}..{}] on attempt {}", lane.projectorId(), lane.subjectId(),
                    first(batch), last(batch), attemptNumber);
                return CompletableFuture.<Void>completedFuture(null);
            }
            Throwable cause = unwrap(error);
            if (!running.get()) {
                logger.debug("Abandoning {}[{}..{}] for {} on shutdown", lane.subjectId(), first(batch), last(batch),
                    lane.projectorId());
                return CompletableFuture.<Void>completedFuture(null);
            }
            if (attemptNumber < config.getMaxAttempts()) {
                Duration delay = config.backoffFor(attemptNumber);
                metrics.recordBatchRetried(lane.projectorId());
                logger.warn("Projector {} failed {}[{}..{}] on attempt {}/{}, retrying in {}: {}", lane.projectorId(),
                    lane.subjectId(), first(batch), last(batch), attemptNumber, config.getMaxAttempts(), delay,
                    cause.getMessage());
                return retryLater(lane, batch, attemptNumber + 1, delay);
            }
            deadLetter(lane, batch, attemptNumber, cause);
            return CompletableFuture.<Void>completedFuture(null);
        }).thenCompose(next -> next);
    }

    private CompletableFuture<Void> retryLater(ProjectorLane lane, List<Event> batch, int attemptNumber, Duration delay) {
        CompletableFuture<Void> retry = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> {
                attempt(lane, batch, attemptNumber).whenComplete((ignored, error) -> {
                    if (error != null) {
                        retry.completeExceptionally(error);
                    } else {
                        retry.complete(null);
                    }
                });
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Retry of {}[{}..{}] not scheduled, pipeline is stopping", lane.subjectId(), first(batch), last(batch));
            retry.complete(null);
        }
        return retry;
    }

    private void deadLetter(ProjectorLane lane, List<Event> batch, int attempts, Throwable cause) {
        lane.projector().skip(lane.subjectId(), first(batch), last(batch));
        metrics.recordBatchDeadLettered(lane.projectorId());
        String reason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        deadLetterQueue.record(lane.projectorId(), lane.subjectId(), first(batch), last(batch), attempts, reason);
    }

    private void resumeAfterRebuild(Projector projector, String subjectId) {
        for (Map.Entry<String, List<ProjectorLane>> entry : lanesBySubject.entrySet()) {
            if (subjectId != null && !subjectId.equals(entry.getKey())) {
                continue;
            }
            for (ProjectorLane lane : entry.getValue()) {
                if (lane.projector() == projector) {
                    lane.resume(projector.checkpoint(entry.getKey()));
                    logger.info("Realigned lane {} after rebuild", lane);
                }
            }
            signal(entry.getKey());
        }
    }

    // Supervision and catch-up, on the scheduler

    private void supervise() {
        for (Worker worker : workers) {
            if (running.get() && !worker.isAlive()) {
                logger.error("Pipeline worker {} died unexpectedly, restarting", worker.index);
                restarts.incrementAndGet();
                reseed(worker.index);
                worker.start();
            }
        }
    }

    private void reseed(int workerIndex) {
        for (Map.Entry<String, List<ProjectorLane>> entry : lanesBySubject.entrySet()) {
            if (workerIndex(entry.getKey()) != workerIndex) {
                continue;
            }
            for (ProjectorLane lane : entry.getValue()) {
                lane.resume(lane.projector().checkpoint(entry.getKey()));
            }
            workers[workerIndex].signal(entry.getKey());
        }
    }

    private void catchUp() {
        try {
            Set<String> subjects = circuitBreakers.executeStoreOperation("subjects",
                () -> streamStore.subjects().join());
            for (String subjectId : subjects) {
                signal(subjectId);
            }
        } catch (RuntimeException e) {
            logger.warn("Catch-up sweep skipped: {}", unwrap(e).getMessage());
        }
    }

    private void deferAfterStoreFailure(String subjectId, RuntimeException e) {
        Throwable cause = unwrap(e);
        logger.warn("Store unavailable while pumping subject {}, retrying in {}: {}", subjectId,
            config.getInitialBackoff(), cause.getMessage());
        try {
            scheduler.schedule(() -> signal(subjectId), config.getInitialBackoff().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException rejected) {
            logger.debug("Pipeline stopping, subject {} not re-signalled", subjectId);
        }
    }

    private List<ProjectorLane> lanes(String subjectId) {
        return lanesBySubject.computeIfAbsent(subjectId, s -> {
            List<ProjectorLane> lanes = new ArrayList<>(projectors.size());
            for (Projector projector : projectors.values()) {
                lanes.add(new ProjectorLane(projector, s));
            }
            return Collections.unmodifiableList(lanes);
        });
    }

    private long lag(Projector projector) {
        long lag = 0;
        for (Map.Entry<String, Long> tail : knownTails.entrySet()) {
            lag += Math.max(0, tail.getValue() - projector.checkpoint(tail.getKey()));
        }
        return lag;
    }

    private Worker workerFor(String subjectId) {
        return workers[workerIndex(subjectId)];
    }

    private int workerIndex(String subjectId) {
        return Math.floorMod(subjectId.hashCode(), workers.length);
    }

    private static long first(List<Event> batch) {
        return batch.get(0).getStreamVersion();
    }

    private static long last(List<Event> batch) {
        return batch.get(batch.size() - 1).getStreamVersion();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Owns the signal queue of one partition; its thread may be replaced by the supervisor.
     */
    private final class Worker {
        private final int index;
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        private final Set<String> queued = ConcurrentHashMap.newKeySet();
        private volatile Thread thread;

        Worker(int index) {
            this.index = index;
        }

        void start() {
            Thread t = new Thread(this::run, "rehab-pipeline-worker-" + index);
            t.setDaemon(true);
            thread = t;
            t.start();
        }

        void signal(String subjectId) {
            if (queued.add(subjectId)) {
                queue.offer(subjectId);
            }
        }

        boolean isAlive() {
            Thread t = thread;
            return t != null && t.isAlive();
        }

        void interrupt() {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
            }
        }

        void join(long millis) throws InterruptedException {
            Thread t = thread;
            if (t != null) {
                t.join(millis);
            }
        }

        private void run() {
            logger.debug("Pipeline worker {} started", index);
            while (running.get()) {
                String subjectId;
                try {
                    subjectId = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                queued.remove(subjectId);
                try {
                    pump(subjectId);
                } catch (RuntimeException e) {
                    logger.error("Pipeline worker {} failed pumping subject {}: {}", index, subjectId, e.getMessage(), e);
                }
            }
            if (running.get()) {
                logger.warn("Pipeline worker {} exiting while the pipeline is running", index);
            } else {
                logger.debug("Pipeline worker {} stopped", index);
            }
        }
    }
}
