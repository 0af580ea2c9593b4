/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.mapserver.server;

import dev.nishisan.mapserver.config.MapServerConfig;
import dev.nishisan.mapserver.engine.GlobalMap;
import dev.nishisan.mapserver.engine.MappingEngine;
import dev.nishisan.mapserver.engine.MappingEngineException;
import dev.nishisan.mapserver.engine.Submap;
import dev.nishisan.mapserver.pipeline.CommandPipeline;
import dev.nishisan.mapserver.pipeline.PipelineException;
import dev.nishisan.mapserver.queue.SubmapJob;
import dev.nishisan.mapserver.queue.SubmapQueue;
import dev.nishisan.mapserver.state.MapSnapshot;
import dev.nishisan.mapserver.state.MapState;
import dev.nishisan.mapserver.state.MapStateStore;
import dev.nishisan.mapserver.state.MapUpdate;
import dev.nishisan.mapserver.state.MergedSubmap;
import dev.nishisan.mapserver.stats.MapServerMetrics;
import dev.nishisan.mapserver.stats.MapServerStats;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the map server: one worker thread consumes submap jobs in arrival
 * order, runs the submap pipeline, merges the result into the {@link MapState}
 * and, when a trigger fires, runs the global map pipeline. A separate scheduler
 * persists a backup of the map every backup interval, regardless of traffic.
 * <p>
 * A job either merges completely (version + 1) or leaves the map untouched; a
 * failing job is logged, counted and skipped, and the worker moves on.
 */
public final class MapServerOrchestrator implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(MapServerOrchestrator.class.getName());

    static final String WORKER_THREAD_NAME = "map-server-worker";
    static final String BACKUP_THREAD_NAME = "map-server-backup";

    private final MapServerConfig config;
    private final MappingEngine engine;
    private final MapState mapState;
    private final CommandPipeline<Submap> submapPipeline;
    private final CommandPipeline<GlobalMap> globalPipeline;
    private final MapStateStore store;
    private final MapServerStats stats;
    private final SubmapQueue queue;

    private final Object lifecycleLock = new Object();
    private final Object intakeLock = new Object();
    private final AtomicLong nextSequence = new AtomicLong(1L);
    private final AtomicLong backupCount = new AtomicLong();

    private volatile OrchestratorState state = OrchestratorState.IDLE;
    private Thread worker;
    private ScheduledExecutorService backupScheduler;

    // worker thread only
    private int mergesSinceGlobal;
    private long lastGlobalRunNanos;

    public MapServerOrchestrator(MapServerConfig config, MappingEngine engine, MapState mapState,
            CommandPipeline<Submap> submapPipeline, CommandPipeline<GlobalMap> globalPipeline,
            MapStateStore store, MapServerStats stats) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.mapState = Objects.requireNonNull(mapState, "mapState");
        this.submapPipeline = Objects.requireNonNull(submapPipeline, "submapPipeline");
        this.globalPipeline = Objects.requireNonNull(globalPipeline, "globalPipeline");
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.queue = new SubmapQueue(config.ingestionCapacity());
        List<MergedSubmap> history = mapState.takeSnapshot().history();
        this.nextSequence.set(history.isEmpty() ? 1L : history.get(history.size() - 1).sequence() + 1);
    }

    /**
     * Starts the worker and, when backups are enabled, the backup scheduler.
     *
     * @throws IllegalStateException if the orchestrator was already started
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != OrchestratorState.IDLE) {
                throw new IllegalStateException("Orchestrator cannot start from state " + state);
            }
            worker = new Thread(this::runWorker, WORKER_THREAD_NAME);
            worker.setDaemon(true);
            state = OrchestratorState.RUNNING;
            worker.start();

            if (config.backupsEnabled()) {
                long periodMs = config.backupInterval().toMillis();
                backupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, BACKUP_THREAD_NAME);
                    t.setDaemon(true);
                    return t;
                });
                backupScheduler.scheduleAtFixedRate(this::backup, periodMs, periodMs, TimeUnit.MILLISECONDS);
            }
            LOGGER.info(() -> "Map server started at version " + mapState.version()
                    + " (submap pipeline " + submapPipeline.commandNames()
                    + ", global pipeline " + globalPipeline.commandNames()
                    + ", backups " + (config.backupsEnabled() ? "every " + config.backupInterval() : "disabled")
                    + ")");
        }
    }

    /**
     * Validates a submap notification and queues it for the worker. Safe to call
     * from any thread; never blocks on the worker.
     *
     * @param robotName the robot that produced the submap
     * @param mapPath   folder of the submap; resolved to an absolute path
     * @return what happened to the notification
     */
    public SubmissionResult loadAndProcessSubmap(String robotName, String mapPath) {
        if (mapPath == null || mapPath.isBlank()) {
            return reject(robotName, mapPath, SubmissionResult.PATH_NOT_FOUND);
        }
        Path path;
        try {
            path = Path.of(mapPath.trim());
        } catch (InvalidPathException e) {
            return reject(robotName, mapPath, SubmissionResult.PATH_NOT_FOUND);
        }
        return loadAndProcessSubmap(robotName, path);
    }

    public SubmissionResult loadAndProcessSubmap(String robotName, Path mapPath) {
        if (state != OrchestratorState.RUNNING) {
            return reject(robotName, mapPath, SubmissionResult.NOT_RUNNING);
        }
        if (robotName == null || robotName.isBlank()) {
            return reject(robotName, mapPath, SubmissionResult.INVALID_ROBOT_NAME);
        }
        if (mapPath == null) {
            return reject(robotName, null, SubmissionResult.PATH_NOT_FOUND);
        }
        Path normalized = mapPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            return reject(robotName, normalized, SubmissionResult.PATH_NOT_FOUND);
        }

        SubmapJob job;
        boolean accepted;
        synchronized (intakeLock) {
            job = SubmapJob.of(nextSequence.get(), robotName.trim(), normalized);
            accepted = queue.offer(job);
            if (accepted) {
                nextSequence.incrementAndGet();
            }
        }
        if (!accepted) {
            return reject(robotName, normalized,
                    queue.isShutdown() ? SubmissionResult.NOT_RUNNING : SubmissionResult.QUEUE_FULL);
        }
        stats.notifyHitCounter(MapServerMetrics.SUBMAP_ACCEPTED);
        stats.notifyCurrentValue(MapServerMetrics.QUEUE_DEPTH, queue.size());
        LOGGER.fine(() -> "Queued submap #" + job.sequence() + " from robot '" + job.robotName() + "': "
                + job.mapPath());
        return SubmissionResult.ACCEPTED;
    }

    private SubmissionResult reject(String robotName, Object mapPath, SubmissionResult result) {
        stats.notifyHitCounter(MapServerMetrics.SUBMAP_REJECTED);
        LOGGER.warning(() -> "Rejected submap notification from robot '" + robotName + "' (" + mapPath + "): "
                + result);
        return result;
    }

    private void runWorker() {
        try {
            mapState.claimWriter();
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Map server worker could not take ownership of the map state", e);
            return;
        }
        lastGlobalRunNanos = System.nanoTime();
        long pollMs = config.workerPollInterval().toMillis();
        while (true) {
            Optional<SubmapJob> next;
            try {
                next = queue.poll(pollMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warning("Map server worker interrupted");
                break;
            }
            if (next.isEmpty() && queue.isShutdown()) {
                break;
            }
            try {
                next.ifPresent(this::processJob);
                if (!queue.isShutdown()) {
                    maybeRunGlobalPipeline();
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Unexpected failure in map server worker loop", e);
            }
        }
        LOGGER.fine("Map server worker finished");
    }

    /**
     * Loads, processes and merges one job. Any failure leaves the map untouched.
     */
    void processJob(SubmapJob job) {
        long start = System.nanoTime();
        stats.notifyCurrentValue(MapServerMetrics.QUEUE_DEPTH, queue.size());
        try {
            Submap loaded = engine.loadSubmap(job);
            Submap processed = submapPipeline.run(loaded);
            MapSnapshot published = mapState.mutate(base -> new MapUpdate(
                    engine.merge(base.globalMap().copy(), processed),
                    MergedSubmap.of(job, processed.span())));
            mergesSinceGlobal++;
            stats.notifyHitCounter(MapServerMetrics.SUBMAP_MERGED);
            stats.notifyCurrentValue(MapServerMetrics.MAP_VERSION, published.version());
            LOGGER.info(() -> "Merged submap #" + job.sequence() + " from robot '" + job.robotName()
                    + "', map version " + published.version());
        } catch (MappingEngineException | PipelineException e) {
            stats.notifyHitCounter(MapServerMetrics.SUBMAP_FAILED);
            LOGGER.log(Level.WARNING, "Submap #" + job.sequence() + " from robot '" + job.robotName()
                    + "' discarded: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            stats.notifyHitCounter(MapServerMetrics.SUBMAP_FAILED);
            LOGGER.log(Level.SEVERE, "Unexpected failure processing submap #" + job.sequence()
                    + " from robot '" + job.robotName() + "'", e);
        } finally {
            stats.notifyAverageCounter(MapServerMetrics.SUBMAP_PROCESSING_MS,
                    (System.nanoTime() - start) / 1_000_000L);
        }
    }

    /**
     * Runs the global pipeline when the merge-count or elapsed-time trigger has
     * fired and at least one merge happened since the previous pass.
     */
    void maybeRunGlobalPipeline() {
        if (mergesSinceGlobal == 0 || globalPipeline.isEmpty()) {
            return;
        }
        int everyN = config.globalPipelineEveryNMerges();
        long intervalNanos = config.globalPipelineInterval().toNanos();
        boolean countReached = everyN > 0 && mergesSinceGlobal >= everyN;
        boolean timeReached = intervalNanos > 0 && System.nanoTime() - lastGlobalRunNanos >= intervalNanos;
        if (!countReached && !timeReached) {
            return;
        }
        long start = System.nanoTime();
        try {
            MapSnapshot refined = mapState.refine(base -> globalPipeline.run(base.globalMap().copy()));
            stats.notifyHitCounter(MapServerMetrics.GLOBAL_PIPELINE_RUN);
            LOGGER.info(() -> "Global map pipeline applied after " + mergesSinceGlobal
                    + " merge(s), map version " + refined.version() + " revision " + refined.revision());
        } catch (PipelineException e) {
            stats.notifyHitCounter(MapServerMetrics.GLOBAL_PIPELINE_FAILED);
            LOGGER.log(Level.WARNING, "Global map pipeline failed, map left unchanged: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            stats.notifyHitCounter(MapServerMetrics.GLOBAL_PIPELINE_FAILED);
            LOGGER.log(Level.SEVERE, "Unexpected failure in global map pipeline, map left unchanged", e);
        } finally {
            mergesSinceGlobal = 0;
            lastGlobalRunNanos = System.nanoTime();
            stats.notifyAverageCounter(MapServerMetrics.GLOBAL_PIPELINE_MS, (lastGlobalRunNanos - start) / 1_000_000L);
        }
    }

    private void backup() {
        MapSnapshot snapshot = mapState.takeSnapshot();
        try {
            store.save(snapshot, config.backupFolder());
            backupCount.incrementAndGet();
            stats.notifyHitCounter(MapServerMetrics.BACKUP_SAVED);
            LOGGER.fine(() -> "Backup of map version " + snapshot.version() + " written to " + config.backupFolder());
        } catch (IOException | RuntimeException e) {
            stats.notifyHitCounter(MapServerMetrics.BACKUP_FAILED);
            LOGGER.log(Level.WARNING, "Failed to write map backup to " + config.backupFolder(), e);
        }
    }

    /**
     * Stops the server. Intake stops at once, the job being processed (if any)
     * finishes, jobs still queued are discarded and logged, backups stop, the
     * worker is joined and, if configured, the map is saved to the merged map
     * folder. Idempotent; concurrent callers all return once the orchestrator
     * is {@link OrchestratorState#STOPPED}.
     */
    public void shutdown() {
        synchronized (lifecycleLock) {
            if (state == OrchestratorState.STOPPED) {
                return;
            }
            if (state == OrchestratorState.IDLE) {
                queue.shutdown();
                state = OrchestratorState.STOPPED;
                LOGGER.info("Map server stopped before it was started");
                return;
            }
            state = OrchestratorState.DRAINING;
            LOGGER.info("Map server shutting down");

            List<SubmapJob> discarded = queue.shutdown();
            if (!discarded.isEmpty()) {
                for (SubmapJob job : discarded) {
                    stats.notifyHitCounter(MapServerMetrics.SUBMAP_DISCARDED);
                    LOGGER.fine(() -> "Discarded pending submap #" + job.sequence() + " from robot '"
                            + job.robotName() + "': " + job.mapPath());
                }
                LOGGER.warning(() -> discarded.size() + " pending submap(s) discarded at shutdown");
            }

            if (backupScheduler != null) {
                backupScheduler.shutdown();
            }
            joinWorker();
            if (backupScheduler != null) {
                awaitBackupScheduler();
            }

            if (config.saveMapOnShutdown()) {
                MapSnapshot snapshot = mapState.takeSnapshot();
                try {
                    store.save(snapshot, config.mergedMapFolder());
                    stats.notifyHitCounter(MapServerMetrics.MAP_SAVED);
                    LOGGER.info(() -> "Final map version " + snapshot.version() + " saved to "
                            + config.mergedMapFolder());
                } catch (IOException | RuntimeException e) {
                    stats.notifyHitCounter(MapServerMetrics.MAP_SAVE_FAILED);
                    LOGGER.log(Level.SEVERE, "Failed to save final map to " + config.mergedMapFolder(), e);
                }
            }
            state = OrchestratorState.STOPPED;
            LOGGER.info("Map server stopped");
        }
    }

    private void joinWorker() {
        if (worker == null || worker == Thread.currentThread()) {
            return;
        }
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while waiting for the map server worker to finish");
        }
    }

    private void awaitBackupScheduler() {
        try {
            if (!backupScheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Backup task did not finish in time");
                backupScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            backupScheduler.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    public OrchestratorState state() {
        return state;
    }

    public MapState mapState() {
        return mapState;
    }

    public MapServerStats stats() {
        return stats;
    }

    /** Number of backups written since start. */
    public long backupCount() {
        return backupCount.get();
    }

    public int queueDepth() {
        return queue.size();
    }

    public MapServerConfig config() {
        return config;
    }
}
