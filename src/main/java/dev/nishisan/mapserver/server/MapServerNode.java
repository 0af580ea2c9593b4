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
import dev.nishisan.mapserver.config.MapServerConfigLoader;
import dev.nishisan.mapserver.engine.GlobalMap;
import dev.nishisan.mapserver.engine.MappingEngine;
import dev.nishisan.mapserver.engine.Submap;
import dev.nishisan.mapserver.pipeline.CommandPipeline;
import dev.nishisan.mapserver.state.MapSnapshot;
import dev.nishisan.mapserver.state.MapState;
import dev.nishisan.mapserver.state.MapStateStore;
import dev.nishisan.mapserver.stats.MapServerStats;
import dev.nishisan.mapserver.status.MapServerStatus;
import dev.nishisan.mapserver.status.StatusReporter;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * A complete map server built from a configuration and a mapping engine.
 * <p>
 * Construction validates everything that can be validated up front: the
 * configuration, every command name of both pipelines and, when restoring is
 * enabled, the last backup. Any problem there is fatal and surfaces as an
 * exception from {@link #create(Path, MappingEngine)}.
 */
public final class MapServerNode implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(MapServerNode.class.getName());

    private final MapServerConfig config;
    private final MapServerStats stats;
    private final MapServerOrchestrator orchestrator;
    private final MapQueryService queryService;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ScheduledExecutorService statusScheduler;
    private volatile StatusReporter statusReporter;

    private MapServerNode(MapServerConfig config, MapServerStats stats, MapServerOrchestrator orchestrator,
            MapQueryService queryService) {
        this.config = config;
        this.stats = stats;
        this.orchestrator = orchestrator;
        this.queryService = queryService;
    }

    /**
     * Loads the YAML configuration and builds the server.
     *
     * @throws IOException              if the file is missing or unreadable, or the
     *                                  backup cannot be read
     * @throws IllegalArgumentException if the configuration is invalid or names a
     *                                  command the engine does not know
     */
    public static MapServerNode create(Path configFile, MappingEngine engine) throws IOException {
        return create(MapServerConfigLoader.loadConfig(configFile), engine);
    }

    /**
     * Builds the server from an already validated configuration.
     *
     * @throws IOException              if restoring is enabled and the backup cannot be read
     * @throws IllegalArgumentException if a configured command is unknown to the engine
     */
    public static MapServerNode create(MapServerConfig config, MappingEngine engine) throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(engine, "engine");
        MapServerStats stats = new MapServerStats();
        CommandPipeline<Submap> submapPipeline = CommandPipeline.forSubmaps(config.submapCommands(), engine, stats);
        CommandPipeline<GlobalMap> globalPipeline = CommandPipeline.forGlobalMap(config.globalMapCommands(), engine,
                stats);

        MapStateStore store = new MapStateStore();
        MapState mapState = restoreOrCreate(config, engine, store);

        MapServerOrchestrator orchestrator = new MapServerOrchestrator(config, engine, mapState, submapPipeline,
                globalPipeline, store, stats);
        MapQueryService queryService = new MapQueryService(mapState, engine, store, stats,
                config.mergedMapFolder());
        LOGGER.info(() -> "Map server configured: " + config);
        return new MapServerNode(config, stats, orchestrator, queryService);
    }

    private static MapState restoreOrCreate(MapServerConfig config, MappingEngine engine, MapStateStore store)
            throws IOException {
        if (!config.restoreFromBackup()) {
            return MapState.empty(engine);
        }
        Optional<MapSnapshot> restored = store.load(config.backupFolder());
        if (restored.isEmpty()) {
            LOGGER.info(() -> "No backup found in " + config.backupFolder() + ", starting with an empty map");
            return MapState.empty(engine);
        }
        MapSnapshot snapshot = restored.get();
        LOGGER.info(() -> "Restored map version " + snapshot.version() + " with robots " + snapshot.robotNames()
                + " from " + config.backupFolder());
        return new MapState(snapshot, engine);
    }

    /**
     * Starts the worker, the backup task and, when enabled, the status report.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Map server node already closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        orchestrator.start();
        if (config.statusReportEnabled()) {
            statusScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "map-server-status");
                t.setDaemon(true);
                return t;
            });
            statusReporter = new StatusReporter(this::status, statusScheduler, config.statusReportPath(),
                    config.statusReportInterval());
            statusReporter.start();
        }
    }

    /**
     * Entry point for the notification transport: a robot announces a new
     * submap folder.
     */
    public SubmissionResult onSubmapNotification(String robotName, String mapPath) {
        return orchestrator.loadAndProcessSubmap(robotName, mapPath);
    }

    public MapQueryService query() {
        return queryService;
    }

    public MapServerOrchestrator orchestrator() {
        return orchestrator;
    }

    public MapServerConfig config() {
        return config;
    }

    public MapServerStats stats() {
        return stats;
    }

    /**
     * Captures the current status of the server.
     */
    public MapServerStatus status() {
        stats.calcStats(false);
        return MapServerStatus.capture(orchestrator.state().name(), orchestrator.mapState().takeSnapshot(),
                orchestrator.queueDepth(), orchestrator.backupCount(), stats.snapshot());
    }

    /**
     * Stops the server. Idempotent.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            orchestrator.shutdown();
            return;
        }
        if (statusReporter != null) {
            statusReporter.close();
        }
        orchestrator.shutdown();
        if (statusReporter != null) {
            statusReporter.report();
        }
        if (statusScheduler != null) {
            statusScheduler.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
