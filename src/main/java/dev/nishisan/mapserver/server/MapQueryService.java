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

import dev.nishisan.mapserver.engine.MappingEngine;
import dev.nishisan.mapserver.lookup.LookupRequest;
import dev.nishisan.mapserver.lookup.LookupResponse;
import dev.nishisan.mapserver.lookup.LookupStatus;
import dev.nishisan.mapserver.state.MapSnapshot;
import dev.nishisan.mapserver.state.MapState;
import dev.nishisan.mapserver.state.MapStateStore;
import dev.nishisan.mapserver.stats.MapServerMetrics;
import dev.nishisan.mapserver.stats.MapServerStats;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-side operations of the map server. Every call works on a snapshot taken
 * at its start, so callers never wait for the worker and never see a partial
 * merge. Safe to use from any number of threads.
 */
public final class MapQueryService {

    private static final Logger LOGGER = Logger.getLogger(MapQueryService.class.getName());

    private final MapState mapState;
    private final MappingEngine engine;
    private final MapStateStore store;
    private final MapServerStats stats;
    private final Path defaultFolder;

    public MapQueryService(MapState mapState, MappingEngine engine, MapStateStore store, MapServerStats stats,
            Path defaultFolder) {
        this.mapState = Objects.requireNonNull(mapState, "mapState");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.defaultFolder = Objects.requireNonNull(defaultFolder, "defaultFolder");
    }

    /**
     * Saves the current map to the merged map folder.
     */
    public boolean saveMap() {
        return saveMap(defaultFolder);
    }

    /**
     * Saves the current map to a folder given as a string, as received from a
     * client. A blank value means the merged map folder.
     */
    public boolean saveMap(String folder) {
        if (folder == null || folder.isBlank()) {
            return saveMap();
        }
        Path path;
        try {
            path = Path.of(folder.trim());
        } catch (InvalidPathException e) {
            LOGGER.log(Level.WARNING, "Invalid map output folder '" + folder + "'", e);
            stats.notifyHitCounter(MapServerMetrics.MAP_SAVE_FAILED);
            return false;
        }
        return saveMap(path);
    }

    /**
     * Saves a snapshot of the current map to {@code folder}.
     *
     * @return {@code true} if the map was written; I/O failures are logged and
     *         reported as {@code false}
     */
    public boolean saveMap(Path folder) {
        Objects.requireNonNull(folder, "folder");
        MapSnapshot snapshot = mapState.takeSnapshot();
        try {
            store.save(snapshot, folder);
            stats.notifyHitCounter(MapServerMetrics.MAP_SAVED);
            LOGGER.info(() -> "Map version " + snapshot.version() + " saved to " + folder);
            return true;
        } catch (IOException | RuntimeException e) {
            stats.notifyHitCounter(MapServerMetrics.MAP_SAVE_FAILED);
            LOGGER.log(Level.WARNING, "Failed to save map version " + snapshot.version() + " to " + folder, e);
            return false;
        }
    }

    /**
     * Asks the engine to render the current map. Best effort: failures are
     * logged and not reported to the caller.
     */
    public void visualizeMap() {
        MapSnapshot snapshot = mapState.takeSnapshot();
        try {
            engine.visualize(snapshot.globalMap());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Map visualization failed for version " + snapshot.version(), e);
        }
    }

    /**
     * Resolves a batch of lookups against a single snapshot.
     *
     * @param requests the batch; may be empty
     * @return one response per request, in request order
     */
    public List<LookupResponse> mapLookup(List<LookupRequest> requests) {
        Objects.requireNonNull(requests, "requests");
        MapSnapshot snapshot = mapState.takeSnapshot();
        List<LookupResponse> responses = new ArrayList<>(requests.size());
        for (LookupRequest request : requests) {
            LookupResponse response;
            if (request == null) {
                response = LookupResponse.failure(LookupStatus.ROBOT_UNKNOWN);
            } else {
                try {
                    response = mapState.lookup(snapshot, request);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Lookup failed for robot '" + request.robotName() + "'", e);
                    response = LookupResponse.failure(LookupStatus.TIMESTAMP_OUT_OF_RANGE);
                }
            }
            stats.notifyHitCounter(MapServerMetrics.LOOKUP_REQUESTS);
            stats.notifyHitCounter(MapServerMetrics.lookupStatus(response.status().name()));
            responses.add(response);
        }
        LOGGER.fine(() -> "Resolved " + requests.size() + " lookup(s) against map version " + snapshot.version());
        return responses;
    }

    /**
     * Returns the latest published snapshot.
     */
    public MapSnapshot snapshot() {
        return mapState.takeSnapshot();
    }
}
