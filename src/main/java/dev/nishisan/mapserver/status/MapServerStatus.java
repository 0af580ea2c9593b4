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

package dev.nishisan.mapserver.status;

import dev.nishisan.mapserver.state.MapSnapshot;
import dev.nishisan.mapserver.state.RobotTrajectory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Point-in-time view of a running map server, as written by {@link StatusReporter}.
 *
 * @param capturedAt   when the status was taken
 * @param state        orchestrator lifecycle state
 * @param mapVersion   number of merged submaps
 * @param mapRevision  number of successful global pipeline passes
 * @param robots       trajectories by robot name
 * @param queueDepth   jobs waiting for the worker
 * @param backupCount  backups written since start
 * @param counters     stats counters, current values and averages by key
 */
public record MapServerStatus(
        Instant capturedAt,
        String state,
        long mapVersion,
        long mapRevision,
        List<RobotTrajectory> robots,
        int queueDepth,
        long backupCount,
        Map<String, Number> counters) {

    public MapServerStatus {
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(state, "state");
        robots = List.copyOf(robots);
        counters = Map.copyOf(counters);
    }

    public static MapServerStatus capture(String state, MapSnapshot snapshot, int queueDepth, long backupCount,
            Map<String, Number> counters) {
        return new MapServerStatus(Instant.now(), state, snapshot.version(), snapshot.revision(),
                List.copyOf(snapshot.trajectories().values()), queueDepth, backupCount,
                new TreeMap<>(counters));
    }
}
