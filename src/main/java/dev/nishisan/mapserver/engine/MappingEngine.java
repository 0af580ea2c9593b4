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

package dev.nishisan.mapserver.engine;

import dev.nishisan.mapserver.lookup.GlobalFramePoint;
import dev.nishisan.mapserver.lookup.SensorType;
import dev.nishisan.mapserver.lookup.Vector3;
import dev.nishisan.mapserver.queue.SubmapJob;

import java.util.Optional;

/**
 * The mapping collaborator the server drives. It owns every geometric algorithm
 * (alignment, pose-graph optimization, loop closure, interpolation); the server
 * only decides what runs, in which order, and which result becomes visible.
 *
 * <h2>Contract</h2>
 * <ul>
 * <li>Commands are deterministic given their inputs.</li>
 * <li>Commands and merges only touch the working copies they are handed. The
 * server publishes the net result of a pipeline in one step, so a failing
 * command leaves the visible map untouched.</li>
 * <li>{@link #transformToGlobal} and {@link #visualize} are called concurrently
 * from query threads and must treat the map as read-only.</li>
 * </ul>
 */
public interface MappingEngine {

    /** Returns the map the server starts from when nothing is restored. */
    GlobalMap emptyMap();

    /**
     * Loads the submap referenced by a job.
     *
     * @throws MappingEngineException if the submap cannot be read
     */
    Submap loadSubmap(SubmapJob job) throws MappingEngineException;

    /**
     * Resolves a submap command by name. Called once per configured name at
     * startup to build the submap pipeline.
     *
     * @return the command, or {@code empty} if the engine does not know it
     */
    Optional<MapCommand<Submap>> submapCommand(String name);

    /**
     * Resolves a global map command by name. Called once per configured name at
     * startup to build the global map pipeline.
     *
     * @return the command, or {@code empty} if the engine does not know it
     */
    Optional<MapCommand<GlobalMap>> globalMapCommand(String name);

    /**
     * Merges a processed submap into a working copy of the global map.
     *
     * @param target working copy, owned by the caller
     * @param submap the submap, after the submap pipeline
     * @return the merged map
     * @throws MappingEngineException if the submap cannot be merged
     */
    GlobalMap merge(GlobalMap target, Submap submap) throws MappingEngineException;

    /**
     * Expresses a point observed by a robot's sensor in the global frame.
     *
     * @return the transformed point and sensor origin, or {@code empty} when no
     *         pose can be interpolated at that time
     */
    Optional<GlobalFramePoint> transformToGlobal(GlobalMap map, String robotName, SensorType sensor,
            long timestampNs, Vector3 pointInSensorFrame);

    /** Triggers rendering of the map. Best effort. */
    void visualize(GlobalMap map);

    /**
     * Runs a single submap command by name.
     *
     * @throws MappingEngineException if the command is unknown or fails
     */
    default Submap runSubmapCommand(String name, Submap submap) throws MappingEngineException {
        MapCommand<Submap> command = submapCommand(name)
                .orElseThrow(() -> new MappingEngineException(name, "Unknown submap command"));
        return command.apply(submap);
    }

    /**
     * Runs a single global map command by name.
     *
     * @throws MappingEngineException if the command is unknown or fails
     */
    default GlobalMap runGlobalCommand(String name, GlobalMap map) throws MappingEngineException {
        MapCommand<GlobalMap> command = globalMapCommand(name)
                .orElseThrow(() -> new MappingEngineException(name, "Unknown global map command"));
        return command.apply(map);
    }
}
