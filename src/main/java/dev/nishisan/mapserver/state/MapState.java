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

package dev.nishisan.mapserver.state;

import dev.nishisan.mapserver.engine.GlobalMap;
import dev.nishisan.mapserver.engine.MappingEngine;
import dev.nishisan.mapserver.lookup.GlobalFramePoint;
import dev.nishisan.mapserver.lookup.LookupRequest;
import dev.nishisan.mapserver.lookup.LookupResponse;
import dev.nishisan.mapserver.lookup.LookupStatus;
import dev.nishisan.mapserver.lookup.SensorType;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The shared, versioned map. One writer thread mutates it; any thread reads it
 * through {@link #takeSnapshot() snapshots}.
 * <p>
 * The current state is a single immutable {@link MapSnapshot} behind a volatile
 * reference. A mutation computes the next snapshot from the current one and
 * publishes it with one write, so readers never wait for the writer and never
 * observe a half-applied merge. If the mutation function throws, nothing is
 * published.
 * <p>
 * The writer is the thread that calls {@link #claimWriter()} or, failing that,
 * the first thread that mutates. Mutation from any other thread is rejected.
 */
public final class MapState {

    private static final Logger LOGGER = Logger.getLogger(MapState.class.getName());

    private final MappingEngine engine;
    private final AtomicReference<Thread> writer = new AtomicReference<>();
    private volatile MapSnapshot current;

    /**
     * Computes the next piece of state from the current snapshot.
     *
     * @param <R> what the function produces
     * @param <E> the checked exception it may throw
     */
    @FunctionalInterface
    public interface Mutation<R, E extends Exception> {
        R apply(MapSnapshot current) throws E;
    }

    public MapState(MapSnapshot initial, MappingEngine engine) {
        this.current = Objects.requireNonNull(initial, "initial");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Creates an empty state (version 0) around the engine's empty map.
     */
    public static MapState empty(MappingEngine engine) {
        return new MapState(MapSnapshot.initial(engine.emptyMap()), engine);
    }

    /**
     * Binds the calling thread as the only writer.
     *
     * @throws IllegalStateException if another thread already owns the state
     */
    public void claimWriter() {
        Thread self = Thread.currentThread();
        if (!writer.compareAndSet(null, self) && writer.get() != self) {
            throw new IllegalStateException("MapState is already owned by writer thread '"
                    + writer.get().getName() + "'");
        }
    }

    /**
     * Merges one submap: applies {@code fn} to the current snapshot and publishes
     * the result as version + 1.
     *
     * @param fn computes the merged map and its history entry; must not modify the
     *           snapshot's global map
     * @return the published snapshot
     * @throws E if {@code fn} fails, in which case the state is unchanged
     */
    public <E extends Exception> MapSnapshot mutate(Mutation<MapUpdate, E> fn) throws E {
        Objects.requireNonNull(fn, "fn");
        claimWriter();
        MapSnapshot base = current;
        MapUpdate update = Objects.requireNonNull(fn.apply(base), "mutation returned no update");
        MapSnapshot next = base.advance(update);
        current = next;
        LOGGER.fine(() -> "Published map version " + next.version() + " (robot '" + update.merged().robotName()
                + "', sequence " + update.merged().sequence() + ")");
        return next;
    }

    /**
     * Replaces the global map after a global pipeline pass. The version does not
     * change; the revision increases by one.
     *
     * @param fn computes the refined map from a snapshot; must not modify the
     *           snapshot's global map
     * @return the published snapshot
     * @throws E if {@code fn} fails, in which case the state is unchanged
     */
    public <E extends Exception> MapSnapshot refine(Mutation<GlobalMap, E> fn) throws E {
        Objects.requireNonNull(fn, "fn");
        claimWriter();
        MapSnapshot base = current;
        GlobalMap refined = Objects.requireNonNull(fn.apply(base), "refinement returned no map");
        MapSnapshot next = base.refine(refined);
        current = next;
        return next;
    }

    /**
     * Returns the latest published snapshot. Never blocks.
     */
    public MapSnapshot takeSnapshot() {
        return current;
    }

    public long version() {
        return current.version();
    }

    /**
     * Resolves a lookup against a snapshot. Never throws for bad input: every
     * problem is reported through the response status.
     * <p>
     * Checks run in this order: robot known, sensor tag recognized and seen for
     * that robot, timestamp inside the robot's span. The transform itself is
     * delegated to the mapping engine.
     */
    public LookupResponse lookup(MapSnapshot snapshot, LookupRequest request) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(request, "request");
        Optional<RobotTrajectory> trajectory = request.robotName() == null
                ? Optional.empty()
                : snapshot.trajectory(request.robotName());
        if (trajectory.isEmpty()) {
            return LookupResponse.failure(LookupStatus.ROBOT_UNKNOWN);
        }
        Optional<SensorType> sensor = SensorType.fromTag(request.sensorType());
        if (sensor.isEmpty() || !trajectory.get().span().hasSensor(sensor.get())) {
            return LookupResponse.failure(LookupStatus.SENSOR_UNKNOWN);
        }
        if (!trajectory.get().span().covers(request.timestampNs())) {
            return LookupResponse.failure(LookupStatus.TIMESTAMP_OUT_OF_RANGE);
        }
        try {
            Optional<GlobalFramePoint> resolved = engine.transformToGlobal(snapshot.globalMap(),
                    request.robotName(), sensor.get(), request.timestampNs(), request.pointInSensorFrame());
            return resolved.map(LookupResponse::success)
                    .orElseGet(() -> LookupResponse.failure(LookupStatus.TIMESTAMP_OUT_OF_RANGE));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Mapping engine failed to resolve lookup for robot '" + request.robotName()
                    + "' at " + request.timestampNs() + "ns", e);
            return LookupResponse.failure(LookupStatus.TIMESTAMP_OUT_OF_RANGE);
        }
    }
}
