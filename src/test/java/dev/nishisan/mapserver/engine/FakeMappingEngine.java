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
import dev.nishisan.mapserver.state.TrajectorySpan;

import java.io.Serial;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory mapping engine for tests.
 * <p>
 * Submap commands: {@code align}, {@code optimize}, {@code slow} (blocks until
 * {@link #releaseSlow()}). Global commands: {@code loop_close},
 * {@code optimize}. Any command listed through {@link #failCommand(String)}
 * first scribbles on its input and then throws, so tests can check that the
 * published map never sees a failed pass.
 * <p>
 * The transform places the sensor origin at {@code (t_seconds, robotIndex, 0)}
 * and adds the sensor-frame point to it.
 */
public final class FakeMappingEngine implements MappingEngine {

    public static final TrajectorySpan DEFAULT_SPAN = new TrajectorySpan(0L, 10_000_000_000L,
            EnumSet.of(SensorType.LIDAR, SensorType.IMU));

    private static final Set<String> SUBMAP_COMMANDS = Set.of("align", "optimize", "slow");
    private static final Set<String> GLOBAL_COMMANDS = Set.of("loop_close", "optimize");

    private final Map<Path, TrajectorySpan> spans = new ConcurrentHashMap<>();
    private final Set<String> failingCommands = ConcurrentHashMap.newKeySet();
    private final Set<Path> unreadable = ConcurrentHashMap.newKeySet();
    private final Set<Path> unmergeable = ConcurrentHashMap.newKeySet();
    private final AtomicInteger loads = new AtomicInteger();
    private final AtomicInteger visualizations = new AtomicInteger();
    private final CountDownLatch slowEntered = new CountDownLatch(1);
    private final CountDownLatch slowRelease = new CountDownLatch(1);
    private volatile boolean failTransform;
    private volatile boolean failVisualize;

    public FakeMappingEngine spanFor(Path mapPath, TrajectorySpan span) {
        spans.put(mapPath.toAbsolutePath().normalize(), span);
        return this;
    }

    public FakeMappingEngine failCommand(String name) {
        failingCommands.add(name);
        return this;
    }

    public FakeMappingEngine unreadable(Path mapPath) {
        unreadable.add(mapPath.toAbsolutePath().normalize());
        return this;
    }

    public FakeMappingEngine unmergeable(Path mapPath) {
        unmergeable.add(mapPath.toAbsolutePath().normalize());
        return this;
    }

    public FakeMappingEngine failTransform(boolean fail) {
        this.failTransform = fail;
        return this;
    }

    public FakeMappingEngine failVisualize(boolean fail) {
        this.failVisualize = fail;
        return this;
    }

    public boolean awaitSlowCommand(long timeout, TimeUnit unit) throws InterruptedException {
        return slowEntered.await(timeout, unit);
    }

    public void releaseSlow() {
        slowRelease.countDown();
    }

    public int loadCount() {
        return loads.get();
    }

    public int visualizeCount() {
        return visualizations.get();
    }

    @Override
    public GlobalMap emptyMap() {
        return new FakeGlobalMap();
    }

    @Override
    public Submap loadSubmap(SubmapJob job) throws MappingEngineException {
        loads.incrementAndGet();
        if (unreadable.contains(job.mapPath())) {
            throw new MappingEngineException("load", "Cannot read submap at " + job.mapPath());
        }
        TrajectorySpan span = spans.getOrDefault(job.mapPath(), DEFAULT_SPAN);
        return new FakeSubmap(job.robotName(), job.mapPath(), span, List.of());
    }

    @Override
    public Optional<MapCommand<Submap>> submapCommand(String name) {
        if (!SUBMAP_COMMANDS.contains(name)) {
            return Optional.empty();
        }
        return Optional.of(input -> {
            FakeSubmap submap = (FakeSubmap) input;
            if ("slow".equals(name)) {
                slowEntered.countDown();
                try {
                    slowRelease.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MappingEngineException(name, "Interrupted", e);
                }
            }
            if (failingCommands.contains(name)) {
                throw new MappingEngineException(name, "Command failed for " + submap.mapPath());
            }
            return submap.withCommand(name);
        });
    }

    @Override
    public Optional<MapCommand<GlobalMap>> globalMapCommand(String name) {
        if (!GLOBAL_COMMANDS.contains(name)) {
            return Optional.empty();
        }
        return Optional.of(input -> {
            FakeGlobalMap map = (FakeGlobalMap) input;
            map.appliedCommands.add(name);
            if (failingCommands.contains(name)) {
                map.merged.clear();
                throw new MappingEngineException(name, "Global command failed");
            }
            return map;
        });
    }

    @Override
    public GlobalMap merge(GlobalMap target, Submap submap) throws MappingEngineException {
        if (unmergeable.contains(submap.mapPath())) {
            throw new MappingEngineException("merge", "Cannot merge " + submap.mapPath());
        }
        FakeGlobalMap map = (FakeGlobalMap) target;
        map.merged.add(submap.robotName() + ":" + submap.mapPath().getFileName());
        map.robotIndex.putIfAbsent(submap.robotName(), map.robotIndex.size());
        return map;
    }

    @Override
    public Optional<GlobalFramePoint> transformToGlobal(GlobalMap map, String robotName, SensorType sensor,
            long timestampNs, Vector3 pointInSensorFrame) {
        if (failTransform) {
            throw new IllegalStateException("transform unavailable");
        }
        Integer index = ((FakeGlobalMap) map).robotIndex.get(robotName);
        if (index == null) {
            return Optional.empty();
        }
        Vector3 origin = expectedOrigin(index, timestampNs);
        return Optional.of(new GlobalFramePoint(origin.plus(pointInSensorFrame), origin));
    }

    public static Vector3 expectedOrigin(int robotIndex, long timestampNs) {
        return Vector3.of(timestampNs / 1_000_000_000.0, robotIndex, 0.0);
    }

    @Override
    public void visualize(GlobalMap map) {
        if (failVisualize) {
            throw new IllegalStateException("no display");
        }
        visualizations.incrementAndGet();
    }

    /**
     * Global map that records what happened to it.
     */
    public static final class FakeGlobalMap implements GlobalMap {

        @Serial
        private static final long serialVersionUID = 1L;

        private final List<String> merged;
        private final List<String> appliedCommands;
        private final Map<String, Integer> robotIndex;

        FakeGlobalMap() {
            this(new ArrayList<>(), new ArrayList<>(), new HashMap<>());
        }

        private FakeGlobalMap(List<String> merged, List<String> appliedCommands, Map<String, Integer> robotIndex) {
            this.merged = merged;
            this.appliedCommands = appliedCommands;
            this.robotIndex = robotIndex;
        }

        @Override
        public GlobalMap copy() {
            return new FakeGlobalMap(new ArrayList<>(merged), new ArrayList<>(appliedCommands),
                    new HashMap<>(robotIndex));
        }

        /** Merged submaps as {@code robot:folder}, in merge order. */
        public List<String> merged() {
            return Collections.unmodifiableList(merged);
        }

        public List<String> appliedCommands() {
            return Collections.unmodifiableList(appliedCommands);
        }

        public Map<String, Integer> robotIndex() {
            return Collections.unmodifiableMap(robotIndex);
        }
    }

    public record FakeSubmap(String robotName, Path mapPath, TrajectorySpan span, List<String> appliedCommands)
            implements Submap {

        FakeSubmap withCommand(String name) {
            List<String> next = new ArrayList<>(appliedCommands);
            next.add(name);
            return new FakeSubmap(robotName, mapPath, span, List.copyOf(next));
        }
    }
}
