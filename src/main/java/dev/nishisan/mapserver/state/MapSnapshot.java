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

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable view of the map state at one version.
 * <p>
 * {@code version} counts merged submaps and is the length of {@link #history()}.
 * {@code revision} counts global pipeline passes published since startup or
 * restore. A snapshot never changes after it is published; later mutations
 * produce new snapshots.
 */
public final class MapSnapshot implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final long version;
    private final long revision;
    private final GlobalMap globalMap;
    private final Map<String, RobotTrajectory> trajectories;
    private final List<MergedSubmap> history;
    private final Instant publishedAt;

    private MapSnapshot(long version, long revision, GlobalMap globalMap, Map<String, RobotTrajectory> trajectories,
            List<MergedSubmap> history, Instant publishedAt) {
        this.version = version;
        this.revision = revision;
        this.globalMap = Objects.requireNonNull(globalMap, "globalMap");
        this.trajectories = Collections.unmodifiableMap(new TreeMap<>(trajectories));
        this.history = List.copyOf(history);
        this.publishedAt = publishedAt;
    }

    /**
     * Creates the version-0 snapshot around an empty map.
     */
    public static MapSnapshot initial(GlobalMap emptyMap) {
        return new MapSnapshot(0L, 0L, emptyMap, Map.of(), List.of(), Instant.now());
    }

    /**
     * Returns the snapshot that results from merging one more submap.
     */
    MapSnapshot advance(MapUpdate update) {
        MergedSubmap merged = update.merged();
        Map<String, RobotTrajectory> nextTrajectories = new TreeMap<>(trajectories);
        nextTrajectories.merge(merged.robotName(),
                RobotTrajectory.first(merged.robotName(), merged.span()),
                (existing, ignored) -> existing.extend(merged.span()));
        List<MergedSubmap> nextHistory = new ArrayList<>(history.size() + 1);
        nextHistory.addAll(history);
        nextHistory.add(merged);
        return new MapSnapshot(version + 1, revision, update.globalMap(), nextTrajectories, nextHistory,
                Instant.now());
    }

    /**
     * Returns the snapshot that results from replacing the global map after a
     * global pipeline pass. The version does not move.
     */
    MapSnapshot refine(GlobalMap refined) {
        return new MapSnapshot(version, revision + 1, refined, trajectories, history, Instant.now());
    }

    public long version() {
        return version;
    }

    public long revision() {
        return revision;
    }

    public GlobalMap globalMap() {
        return globalMap;
    }

    public Optional<RobotTrajectory> trajectory(String robotName) {
        return Optional.ofNullable(trajectories.get(robotName));
    }

    /** Trajectories by robot name, sorted by name. */
    public Map<String, RobotTrajectory> trajectories() {
        return trajectories;
    }

    public Set<String> robotNames() {
        return trajectories.keySet();
    }

    /** Merged submaps in merge order. */
    public List<MergedSubmap> history() {
        return history;
    }

    public Instant publishedAt() {
        return publishedAt;
    }

    public boolean isEmpty() {
        return version == 0L;
    }

    @Override
    public String toString() {
        return "MapSnapshot{version=" + version + ", revision=" + revision + ", robots=" + trajectories.keySet() + '}';
    }
}
