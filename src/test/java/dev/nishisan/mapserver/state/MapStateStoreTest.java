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

import dev.nishisan.mapserver.engine.FakeMappingEngine;
import dev.nishisan.mapserver.engine.FakeMappingEngine.FakeGlobalMap;
import dev.nishisan.mapserver.engine.MappingEngineException;
import dev.nishisan.mapserver.lookup.SensorType;
import dev.nishisan.mapserver.queue.SubmapJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MapStateStoreTest {

    @TempDir
    Path tempDir;

    private final FakeMappingEngine engine = new FakeMappingEngine();
    private final MapStateStore store = new MapStateStore();

    private MapSnapshot twoRobotSnapshot() throws MappingEngineException {
        MapState state = MapState.empty(engine);
        TrajectorySpan alphaSpan = new TrajectorySpan(0L, 5_000L, EnumSet.of(SensorType.LIDAR, SensorType.IMU));
        TrajectorySpan betaSpan = new TrajectorySpan(100L, 900L, EnumSet.of(SensorType.CAMERA));
        mergeInto(state, SubmapJob.of(1, "alpha", tempDir.resolve("a1")), alphaSpan);
        mergeInto(state, SubmapJob.of(2, "beta", tempDir.resolve("b1")), betaSpan);
        return state.refine(base -> engine.runGlobalCommand("optimize", base.globalMap().copy()));
    }

    private void mergeInto(MapState state, SubmapJob job, TrajectorySpan span) throws MappingEngineException {
        state.mutate(base -> new MapUpdate(
                engine.merge(base.globalMap().copy(),
                        new FakeMappingEngine.FakeSubmap(job.robotName(), job.mapPath(), span, List.of())),
                MergedSubmap.of(job, span)));
    }

    @Test
    void shouldSaveAndLoadSnapshot() throws Exception {
        MapSnapshot snapshot = twoRobotSnapshot();
        Path folder = tempDir.resolve("merged");

        store.save(snapshot, folder);
        Optional<MapSnapshot> loaded = store.load(folder);

        assertTrue(loaded.isPresent());
        MapSnapshot restored = loaded.get();
        assertEquals(2, restored.version());
        assertEquals(1, restored.revision());
        assertEquals(snapshot.trajectories(), restored.trajectories());
        assertEquals(snapshot.history(), restored.history());
        assertEquals(List.of("alpha:a1", "beta:b1"), ((FakeGlobalMap) restored.globalMap()).merged());
        assertFalse(Files.exists(folder.resolve(MapStateStore.SNAPSHOT_FILE + ".tmp")));
    }

    @Test
    void shouldWriteReadableMetadata() throws Exception {
        Path folder = tempDir.resolve("meta");
        store.save(twoRobotSnapshot(), folder);

        MapMetadata meta = store.readMetadata(folder).orElseThrow();

        assertEquals(MapStateStore.FORMAT_VERSION, meta.getFormatVersion());
        assertEquals(2, meta.getVersion());
        assertEquals(1, meta.getRevision());
        assertEquals(2, meta.getMergedSubmaps());
        assertNotNull(meta.getSavedAt());
        assertEquals(2, meta.getRobots().size());
        MapMetadata.RobotEntry alpha = meta.getRobots().get(0);
        assertEquals("alpha", alpha.getName());
        assertEquals(5_000L, alpha.getEndNs());
        assertEquals(List.of("IMU", "LIDAR"), alpha.getSensors());

        String yaml = Files.readString(folder.resolve(MapStateStore.META_FILE));
        assertTrue(yaml.contains("format_version: 1"));
        assertTrue(yaml.contains("start_ns"));
    }

    @Test
    void saveShouldReplacePreviousMap() throws Exception {
        Path folder = tempDir.resolve("replace");
        store.save(MapSnapshot.initial(engine.emptyMap()), folder);
        store.save(twoRobotSnapshot(), folder);

        assertEquals(2, store.load(folder).orElseThrow().version());
    }

    @Test
    void loadFromEmptyFolderReturnsEmpty() throws IOException {
        assertTrue(store.load(tempDir.resolve("nothing-here")).isEmpty());
        assertTrue(store.readMetadata(tempDir.resolve("nothing-here")).isEmpty());
    }

    @Test
    void corruptSnapshotIsAnIoError() throws IOException {
        Path folder = tempDir.resolve("corrupt");
        Files.createDirectories(folder);
        Files.writeString(folder.resolve(MapStateStore.SNAPSHOT_FILE), "not a snapshot");

        assertThrows(IOException.class, () -> store.load(folder));
    }

    @Test
    void saveIntoAFileFails() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        assertThrows(IOException.class, () -> store.save(twoRobotSnapshot(), blocker));
    }
}
