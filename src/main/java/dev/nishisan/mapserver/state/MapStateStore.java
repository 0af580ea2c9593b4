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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Writes and reads map snapshots on disk.
 * <p>
 * A saved map is a folder holding {@code map.snapshot} (the serialized
 * {@link MapSnapshot}) and {@code map-meta.yaml} (a readable summary). The
 * snapshot file is written to a temporary file first and moved into place, so
 * a crash during a save leaves the previous map intact. Saves through the same
 * store are serialized.
 */
public final class MapStateStore {

    private static final Logger LOGGER = Logger.getLogger(MapStateStore.class.getName());

    static final String SNAPSHOT_FILE = "map.snapshot";
    static final String META_FILE = "map-meta.yaml";
    static final int FORMAT_VERSION = 1;

    private static final ObjectMapper YAML_MAPPER;

    static {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
        YAML_MAPPER = new ObjectMapper(factory);
    }

    private final Object saveLock = new Object();

    /**
     * Persists a snapshot into a folder, creating it if needed.
     *
     * @param snapshot the snapshot to save
     * @param folder   the target folder
     * @throws IOException if the folder cannot be created or a file cannot be written
     */
    public void save(MapSnapshot snapshot, Path folder) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(folder, "folder");
        synchronized (saveLock) {
            Files.createDirectories(folder);
            Path snapshotPath = folder.resolve(SNAPSHOT_FILE);
            Path tempSnapshotPath = folder.resolve(SNAPSHOT_FILE + ".tmp");
            Files.deleteIfExists(tempSnapshotPath);
            try (ObjectOutputStream oos = new ObjectOutputStream(
                    new BufferedOutputStream(Files.newOutputStream(tempSnapshotPath)))) {
                oos.writeObject(snapshot);
                oos.flush();
            }
            moveIntoPlace(tempSnapshotPath, snapshotPath);

            MapMetadata meta = MapMetadata.of(snapshot, FORMAT_VERSION, Instant.now().toString());
            YAML_MAPPER.writeValue(folder.resolve(META_FILE).toFile(), meta);
            LOGGER.fine(() -> "Saved map version " + snapshot.version() + " to " + folder);
        }
    }

    /**
     * Loads the snapshot saved in a folder.
     *
     * @param folder the folder written by {@link #save(MapSnapshot, Path)}
     * @return the snapshot, or {@code empty} if the folder holds no saved map
     * @throws IOException if the snapshot exists but cannot be read
     */
    public Optional<MapSnapshot> load(Path folder) throws IOException {
        Objects.requireNonNull(folder, "folder");
        Path snapshotPath = folder.resolve(SNAPSHOT_FILE);
        if (!Files.exists(snapshotPath)) {
            return Optional.empty();
        }
        try (ObjectInputStream ois = new ObjectInputStream(
                new BufferedInputStream(Files.newInputStream(snapshotPath)))) {
            return Optional.of((MapSnapshot) ois.readObject());
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IOException("Failed to deserialize map snapshot from " + snapshotPath, e);
        }
    }

    /**
     * Reads the metadata written next to a saved map.
     *
     * @return the metadata, or {@code empty} if none exists
     * @throws IOException if the file exists but cannot be parsed
     */
    public Optional<MapMetadata> readMetadata(Path folder) throws IOException {
        Path metaPath = folder.resolve(META_FILE);
        if (!Files.exists(metaPath)) {
            return Optional.empty();
        }
        return Optional.of(YAML_MAPPER.readValue(metaPath.toFile(), MapMetadata.class));
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
