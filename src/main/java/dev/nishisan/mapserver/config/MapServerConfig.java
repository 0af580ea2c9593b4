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

package dev.nishisan.mapserver.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of a map server. Read once at startup; pipelines are
 * never reconfigured at runtime.
 */
public final class MapServerConfig {

    private final List<String> submapCommands;
    private final List<String> globalMapCommands;
    private final Path mergedMapFolder;
    private final Path backupFolder;
    private final Duration backupInterval;
    private final int mapUpdateQueueSize;
    private final int ingestionCapacity;
    private final int globalPipelineEveryNMerges;
    private final Duration globalPipelineInterval;
    private final boolean saveMapOnShutdown;
    private final boolean restoreFromBackup;
    private final Duration workerPollInterval;
    private final boolean statusReportEnabled;
    private final Path statusReportPath;
    private final Duration statusReportInterval;

    private MapServerConfig(Builder builder) {
        this.submapCommands = List.copyOf(builder.submapCommands);
        this.globalMapCommands = List.copyOf(builder.globalMapCommands);
        this.mergedMapFolder = Objects.requireNonNull(builder.mergedMapFolder, "mergedMapFolder");
        this.backupFolder = builder.backupFolder != null
                ? builder.backupFolder
                : defaultBackupFolder(builder.mergedMapFolder);
        this.backupInterval = Objects.requireNonNull(builder.backupInterval, "backupInterval");
        this.mapUpdateQueueSize = builder.mapUpdateQueueSize;
        this.ingestionCapacity = builder.ingestionCapacity;
        this.globalPipelineEveryNMerges = builder.globalPipelineEveryNMerges;
        this.globalPipelineInterval = Objects.requireNonNull(builder.globalPipelineInterval,
                "globalPipelineInterval");
        this.saveMapOnShutdown = builder.saveMapOnShutdown;
        this.restoreFromBackup = builder.restoreFromBackup;
        this.workerPollInterval = Objects.requireNonNull(builder.workerPollInterval, "workerPollInterval");
        this.statusReportEnabled = builder.statusReportEnabled;
        this.statusReportPath = builder.statusReportPath;
        this.statusReportInterval = Objects.requireNonNull(builder.statusReportInterval, "statusReportInterval");
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The backup folder used when none is configured: a sibling of the merged map
     * folder with a {@code _backup} suffix.
     */
    static Path defaultBackupFolder(Path mergedMapFolder) {
        Path absolute = mergedMapFolder.toAbsolutePath().normalize();
        Path name = absolute.getFileName();
        String folderName = (name == null ? "merged_map" : name.toString()) + "_backup";
        Path parent = absolute.getParent();
        return parent == null ? Path.of(folderName) : parent.resolve(folderName);
    }

    /** Ordered command names applied to every submap before merging. */
    public List<String> submapCommands() {
        return submapCommands;
    }

    /** Ordered command names applied to the global map after merges. */
    public List<String> globalMapCommands() {
        return globalMapCommands;
    }

    public Path mergedMapFolder() {
        return mergedMapFolder;
    }

    public Path backupFolder() {
        return backupFolder;
    }

    /** Period of the backup task. {@link Duration#ZERO} disables backups. */
    public Duration backupInterval() {
        return backupInterval;
    }

    public boolean backupsEnabled() {
        return !backupInterval.isZero();
    }

    /** Buffer size handed to the notification transport. */
    public int mapUpdateQueueSize() {
        return mapUpdateQueueSize;
    }

    /** Capacity of the ingestion queue; {@code <= 0} means unbounded. */
    public int ingestionCapacity() {
        return ingestionCapacity;
    }

    /** Run the global pipeline after this many merges; 0 disables the count trigger. */
    public int globalPipelineEveryNMerges() {
        return globalPipelineEveryNMerges;
    }

    /** Run the global pipeline once this much time has passed; zero disables the time trigger. */
    public Duration globalPipelineInterval() {
        return globalPipelineInterval;
    }

    public boolean saveMapOnShutdown() {
        return saveMapOnShutdown;
    }

    public boolean restoreFromBackup() {
        return restoreFromBackup;
    }

    /** How long the worker waits for a job before re-checking time triggers. */
    public Duration workerPollInterval() {
        return workerPollInterval;
    }

    public boolean statusReportEnabled() {
        return statusReportEnabled;
    }

    public Path statusReportPath() {
        return statusReportPath;
    }

    public Duration statusReportInterval() {
        return statusReportInterval;
    }

    private void validate() {
        for (String name : submapCommands) {
            requireCommandName(name, "submap_commands");
        }
        for (String name : globalMapCommands) {
            requireCommandName(name, "global_map_commands");
        }
        if (backupInterval.isNegative()) {
            throw new IllegalArgumentException("backupInterval cannot be negative");
        }
        requireNanosRange(backupInterval, "backupInterval");
        if (!backupInterval.isZero() && backupInterval.toMillis() < 1) {
            throw new IllegalArgumentException("backupInterval must be zero or at least 1ms");
        }
        if (mapUpdateQueueSize <= 0) {
            throw new IllegalArgumentException("mapUpdateQueueSize must be > 0");
        }
        if (globalPipelineEveryNMerges < 0) {
            throw new IllegalArgumentException("globalPipelineEveryNMerges must be >= 0");
        }
        if (globalPipelineInterval.isNegative()) {
            throw new IllegalArgumentException("globalPipelineInterval cannot be negative");
        }
        requireNanosRange(globalPipelineInterval, "globalPipelineInterval");
        if (!globalMapCommands.isEmpty() && globalPipelineEveryNMerges == 0 && globalPipelineInterval.isZero()) {
            throw new IllegalArgumentException(
                    "global_map_commands are configured but both global pipeline triggers are disabled");
        }
        requireNanosRange(workerPollInterval, "workerPollInterval");
        if (workerPollInterval.toMillis() < 1) {
            throw new IllegalArgumentException("workerPollInterval must be at least 1ms");
        }
        if (statusReportEnabled) {
            if (statusReportPath == null) {
                throw new IllegalArgumentException("statusReportPath is required when the status report is enabled");
            }
            if (statusReportInterval.isNegative() || statusReportInterval.isZero()) {
                throw new IllegalArgumentException("statusReportInterval must be > 0");
            }
            requireNanosRange(statusReportInterval, "statusReportInterval");
        }
    }

    // durations must fit in a long of nanoseconds
    private static void requireNanosRange(Duration value, String name) {
        try {
            value.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(name + " is too large: " + value, e);
        }
    }

    private static void requireCommandName(String name, String listName) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Blank command name in " + listName);
        }
    }

    @Override
    public String toString() {
        return "MapServerConfig{submapCommands=" + submapCommands
                + ", globalMapCommands=" + globalMapCommands
                + ", mergedMapFolder=" + mergedMapFolder
                + ", backupFolder=" + backupFolder
                + ", backupInterval=" + backupInterval
                + ", ingestionCapacity=" + ingestionCapacity + '}';
    }

    /**
     * Builder for {@link MapServerConfig}.
     */
    public static final class Builder {
        private List<String> submapCommands = new ArrayList<>();
        private List<String> globalMapCommands = new ArrayList<>();
        private Path mergedMapFolder = Path.of("/tmp/map_server/merged_map");
        private Path backupFolder;
        private Duration backupInterval = Duration.ofMinutes(5);
        private int mapUpdateQueueSize = 100;
        private int ingestionCapacity = 1000;
        private int globalPipelineEveryNMerges = 1;
        private Duration globalPipelineInterval = Duration.ZERO;
        private boolean saveMapOnShutdown = true;
        private boolean restoreFromBackup = false;
        private Duration workerPollInterval = Duration.ofMillis(500);
        private boolean statusReportEnabled = false;
        private Path statusReportPath;
        private Duration statusReportInterval = Duration.ofSeconds(30);

        private Builder() {
        }

        public Builder submapCommands(List<String> names) {
            this.submapCommands = new ArrayList<>(Objects.requireNonNull(names, "names"));
            return this;
        }

        public Builder globalMapCommands(List<String> names) {
            this.globalMapCommands = new ArrayList<>(Objects.requireNonNull(names, "names"));
            return this;
        }

        public Builder mergedMapFolder(Path folder) {
            this.mergedMapFolder = Objects.requireNonNull(folder, "folder");
            return this;
        }

        /** Sets the backup folder; {@code null} restores the default. */
        public Builder backupFolder(Path folder) {
            this.backupFolder = folder;
            return this;
        }

        public Builder backupInterval(Duration interval) {
            this.backupInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public Builder mapUpdateQueueSize(int size) {
            this.mapUpdateQueueSize = size;
            return this;
        }

        public Builder ingestionCapacity(int capacity) {
            this.ingestionCapacity = capacity;
            return this;
        }

        public Builder globalPipelineEveryNMerges(int merges) {
            this.globalPipelineEveryNMerges = merges;
            return this;
        }

        public Builder globalPipelineInterval(Duration interval) {
            this.globalPipelineInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public Builder saveMapOnShutdown(boolean save) {
            this.saveMapOnShutdown = save;
            return this;
        }

        public Builder restoreFromBackup(boolean restore) {
            this.restoreFromBackup = restore;
            return this;
        }

        public Builder workerPollInterval(Duration interval) {
            this.workerPollInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public Builder statusReport(Path path, Duration interval) {
            this.statusReportEnabled = true;
            this.statusReportPath = Objects.requireNonNull(path, "path");
            this.statusReportInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public MapServerConfig build() {
            return new MapServerConfig(this);
        }
    }
}
