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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.mapserver.state.RobotTrajectory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically captures a {@link MapServerStatus} and writes it as YAML to a
 * file, for monitoring scripts and operators.
 */
public final class StatusReporter implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(StatusReporter.class.getName());

    private static final ObjectMapper YAML_MAPPER;

    static {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .build();
        YAML_MAPPER = new ObjectMapper(factory);
    }

    private final Supplier<MapServerStatus> statusSupplier;
    private final ScheduledExecutorService scheduler;
    private final Path outputPath;
    private final Duration reportInterval;
    private volatile boolean running;
    private volatile ScheduledFuture<?> reportTask;

    /**
     * @param statusSupplier supplies the status on each tick
     * @param scheduler      scheduler for periodic execution
     * @param outputPath     file to write
     * @param reportInterval interval between reports
     */
    public StatusReporter(Supplier<MapServerStatus> statusSupplier, ScheduledExecutorService scheduler,
            Path outputPath, Duration reportInterval) {
        this.statusSupplier = Objects.requireNonNull(statusSupplier, "statusSupplier");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.outputPath = Objects.requireNonNull(outputPath, "outputPath");
        this.reportInterval = Objects.requireNonNull(reportInterval, "reportInterval");
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        long periodMs = Math.max(100L, reportInterval.toMillis());
        reportTask = scheduler.scheduleAtFixedRate(this::reportScheduled, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Captures the status and writes the report. Can be called manually;
     * failures are logged.
     */
    public void report() {
        try {
            MapServerStatus status = statusSupplier.get();
            if (status == null) {
                return;
            }
            String yaml = YAML_MAPPER.writeValueAsString(buildReport(status));
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, yaml);
            LOGGER.fine(() -> "Status report written to " + outputPath);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Status report generation failed", e);
        }
    }

    private void reportScheduled() {
        if (!running) {
            return;
        }
        report();
    }

    /**
     * Package-private for testing.
     */
    Map<String, Object> buildReport(MapServerStatus status) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("capturedAt", status.capturedAt().toString());
        root.put("state", status.state());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", status.mapVersion());
        map.put("revision", status.mapRevision());
        List<Map<String, Object>> robots = new ArrayList<>();
        for (RobotTrajectory trajectory : status.robots()) {
            Map<String, Object> robot = new LinkedHashMap<>();
            robot.put("name", trajectory.robotName());
            robot.put("startNs", trajectory.span().startNs());
            robot.put("endNs", trajectory.span().endNs());
            robot.put("submaps", trajectory.submapCount());
            List<String> sensors = new ArrayList<>();
            trajectory.span().sensors().forEach(s -> sensors.add(s.name()));
            sensors.sort(String::compareTo);
            robot.put("sensors", sensors);
            robots.add(robot);
        }
        map.put("robots", robots);
        root.put("map", map);

        Map<String, Object> ingestion = new LinkedHashMap<>();
        ingestion.put("queueDepth", status.queueDepth());
        ingestion.put("backups", status.backupCount());
        root.put("ingestion", ingestion);

        root.put("counters", new TreeMap<>(status.counters()));
        return root;
    }

    /**
     * Returns the report as YAML without touching the filesystem.
     *
     * @return YAML string, or {@code null} if no status is available
     */
    public String toYaml() {
        MapServerStatus status = statusSupplier.get();
        if (status == null) {
            return null;
        }
        try {
            return YAML_MAPPER.writeValueAsString(buildReport(status));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to serialize status to YAML", e);
            return null;
        }
    }

    @Override
    public void close() {
        running = false;
        ScheduledFuture<?> task = reportTask;
        if (task != null) {
            task.cancel(false);
            reportTask = null;
        }
    }
}
