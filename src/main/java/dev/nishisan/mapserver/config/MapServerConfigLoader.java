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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the map server YAML and turns it into a {@link MapServerConfig}.
 */
public class MapServerConfigLoader {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private MapServerConfigLoader() {
    }

    public static MapServerYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    /**
     * Reads a YAML file, resolving {@code ${VAR}} and {@code ${VAR:default}}
     * placeholders through {@code envProvider}.
     *
     * @throws IOException if the file is missing, unreadable or not valid YAML
     */
    public static MapServerYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        String processedContent = resolveVariables(content, envProvider);
        MapServerYamlConfig config = mapper.readValue(processedContent, MapServerYamlConfig.class);
        if (config == null) {
            throw new IOException("Configuration file is empty: " + yamlFile);
        }
        return config;
    }

    /**
     * Loads and validates in one step.
     */
    public static MapServerConfig loadConfig(Path yamlFile) throws IOException {
        return convertToDomain(load(yamlFile));
    }

    public static void save(Path yamlFile, MapServerYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = VARIABLE.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            String replacement = getReplacement(matcher.group(1), envProvider);
            builder.append(content, i, matcher.start());
            builder.append(replacement);
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String varName = parts[0];
        String defaultValue = parts.length > 1 ? parts[1] : null;

        String value = envProvider.apply(varName);
        if (value != null) {
            return value;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new IllegalArgumentException(
                "Environment variable or property '" + varName + "' not found and no default value provided.");
    }

    /**
     * Validates the YAML model and builds the immutable domain config.
     *
     * @throws IllegalArgumentException if a required field is missing or a value
     *                                  is out of range
     */
    public static MapServerConfig convertToDomain(MapServerYamlConfig yamlConfig) {
        if (yamlConfig.getSubmapCommands() == null) {
            throw new IllegalArgumentException("submap_commands is missing");
        }
        if (yamlConfig.getGlobalMapCommands() == null) {
            throw new IllegalArgumentException("global_map_commands is missing");
        }

        MapServerConfig.Builder builder = MapServerConfig.builder()
                .submapCommands(trimmed(yamlConfig.getSubmapCommands(), "submap_commands"))
                .globalMapCommands(trimmed(yamlConfig.getGlobalMapCommands(), "global_map_commands"));

        ServerPolicyConfig server = yamlConfig.getServer();
        if (server == null) {
            return builder.build();
        }

        if (server.getMergedMapFolder() != null && !server.getMergedMapFolder().isBlank()) {
            builder.mergedMapFolder(Path.of(server.getMergedMapFolder().trim()));
        }
        if (server.getBackupFolder() != null && !server.getBackupFolder().isBlank()) {
            builder.backupFolder(Path.of(server.getBackupFolder().trim()));
        }
        if (server.getBackupIntervalSeconds() != null) {
            if (server.getBackupIntervalSeconds() < 0) {
                throw new IllegalArgumentException("backup_interval_s must be >= 0");
            }
            builder.backupInterval(Duration.ofSeconds(server.getBackupIntervalSeconds()));
        }
        if (server.getMapUpdateQueueSize() != null) {
            if (server.getMapUpdateQueueSize() <= 0) {
                throw new IllegalArgumentException("map_update_queue_size must be > 0");
            }
            builder.mapUpdateQueueSize(server.getMapUpdateQueueSize());
        }
        if (server.getSaveMapOnShutdown() != null) {
            builder.saveMapOnShutdown(server.getSaveMapOnShutdown());
        }
        if (server.getRestoreFromBackup() != null) {
            builder.restoreFromBackup(server.getRestoreFromBackup());
        }
        Duration pollInterval = parseDuration(server.getWorkerPollInterval());
        if (pollInterval != null) {
            builder.workerPollInterval(pollInterval);
        }

        if (server.getIngestion() != null && server.getIngestion().getCapacity() != null) {
            builder.ingestionCapacity(server.getIngestion().getCapacity());
        }

        ServerPolicyConfig.GlobalPipelineConfig global = server.getGlobalPipeline();
        if (global != null) {
            if (global.getEveryNMerges() != null) {
                builder.globalPipelineEveryNMerges(global.getEveryNMerges());
            }
            Duration interval = parseDuration(global.getInterval());
            if (interval != null) {
                builder.globalPipelineInterval(interval);
            }
        }

        ServerPolicyConfig.StatusReportConfig report = server.getStatusReport();
        if (report != null && report.isEnabled()) {
            if (report.getPath() == null || report.getPath().isBlank()) {
                throw new IllegalArgumentException("status_report.path is required when the report is enabled");
            }
            Duration interval = parseDuration(report.getInterval());
            builder.statusReport(Path.of(report.getPath().trim()),
                    interval != null ? interval : Duration.ofSeconds(30));
        }

        return builder.build();
    }

    private static List<String> trimmed(List<String> names, String listName) {
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Blank command name in " + listName);
            }
            result.add(name.trim());
        }
        return result;
    }

    /**
     * Parses an ISO-8601 duration ({@code PT10M}) or a short form such as
     * {@code 500ms}, {@code 30s}, {@code 10m} or {@code 2h}.
     *
     * @return the duration, or {@code null} for a blank value
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    static Duration parseDuration(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        String value = s.trim().toUpperCase();
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            try {
                if (value.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
                } else if (value.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                } else if (value.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
                }
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid duration: '" + s + "'", nfe);
            }
            throw new IllegalArgumentException("Invalid duration: '" + s + "'", e);
        }
    }
}
