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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code server} section of the map server YAML. Every field is optional;
 * missing values fall back to the defaults of {@link MapServerConfig.Builder}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerPolicyConfig {

    @JsonProperty("merged_map_folder")
    private String mergedMapFolder;

    @JsonProperty("backup_folder")
    private String backupFolder;

    @JsonProperty("backup_interval_s")
    private Integer backupIntervalSeconds;

    @JsonProperty("map_update_queue_size")
    private Integer mapUpdateQueueSize;

    @JsonProperty("save_map_on_shutdown")
    private Boolean saveMapOnShutdown;

    @JsonProperty("restore_from_backup")
    private Boolean restoreFromBackup;

    @JsonProperty("worker_poll_interval")
    private String workerPollInterval;

    @JsonProperty("ingestion")
    private IngestionConfig ingestion;

    @JsonProperty("global_pipeline")
    private GlobalPipelineConfig globalPipeline;

    @JsonProperty("status_report")
    private StatusReportConfig statusReport;

    public String getMergedMapFolder() {
        return mergedMapFolder;
    }

    public void setMergedMapFolder(String mergedMapFolder) {
        this.mergedMapFolder = mergedMapFolder;
    }

    public String getBackupFolder() {
        return backupFolder;
    }

    public void setBackupFolder(String backupFolder) {
        this.backupFolder = backupFolder;
    }

    public Integer getBackupIntervalSeconds() {
        return backupIntervalSeconds;
    }

    public void setBackupIntervalSeconds(Integer backupIntervalSeconds) {
        this.backupIntervalSeconds = backupIntervalSeconds;
    }

    public Integer getMapUpdateQueueSize() {
        return mapUpdateQueueSize;
    }

    public void setMapUpdateQueueSize(Integer mapUpdateQueueSize) {
        this.mapUpdateQueueSize = mapUpdateQueueSize;
    }

    public Boolean getSaveMapOnShutdown() {
        return saveMapOnShutdown;
    }

    public void setSaveMapOnShutdown(Boolean saveMapOnShutdown) {
        this.saveMapOnShutdown = saveMapOnShutdown;
    }

    public Boolean getRestoreFromBackup() {
        return restoreFromBackup;
    }

    public void setRestoreFromBackup(Boolean restoreFromBackup) {
        this.restoreFromBackup = restoreFromBackup;
    }

    public String getWorkerPollInterval() {
        return workerPollInterval;
    }

    public void setWorkerPollInterval(String workerPollInterval) {
        this.workerPollInterval = workerPollInterval;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion;
    }

    public GlobalPipelineConfig getGlobalPipeline() {
        return globalPipeline;
    }

    public void setGlobalPipeline(GlobalPipelineConfig globalPipeline) {
        this.globalPipeline = globalPipeline;
    }

    public StatusReportConfig getStatusReport() {
        return statusReport;
    }

    public void setStatusReport(StatusReportConfig statusReport) {
        this.statusReport = statusReport;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        @JsonProperty("capacity")
        private Integer capacity;

        public Integer getCapacity() {
            return capacity;
        }

        public void setCapacity(Integer capacity) {
            this.capacity = capacity;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GlobalPipelineConfig {
        @JsonProperty("every_n_merges")
        private Integer everyNMerges;

        @JsonProperty("interval")
        private String interval;

        public Integer getEveryNMerges() {
            return everyNMerges;
        }

        public void setEveryNMerges(Integer everyNMerges) {
            this.everyNMerges = everyNMerges;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatusReportConfig {
        @JsonProperty("enabled")
        private boolean enabled;

        @JsonProperty("path")
        private String path;

        @JsonProperty("interval")
        private String interval;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }
    }
}
