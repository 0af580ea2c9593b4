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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable summary written next to every saved map ({@code map-meta.yaml}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MapMetadata {

    @JsonProperty("format_version")
    private int formatVersion;

    @JsonProperty("version")
    private long version;

    @JsonProperty("revision")
    private long revision;

    @JsonProperty("saved_at")
    private String savedAt;

    @JsonProperty("merged_submaps")
    private int mergedSubmaps;

    @JsonProperty("robots")
    private List<RobotEntry> robots = new ArrayList<>();

    static MapMetadata of(MapSnapshot snapshot, int formatVersion, String savedAt) {
        MapMetadata meta = new MapMetadata();
        meta.formatVersion = formatVersion;
        meta.version = snapshot.version();
        meta.revision = snapshot.revision();
        meta.savedAt = savedAt;
        meta.mergedSubmaps = snapshot.history().size();
        snapshot.trajectories().values().forEach(t -> {
            RobotEntry entry = new RobotEntry();
            entry.setName(t.robotName());
            entry.setStartNs(t.span().startNs());
            entry.setEndNs(t.span().endNs());
            entry.setSubmaps(t.submapCount());
            List<String> sensors = new ArrayList<>();
            t.span().sensors().forEach(s -> sensors.add(s.name()));
            sensors.sort(String::compareTo);
            entry.setSensors(sensors);
            meta.robots.add(entry);
        });
        return meta;
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public void setFormatVersion(int formatVersion) {
        this.formatVersion = formatVersion;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public String getSavedAt() {
        return savedAt;
    }

    public void setSavedAt(String savedAt) {
        this.savedAt = savedAt;
    }

    public int getMergedSubmaps() {
        return mergedSubmaps;
    }

    public void setMergedSubmaps(int mergedSubmaps) {
        this.mergedSubmaps = mergedSubmaps;
    }

    public List<RobotEntry> getRobots() {
        return robots;
    }

    public void setRobots(List<RobotEntry> robots) {
        this.robots = robots;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RobotEntry {
        private String name;
        @JsonProperty("start_ns")
        private long startNs;
        @JsonProperty("end_ns")
        private long endNs;
        private int submaps;
        private List<String> sensors = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public long getStartNs() {
            return startNs;
        }

        public void setStartNs(long startNs) {
            this.startNs = startNs;
        }

        public long getEndNs() {
            return endNs;
        }

        public void setEndNs(long endNs) {
            this.endNs = endNs;
        }

        public int getSubmaps() {
            return submaps;
        }

        public void setSubmaps(int submaps) {
            this.submaps = submaps;
        }

        public List<String> getSensors() {
            return sensors;
        }

        public void setSensors(List<String> sensors) {
            this.sensors = sensors;
        }
    }
}
