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

package dev.nishisan.mapserver.stats;

/**
 * Metric keys used by map server components.
 */
public final class MapServerMetrics {
    public static final String SUBMAP_ACCEPTED = "mapserver.submap.accepted";
    public static final String SUBMAP_REJECTED = "mapserver.submap.rejected";
    public static final String SUBMAP_MERGED = "mapserver.submap.merged";
    public static final String SUBMAP_FAILED = "mapserver.submap.failed";
    public static final String SUBMAP_DISCARDED = "mapserver.submap.discarded";
    public static final String SUBMAP_PROCESSING_MS = "mapserver.submap.processing.ms";
    public static final String GLOBAL_PIPELINE_RUN = "mapserver.global.run";
    public static final String GLOBAL_PIPELINE_FAILED = "mapserver.global.failed";
    public static final String GLOBAL_PIPELINE_MS = "mapserver.global.ms";
    public static final String BACKUP_SAVED = "mapserver.backup.saved";
    public static final String BACKUP_FAILED = "mapserver.backup.failed";
    public static final String MAP_SAVED = "mapserver.save.ok";
    public static final String MAP_SAVE_FAILED = "mapserver.save.failed";
    public static final String LOOKUP_REQUESTS = "mapserver.lookup.requests";
    public static final String QUEUE_DEPTH = "mapserver.queue.depth";
    public static final String MAP_VERSION = "mapserver.map.version";

    private static final String LOOKUP_STATUS_PREFIX = "mapserver.lookup.status.";
    private static final String COMMAND_MS_PREFIX = "mapserver.command.ms.";
    private static final String COMMAND_FAILURE_PREFIX = "mapserver.command.fail.";

    private MapServerMetrics() {
    }

    public static String lookupStatus(String status) {
        return LOOKUP_STATUS_PREFIX + status.toLowerCase();
    }

    public static String commandDuration(String pipeline, String command) {
        return COMMAND_MS_PREFIX + pipeline + "." + command;
    }

    public static String commandFailure(String pipeline, String command) {
        return COMMAND_FAILURE_PREFIX + pipeline + "." + command;
    }
}
