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

package dev.nishisan.mapserver.queue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A validated submap waiting to be processed.
 *
 * @param sequence    intake order, strictly increasing per server
 * @param robotName   the robot that produced the submap
 * @param mapPath     normalized absolute path of the submap folder
 * @param enqueueTime when the job was accepted
 */
public record SubmapJob(long sequence, String robotName, Path mapPath, Instant enqueueTime) {

    public SubmapJob {
        Objects.requireNonNull(robotName, "robotName");
        Objects.requireNonNull(mapPath, "mapPath");
        Objects.requireNonNull(enqueueTime, "enqueueTime");
    }

    public static SubmapJob of(long sequence, String robotName, Path mapPath) {
        return new SubmapJob(sequence, robotName, mapPath, Instant.now());
    }
}
