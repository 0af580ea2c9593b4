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

import dev.nishisan.mapserver.queue.SubmapJob;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * History entry for a submap that made it into the global map.
 *
 * @param sequence  the job sequence assigned at intake
 * @param robotName the contributing robot
 * @param mapPath   the submap folder, as a string so the record stays serializable
 * @param span      the trajectory span the submap added
 * @param mergedAt  when the merge was published
 */
public record MergedSubmap(long sequence, String robotName, String mapPath, TrajectorySpan span, Instant mergedAt)
        implements Serializable {

    public MergedSubmap {
        Objects.requireNonNull(robotName, "robotName");
        Objects.requireNonNull(mapPath, "mapPath");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(mergedAt, "mergedAt");
    }

    public static MergedSubmap of(SubmapJob job, TrajectorySpan span) {
        return new MergedSubmap(job.sequence(), job.robotName(), job.mapPath().toString(), span, Instant.now());
    }
}
