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

import dev.nishisan.mapserver.lookup.SensorType;

import java.io.Serializable;
import java.util.EnumSet;
import java.util.Set;

/**
 * Time interval covered by a trajectory, with the sensors that contributed to it.
 * Both bounds are inclusive.
 */
public record TrajectorySpan(long startNs, long endNs, Set<SensorType> sensors) implements Serializable {

    public TrajectorySpan {
        if (endNs < startNs) {
            throw new IllegalArgumentException("endNs (" + endNs + ") must be >= startNs (" + startNs + ")");
        }
        sensors = sensors == null || sensors.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(sensors));
    }

    public boolean covers(long timestampNs) {
        return timestampNs >= startNs && timestampNs <= endNs;
    }

    public boolean hasSensor(SensorType sensor) {
        return sensors.contains(sensor);
    }

    /**
     * Returns the smallest span containing both spans and the union of their sensors.
     */
    public TrajectorySpan union(TrajectorySpan other) {
        Set<SensorType> merged = EnumSet.noneOf(SensorType.class);
        merged.addAll(sensors);
        merged.addAll(other.sensors);
        return new TrajectorySpan(Math.min(startNs, other.startNs), Math.max(endNs, other.endNs), merged);
    }
}
