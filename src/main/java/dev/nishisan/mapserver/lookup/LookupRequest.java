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

package dev.nishisan.mapserver.lookup;

import java.util.Objects;

/**
 * Asks for the global-frame position of a point observed in a robot's sensor
 * frame at a given time.
 *
 * @param robotName          the robot that observed the point
 * @param sensorType         the sensor tag, resolved through {@link SensorType#fromTag(String)}
 * @param timestampNs        observation time in nanoseconds
 * @param pointInSensorFrame the point expressed in the sensor frame
 */
public record LookupRequest(String robotName, String sensorType, long timestampNs, Vector3 pointInSensorFrame) {

    public LookupRequest {
        Objects.requireNonNull(pointInSensorFrame, "pointInSensorFrame");
    }
}
