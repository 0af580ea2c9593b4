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

import java.util.Locale;
import java.util.Optional;

/**
 * Sensor kinds a robot can carry. Lookup requests address a sensor frame by its
 * string tag, e.g. {@code "LIDAR"} or {@code "ncamera"}.
 */
public enum SensorType {
    NCAMERA,
    CAMERA,
    IMU,
    LIDAR,
    ODOMETRY_6DOF,
    LOOP_CLOSURE,
    ABSOLUTE_6DOF,
    WHEEL_ODOMETRY,
    POINTCLOUD_MAP,
    GPS_WGS,
    GPS_UTM;

    /**
     * Resolves a sensor tag, ignoring case and surrounding whitespace.
     *
     * @param tag the tag sent by the client
     * @return the sensor type, or {@code empty} for an unrecognized tag
     */
    public static Optional<SensorType> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        for (SensorType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
