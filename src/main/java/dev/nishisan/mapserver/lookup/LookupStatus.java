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

/**
 * Per-item outcome of a map lookup. The numeric code is what goes over the wire.
 */
public enum LookupStatus {
    SUCCESS(0),
    ROBOT_UNKNOWN(1),
    SENSOR_UNKNOWN(2),
    TIMESTAMP_OUT_OF_RANGE(3);

    private final int code;

    LookupStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static LookupStatus fromCode(int code) {
        for (LookupStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown lookup status code: " + code);
    }
}
