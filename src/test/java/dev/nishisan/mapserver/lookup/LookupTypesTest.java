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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LookupTypesTest {

    @Test
    void sensorTagsResolveIgnoringCase() {
        assertEquals(Optional.of(SensorType.LIDAR), SensorType.fromTag(" lidar "));
        assertEquals(Optional.of(SensorType.GPS_UTM), SensorType.fromTag("Gps_Utm"));
        assertTrue(SensorType.fromTag("SONAR").isEmpty());
        assertTrue(SensorType.fromTag("").isEmpty());
        assertTrue(SensorType.fromTag(null).isEmpty());
    }

    @Test
    void statusCodesAreStable() {
        assertEquals(0, LookupStatus.SUCCESS.code());
        assertEquals(1, LookupStatus.ROBOT_UNKNOWN.code());
        assertEquals(2, LookupStatus.SENSOR_UNKNOWN.code());
        assertEquals(3, LookupStatus.TIMESTAMP_OUT_OF_RANGE.code());
        assertEquals(LookupStatus.SENSOR_UNKNOWN, LookupStatus.fromCode(2));
        assertThrows(IllegalArgumentException.class, () -> LookupStatus.fromCode(9));
    }

    @Test
    void failureResponseCarriesZeroVectors() {
        LookupResponse response = LookupResponse.failure(LookupStatus.TIMESTAMP_OUT_OF_RANGE);

        assertFalse(response.isSuccess());
        assertEquals(3, response.statusCode());
        assertEquals(Vector3.ZERO, response.pointInGlobalFrame());
        assertEquals(Vector3.ZERO, response.sensorOriginInGlobalFrame());
    }

    @Test
    void vectorArithmetic() {
        Vector3 a = Vector3.of(1, 2, 3);
        Vector3 b = Vector3.of(4, 6, 3);

        assertEquals(Vector3.of(5, 8, 6), a.plus(b));
        assertEquals(Vector3.of(3, 4, 0), b.minus(a));
        assertEquals(5.0, a.distanceTo(b), 1e-9);
    }
}
