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
 * Answer to a single {@link LookupRequest}. Failed lookups carry zero vectors.
 */
public record LookupResponse(LookupStatus status, Vector3 pointInGlobalFrame, Vector3 sensorOriginInGlobalFrame) {

    public LookupResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(pointInGlobalFrame, "pointInGlobalFrame");
        Objects.requireNonNull(sensorOriginInGlobalFrame, "sensorOriginInGlobalFrame");
    }

    public static LookupResponse success(GlobalFramePoint resolved) {
        return new LookupResponse(LookupStatus.SUCCESS, resolved.pointInGlobalFrame(),
                resolved.sensorOriginInGlobalFrame());
    }

    public static LookupResponse failure(LookupStatus status) {
        if (status == LookupStatus.SUCCESS) {
            throw new IllegalArgumentException("A failed lookup cannot carry SUCCESS");
        }
        return new LookupResponse(status, Vector3.ZERO, Vector3.ZERO);
    }

    public boolean isSuccess() {
        return status == LookupStatus.SUCCESS;
    }

    /** Status as the integer code sent to clients. */
    public int statusCode() {
        return status.code();
    }
}
