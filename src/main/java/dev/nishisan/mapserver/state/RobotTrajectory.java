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

import java.io.Serializable;
import java.util.Objects;

/**
 * What the global map knows about one robot: the time span its merged submaps
 * cover and how many submaps it has contributed.
 */
public record RobotTrajectory(String robotName, TrajectorySpan span, int submapCount) implements Serializable {

    public RobotTrajectory {
        Objects.requireNonNull(robotName, "robotName");
        Objects.requireNonNull(span, "span");
    }

    static RobotTrajectory first(String robotName, TrajectorySpan span) {
        return new RobotTrajectory(robotName, span, 1);
    }

    RobotTrajectory extend(TrajectorySpan more) {
        return new RobotTrajectory(robotName, span.union(more), submapCount + 1);
    }
}
