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

package dev.nishisan.mapserver.engine;

import java.io.Serializable;

/**
 * Opaque handle to the merged map owned by the mapping engine.
 * <p>
 * Instances published in a {@link dev.nishisan.mapserver.state.MapSnapshot} are
 * never modified again: the server only hands {@link #copy() copies} to merges
 * and pipeline commands.
 */
public interface GlobalMap extends Serializable {

    /**
     * Returns an independent working copy. Changes to the copy must not be
     * visible through this instance.
     */
    GlobalMap copy();
}
