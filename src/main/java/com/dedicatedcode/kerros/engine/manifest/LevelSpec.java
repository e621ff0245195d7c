/*
 *  This file is part of kerros.
 *
 *  Kerros is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Kerros is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Kerros. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.kerros.engine.manifest;

import java.util.Optional;

/**
 * One administrative level declared by a dataset.
 *
 * @param level       administrative level number, e.g. 4 for a city
 * @param label       human readable label of the level
 * @param geometry    geometry file of the level, relative to the dataset directory
 * @param parentLevel level the features of this level are expected to nest in, or {@code null}
 */
public record LevelSpec(int level, String label, String geometry, Integer parentLevel) {

    public Optional<Integer> declaredParentLevel() {
        return Optional.ofNullable(parentLevel);
    }
}
