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

package com.dedicatedcode.kerros.engine.spatial;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;

import java.util.Map;

/**
 * One administrative boundary of a dataset.
 *
 * @param id       stable identifier, e.g. {@code tw_r1293250}
 * @param level    administrative level the feature belongs to
 * @param name     default display name
 * @param names    all name properties of the feature keyed by property name ({@code name}, {@code name:en}, ...)
 * @param parentId identifier of the feature this one is recorded to nest in, or {@code null}
 * @param geometry polygonal boundary in lon/lat
 * @param area     planar area in square degrees, used to prefer the more specific of overlapping features
 * @param centroid centroid of the boundary
 */
public record AdminFeature(
        String id,
        int level,
        String name,
        Map<String, String> names,
        String parentId,
        Geometry geometry,
        double area,
        Point centroid
) {

    public AdminFeature {
        names = Map.copyOf(names);
    }
}
