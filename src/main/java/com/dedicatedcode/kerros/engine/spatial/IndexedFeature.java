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

import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;

import java.util.Comparator;

/**
 * A feature together with its prepared boundary for repeated containment tests.
 */
public record IndexedFeature(AdminFeature feature, PreparedGeometry boundary) {

    /**
     * Overlap tie-break: the smaller (more specific) polygon first, then identifier order.
     */
    public static final Comparator<IndexedFeature> MOST_SPECIFIC_FIRST = Comparator
            .comparingDouble((IndexedFeature f) -> f.feature().area())
            .thenComparing(f -> f.feature().id());

    public static final Comparator<IndexedFeature> BY_ID = Comparator.comparing(f -> f.feature().id());

    /**
     * Boundary-inclusive containment.
     */
    public boolean covers(Point point) {
        return boundary.covers(point);
    }

    public String id() {
        return feature.id();
    }
}
