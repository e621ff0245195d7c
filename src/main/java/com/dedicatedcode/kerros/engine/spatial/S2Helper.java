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

import com.google.common.geometry.S2LatLng;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Great-circle helpers on top of S2 for the distance based supplementation steps.
 */
public final class S2Helper {

    public static final double EARTH_RADIUS_KM = 6371.01;
    private static final double KM_PER_DEGREE = 111.0;

    private S2Helper() {
    }

    /**
     * Great-circle distance between two lat/lon pairs in kilometers.
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        S2LatLng a = S2LatLng.fromDegrees(lat1, lon1);
        S2LatLng b = S2LatLng.fromDegrees(lat2, lon2);
        return a.getDistance(b).radians() * EARTH_RADIUS_KM;
    }

    /**
     * Distance between two JTS coordinates. Note: JTS uses (x=lon, y=lat), S2 (lat, lon).
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        return distanceKm(a.y, a.x, b.y, b.x);
    }

    /**
     * Envelopes around a coordinate that together contain every point within {@code radiusKm}.
     * Longitude span widens towards the poles. A search area crossing the antimeridian is
     * split into one envelope on each side, all within [-180, 180].
     */
    public static List<Envelope> searchEnvelopes(Coordinate center, double radiusKm) {
        double latSpan = radiusKm / KM_PER_DEGREE;
        double cos = Math.cos(Math.toRadians(Math.min(89.0, Math.abs(center.y) + latSpan)));
        double lonSpan = Math.min(180.0, latSpan / Math.max(cos, 1e-6));
        double minY = center.y - latSpan;
        double maxY = center.y + latSpan;
        double minX = center.x - lonSpan;
        double maxX = center.x + lonSpan;

        List<Envelope> envelopes = new ArrayList<>(2);
        envelopes.add(new Envelope(Math.max(-180.0, minX), Math.min(180.0, maxX), minY, maxY));
        if (minX < -180.0) {
            envelopes.add(new Envelope(minX + 360.0, 180.0, minY, maxY));
        }
        if (maxX > 180.0) {
            envelopes.add(new Envelope(-180.0, maxX - 360.0, minY, maxY));
        }
        return envelopes;
    }

    /**
     * Longitude of {@code lon} moved by whole turns so it lies within 180 degrees of {@code reference}.
     */
    public static double alignLongitude(double lon, double reference) {
        if (lon - reference > 180.0) {
            return lon - 360.0;
        }
        if (reference - lon > 180.0) {
            return lon + 360.0;
        }
        return lon;
    }
}
