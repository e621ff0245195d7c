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

package com.dedicatedcode.kerros.engine.policy;

import com.dedicatedcode.kerros.engine.hierarchy.DraftHierarchy;
import com.dedicatedcode.kerros.engine.hierarchy.DraftNode;
import com.dedicatedcode.kerros.engine.hierarchy.NodeSource;
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;
import com.dedicatedcode.kerros.engine.spatial.AdminFeature;
import com.dedicatedcode.kerros.engine.spatial.IndexedFeature;
import com.dedicatedcode.kerros.engine.spatial.S2Helper;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.operation.distance.DistanceOp;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fills a hole with the closest boundary of that level within a fixed radius. Meant for points
 * just off a coastline or in slivers between neighbouring polygons.
 */
class NearbyFillPolicy implements SupplementationPolicy {

    private final double maxDistanceKm;
    private final List<Integer> levels;

    NearbyFillPolicy(double maxDistanceKm, List<Integer> levels) {
        this.maxDistanceKm = maxDistanceKm;
        this.levels = List.copyOf(levels);
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        spec.requiredPositiveNumber("max_distance_km");
        PolicyChecks.declaredLevels(spec, "levels", declared);
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) {
        return new NearbyFillPolicy(spec.requiredPositiveNumber("max_distance_km"), spec.intList("levels"));
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.NEARBY_FILL;
    }

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        Coordinate origin = context.point().getCoordinate();
        List<Envelope> searchArea = S2Helper.searchEnvelopes(origin, maxDistanceKm);

        DraftHierarchy current = draft;
        for (int hole : draft.holes()) {
            if (!levels.isEmpty() && !levels.contains(hole)) {
                continue;
            }
            IndexedFeature best = null;
            double bestDistance = Double.MAX_VALUE;
            for (IndexedFeature candidate : candidates(context, hole, searchArea)) {
                double distance = candidate.covers(context.point()) ? 0.0 : distanceKm(candidate, context);
                if (distance <= maxDistanceKm && distance < bestDistance) {
                    best = candidate;
                    bestDistance = distance;
                }
            }
            if (best != null) {
                AdminFeature feature = best.feature();
                current = ParentLinks.place(current, context.manifest(), new DraftNode(hole, feature.id(), feature.name(),
                        NodeSource.NEARBY, feature.parentId()));
            }
        }
        return current;
    }

    /**
     * Candidates of all search envelopes, each once, in identifier order.
     */
    private static Iterable<IndexedFeature> candidates(PolicyContext context, int level, List<Envelope> searchArea) {
        Map<String, IndexedFeature> byId = new TreeMap<>();
        for (Envelope envelope : searchArea) {
            for (IndexedFeature candidate : context.index().candidates(level, envelope)) {
                byId.putIfAbsent(candidate.id(), candidate);
            }
        }
        return byId.values();
    }

    private static double distanceKm(IndexedFeature candidate, PolicyContext context) {
        Geometry boundary = candidate.feature().geometry();
        Point point = context.point();
        // measure against the copy of the point on the candidate's side of the antimeridian
        double lon = S2Helper.alignLongitude(point.getX(), boundary.getEnvelopeInternal().centre().x);
        if (lon != point.getX()) {
            point = boundary.getFactory().createPoint(new Coordinate(lon, point.getY()));
        }
        Coordinate[] nearest = DistanceOp.nearestPoints(boundary, point);
        return S2Helper.distanceKm(nearest[1], nearest[0]);
    }
}
