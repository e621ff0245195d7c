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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fills a hole with the feature of that level whose centroid is closest to the query point,
 * restricted to features whose centroid lies inside the nearest resolved ancestor.
 */
class NearestCentroidFillPolicy implements SupplementationPolicy {

    private final Double maxDistanceKm;
    private final List<Integer> levels;

    NearestCentroidFillPolicy(Double maxDistanceKm, List<Integer> levels) {
        this.maxDistanceKm = maxDistanceKm;
        this.levels = List.copyOf(levels);
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        spec.optionalPositiveNumber("max_distance_km");
        PolicyChecks.declaredLevels(spec, "levels", declared);
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) {
        return new NearestCentroidFillPolicy(spec.optionalPositiveNumber("max_distance_km").orElse(null),
                spec.intList("levels"));
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.NEAREST_CENTROID_FILL;
    }

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        DraftHierarchy current = draft;
        for (int hole : draft.holes()) {
            if (!levels.isEmpty() && !levels.contains(hole)) {
                continue;
            }
            Optional<IndexedFeature> ancestor = current.resolvedAncestor(hole)
                    .flatMap(a -> context.index().feature(a.id()));
            if (ancestor.isEmpty()) {
                continue;
            }
            IndexedFeature within = ancestor.get();
            IndexedFeature best = null;
            double bestDistance = Double.MAX_VALUE;
            for (IndexedFeature candidate : context.index().candidates(hole, within.feature().geometry().getEnvelopeInternal())) {
                AdminFeature feature = candidate.feature();
                if (!within.covers(feature.centroid())) {
                    continue;
                }
                double distance = S2Helper.distanceKm(context.point().getCoordinate(), feature.centroid().getCoordinate());
                if (maxDistanceKm != null && distance > maxDistanceKm) {
                    continue;
                }
                // candidates come in id order, strict comparison keeps the smaller id on ties
                if (distance < bestDistance) {
                    best = candidate;
                    bestDistance = distance;
                }
            }
            if (best != null) {
                AdminFeature feature = best.feature();
                current = ParentLinks.place(current, context.manifest(), new DraftNode(hole, feature.id(), feature.name(),
                        NodeSource.NEAREST_CENTROID, feature.parentId()));
            }
        }
        return current;
    }
}
