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

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-containment structure over the features of a single level: an STR-packed R-tree
 * over the feature envelopes narrows the candidates, the prepared boundaries decide.
 * <p>
 * Read-only after construction; the tree is built eagerly so concurrent queries never
 * trigger a lazy build.
 */
public final class LevelIndex {

    private final STRtree tree;
    private final List<IndexedFeature> features;

    LevelIndex(List<AdminFeature> levelFeatures) {
        List<IndexedFeature> prepared = new ArrayList<>(levelFeatures.size());
        STRtree strTree = new STRtree();
        for (AdminFeature feature : levelFeatures) {
            IndexedFeature indexed = new IndexedFeature(feature, PreparedGeometryFactory.prepare(feature.geometry()));
            // warm up the lazily created point locator before the index is shared
            indexed.covers(feature.centroid());
            strTree.insert(feature.geometry().getEnvelopeInternal(), indexed);
            prepared.add(indexed);
        }
        strTree.build();
        this.tree = strTree;
        this.features = List.copyOf(prepared);
    }

    public List<IndexedFeature> features() {
        return features;
    }

    /**
     * Features whose boundary covers the point, most specific first.
     */
    public List<IndexedFeature> containing(Point point) {
        List<IndexedFeature> hits = new ArrayList<>();
        for (IndexedFeature candidate : query(point.getEnvelopeInternal())) {
            if (candidate.covers(point)) {
                hits.add(candidate);
            }
        }
        hits.sort(IndexedFeature.MOST_SPECIFIC_FIRST);
        return hits;
    }

    /**
     * Features whose envelope intersects the given envelope, in identifier order.
     */
    public List<IndexedFeature> candidates(Envelope envelope) {
        List<IndexedFeature> hits = new ArrayList<>(query(envelope));
        hits.sort(IndexedFeature.BY_ID);
        return hits;
    }

    @SuppressWarnings("unchecked")
    private List<IndexedFeature> query(Envelope envelope) {
        if (features.isEmpty()) {
            return List.of();
        }
        return tree.query(envelope);
    }
}
