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

package com.dedicatedcode.kerros.engine.hierarchy;

import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.manifest.LevelSpec;
import com.dedicatedcode.kerros.engine.spatial.IndexedFeature;
import com.dedicatedcode.kerros.engine.spatial.SpatialIndex;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves the containing feature of every declared level, coarsest first, into a draft
 * hierarchy. Levels without a containing feature stay holes; resolution of finer levels
 * continues regardless.
 */
public class HierarchyComposer {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyComposer.class);

    private final DatasetManifest manifest;
    private final SpatialIndex index;

    public HierarchyComposer(DatasetManifest manifest, SpatialIndex index) {
        this.manifest = manifest;
        this.index = index;
    }

    public DraftHierarchy resolve(Point point) {
        DraftHierarchy draft = DraftHierarchy.empty(manifest.levelNumbers());
        DraftNode lastResolved = null;

        for (LevelSpec level : manifest.levels()) {
            List<IndexedFeature> candidates = index.query(level.level(), point);
            if (candidates.isEmpty()) {
                logger.debug("Level {} is a hole at {}", level.level(), point);
                continue;
            }

            DraftNode reference = level.declaredParentLevel()
                    .flatMap(draft::node)
                    .orElse(level.parentLevel() == null ? lastResolved : null);
            IndexedFeature chosen = choose(candidates, reference);
            if (candidates.size() > 1) {
                logger.debug("Level {} has {} overlapping candidates at {}, chose {}",
                        level.level(), candidates.size(), point, chosen.id());
            }

            DraftNode node = new DraftNode(level.level(), chosen.id(), chosen.feature().name(),
                    NodeSource.POLYGON, chosen.feature().parentId());
            draft = draft.with(node);
            lastResolved = node;
        }
        return draft;
    }

    /**
     * Prefer the candidate whose parent hint names the reference node, otherwise the most
     * specific candidate. {@code candidates} is already in tie-break order.
     */
    private IndexedFeature choose(List<IndexedFeature> candidates, DraftNode reference) {
        if (reference != null) {
            for (IndexedFeature candidate : candidates) {
                if (reference.id().equals(candidate.feature().parentId())) {
                    return candidate;
                }
            }
        }
        return candidates.get(0);
    }
}
