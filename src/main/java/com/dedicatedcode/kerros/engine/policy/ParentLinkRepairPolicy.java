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
import com.dedicatedcode.kerros.engine.spatial.AdminFeature;
import com.dedicatedcode.kerros.engine.spatial.IndexedFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Uses the parent links stored on features. A hole directly above a resolved node is filled
 * with the feature the node links to, and a link that disagrees with the parent the composer
 * picked is rewritten to that parent.
 */
class ParentLinkRepairPolicy implements SupplementationPolicy {

    private static final Logger logger = LoggerFactory.getLogger(ParentLinkRepairPolicy.class);

    @Override
    public PolicyKind kind() {
        return PolicyKind.PARENT_LINK_REPAIR;
    }

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        // finest first, so a filled parent can in turn fill its own parent
        List<Integer> levels = new ArrayList<>(draft.levels());
        Collections.reverse(levels);

        DraftHierarchy current = draft;
        for (int level : levels) {
            Optional<DraftNode> child = current.node(level);
            Optional<Integer> parentLevel = context.manifest().expectedParentLevel(level);
            if (child.isEmpty() || parentLevel.isEmpty()) {
                continue;
            }
            DraftNode node = child.get();
            Optional<DraftNode> parent = current.node(parentLevel.get());
            if (parent.isPresent()) {
                String parentId = parent.get().id();
                if (!parentId.equals(node.parentId())) {
                    logger.debug("Relinking {} from {} to {}", node.id(), node.parentId(), parentId);
                    current = current.with(node.withParentId(parentId));
                }
                continue;
            }
            if (node.parentId() == null) {
                continue;
            }
            Optional<AdminFeature> linked = context.index().feature(node.parentId())
                    .map(IndexedFeature::feature)
                    .filter(f -> f.level() == parentLevel.get());
            if (linked.isPresent()) {
                AdminFeature feature = linked.get();
                current = ParentLinks.place(current, context.manifest(), new DraftNode(feature.level(), feature.id(),
                        feature.name(), NodeSource.PARENT_LINK, feature.parentId()));
            }
        }
        return current;
    }
}
