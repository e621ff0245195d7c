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
import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;

import java.util.Optional;

/**
 * Keeps the parent links of a draft consistent with its resolved levels when a policy places
 * a node: the node links to the resolved node at its expected parent level, and resolved
 * nodes that expect the placed level as their parent link to it.
 */
final class ParentLinks {

    private ParentLinks() {
    }

    static DraftHierarchy place(DraftHierarchy draft, DatasetManifest manifest, DraftNode node) {
        String parentId = manifest.expectedParentLevel(node.level())
                .flatMap(draft::node)
                .map(DraftNode::id)
                .orElse(node.parentId());
        DraftHierarchy current = draft.with(node.withParentId(parentId));

        for (DraftNode child : current.resolved()) {
            Optional<Integer> expected = manifest.expectedParentLevel(child.level());
            if (expected.isPresent() && expected.get() == node.level() && !node.id().equals(child.parentId())) {
                current = current.with(child.withParentId(node.id()));
            }
        }
        return current;
    }
}
