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

import java.util.List;
import java.util.Optional;

/**
 * Base of the fills that derive a missing parent from a lookup table keyed by a resolved
 * child. The first resolved child level, in ascending order, that maps to a parent wins.
 */
abstract class ChildMappedFillPolicy implements SupplementationPolicy {

    private final int parentLevel;
    private final List<Integer> childLevels;

    protected ChildMappedFillPolicy(int parentLevel, List<Integer> childLevels) {
        this.parentLevel = parentLevel;
        this.childLevels = childLevels.stream().sorted().toList();
    }

    /**
     * @return the node to place at the parent level for this child, if the table knows one
     */
    protected abstract Optional<DraftNode> parentFor(DraftNode child, int parentLevel);

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        if (!draft.levels().contains(parentLevel) || !draft.isHole(parentLevel)) {
            return draft;
        }
        for (int childLevel : childLevels) {
            Optional<DraftNode> parent = draft.node(childLevel).flatMap(child -> parentFor(child, parentLevel));
            if (parent.isPresent()) {
                return ParentLinks.place(draft, context.manifest(), parent.get());
            }
        }
        return draft;
    }

    int parentLevel() {
        return parentLevel;
    }

    List<Integer> childLevels() {
        return childLevels;
    }
}
