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

package com.dedicatedcode.kerros.engine;

import com.dedicatedcode.kerros.engine.hierarchy.NodeSource;

/**
 * One level of a lookup result.
 *
 * @param rank     position in the result, coarsest level first, starting at 0
 * @param parentId id of the resolved ancestor this node links to, may be {@code null}
 */
public record HierarchyNode(int level, String name, String id, int rank, NodeSource source, String parentId) {
}
