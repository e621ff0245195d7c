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

/**
 * A resolved level of a draft hierarchy, before ranks are assigned.
 */
public record DraftNode(int level, String id, String name, NodeSource source, String parentId) {

    public DraftNode withName(String newName) {
        return new DraftNode(level, id, newName, source, parentId);
    }

    public DraftNode withParentId(String newParentId) {
        return new DraftNode(level, id, name, source, newParentId);
    }
}
