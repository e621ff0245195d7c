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
 * How a hierarchy entry was obtained.
 */
public enum NodeSource {
    POLYGON("polygon"),
    PARENT_LINK("parent_link"),
    NEAREST_CENTROID("nearest_centroid"),
    NEARBY("nearby"),
    ADMIN_TREE("admin_tree_name"),
    SEMANTIC_ANCHOR("semantic_anchor");

    private final String tag;

    NodeSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
