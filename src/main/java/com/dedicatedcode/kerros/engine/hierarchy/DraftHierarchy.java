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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ordered per-level slots of one lookup. Every declared level has a slot that is either
 * resolved or a hole. Immutable; every change returns a new draft.
 */
public final class DraftHierarchy {

    private final List<Integer> levels;
    private final Map<Integer, DraftNode> nodes;
    private final Map<String, Map<String, Object>> metadata;

    private DraftHierarchy(List<Integer> levels, Map<Integer, DraftNode> nodes, Map<String, Map<String, Object>> metadata) {
        this.levels = levels;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.metadata = Collections.unmodifiableMap(metadata);
    }

    /**
     * A draft where every level is still a hole.
     */
    public static DraftHierarchy empty(List<Integer> levels) {
        return new DraftHierarchy(List.copyOf(levels), new TreeMap<>(), new LinkedHashMap<>());
    }

    public List<Integer> levels() {
        return levels;
    }

    public Optional<DraftNode> node(int level) {
        return Optional.ofNullable(nodes.get(level));
    }

    public boolean isHole(int level) {
        return levels.contains(level) && !nodes.containsKey(level);
    }

    public List<Integer> holes() {
        return levels.stream().filter(l -> !nodes.containsKey(l)).toList();
    }

    /**
     * Resolved nodes, coarsest level first.
     */
    public List<DraftNode> resolved() {
        return new ArrayList<>(nodes.values());
    }

    public boolean isComplete() {
        return nodes.size() == levels.size();
    }

    /**
     * The nearest resolved node coarser than {@code level}.
     */
    public Optional<DraftNode> resolvedAncestor(int level) {
        DraftNode best = null;
        for (DraftNode node : nodes.values()) {
            if (node.level() < level) {
                best = node;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Put {@code node} into its level's slot, replacing whatever was there.
     *
     * @throws IllegalArgumentException if the level is not part of this draft
     */
    public DraftHierarchy with(DraftNode node) {
        if (!levels.contains(node.level())) {
            throw new IllegalArgumentException("Level " + node.level() + " is not declared");
        }
        Map<Integer, DraftNode> copy = new TreeMap<>(nodes);
        copy.put(node.level(), node);
        return new DraftHierarchy(levels, copy, new LinkedHashMap<>(metadata));
    }

    public Map<String, Map<String, Object>> metadata() {
        return metadata;
    }

    public DraftHierarchy withMetadata(String key, Map<String, Object> value) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>(metadata);
        copy.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(value)));
        return new DraftHierarchy(levels, new TreeMap<>(nodes), copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DraftHierarchy that)) return false;
        return levels.equals(that.levels) && nodes.equals(that.nodes) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(levels, nodes, metadata);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DraftHierarchy[");
        for (int i = 0; i < levels.size(); i++) {
            int level = levels.get(i);
            if (i > 0) sb.append(", ");
            DraftNode node = nodes.get(level);
            sb.append(level).append('=').append(node == null ? "<hole>" : node.id());
        }
        return sb.append(']').toString();
    }
}
