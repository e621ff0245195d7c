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

import com.dedicatedcode.kerros.engine.hierarchy.DraftNode;
import com.dedicatedcode.kerros.engine.hierarchy.NodeSource;
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills the parent level from the dataset's administrative tree. The tree lists nodes with
 * their parent ids; a resolved child is matched by id first and by name second.
 */
class AdminTreeFillPolicy extends ChildMappedFillPolicy {

    private record TreeNode(String id, int level, String name, String parentId) {
    }

    private final Map<String, TreeNode> byId;
    private final Map<String, TreeNode> byName;

    AdminTreeFillPolicy(int parentLevel, List<Integer> childLevels, List<TreeNode> nodes) {
        super(parentLevel, childLevels);
        this.byId = new HashMap<>();
        this.byName = new HashMap<>();
        for (TreeNode node : nodes) {
            byId.put(node.id(), node);
        }
        for (TreeNode node : nodes) {
            if (childLevels().contains(node.level())) {
                // first entry wins for ambiguous names
                byName.putIfAbsent(node.name(), node);
            }
        }
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        PolicyChecks.readableFile(spec, "file", datasetDir);
        PolicyChecks.parentAndChildLevels(spec, declared);
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) throws IOException {
        String file = spec.requiredString("file");
        JsonNode root = resources.readJson(file);
        JsonNode nodes = root.path("nodes");
        if (!nodes.isArray()) {
            throw new IllegalArgumentException(file + ": 'nodes' must be an array");
        }
        List<TreeNode> parsed = new ArrayList<>();
        for (JsonNode node : nodes) {
            String id = node.path("id").asText(null);
            String name = node.path("name").asText(null);
            if (id == null || id.isBlank() || name == null || name.isBlank() || !node.path("level").canConvertToInt()) {
                throw new IllegalArgumentException(file + ": tree nodes need id, level and name, got " + node);
            }
            JsonNode parent = node.path("parent_id");
            parsed.add(new TreeNode(id, node.path("level").asInt(), name.trim(),
                    parent.isTextual() ? parent.asText() : null));
        }
        return new AdminTreeFillPolicy(spec.requiredInt("parent_level"), spec.intList("child_levels"), parsed);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.ADMIN_TREE_FILL;
    }

    @Override
    protected Optional<DraftNode> parentFor(DraftNode child, int parentLevel) {
        TreeNode entry = byId.get(child.id());
        if (entry == null || entry.level() != child.level()) {
            entry = byName.get(child.name());
        }
        if (entry == null || entry.parentId() == null) {
            return Optional.empty();
        }
        TreeNode parent = byId.get(entry.parentId());
        if (parent == null || parent.level() != parentLevel) {
            return Optional.empty();
        }
        return Optional.of(new DraftNode(parentLevel, parent.id(), parent.name(), NodeSource.ADMIN_TREE, parent.parentId()));
    }
}
