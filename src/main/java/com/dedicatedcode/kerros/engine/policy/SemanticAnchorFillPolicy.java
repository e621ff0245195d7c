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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills the parent level from a hand-curated anchor table mapping child names to a parent.
 * <pre>
 * {
 *   "anchors":   { "Xinyi District": { "id": "tw_r1293250", "name": "Taipei" },
 *                  "Da'an District": "tw_r1293250" },
 *   "canonical": { "tw_r1293250": "Taipei" }
 * }
 * </pre>
 * A bare id takes its name from {@code canonical}.
 */
class SemanticAnchorFillPolicy extends ChildMappedFillPolicy {

    private record Anchor(String id, String name) {
    }

    private final Map<String, Anchor> anchors;

    SemanticAnchorFillPolicy(int parentLevel, List<Integer> childLevels, Map<String, Anchor> anchors) {
        super(parentLevel, childLevels);
        this.anchors = Map.copyOf(anchors);
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        PolicyChecks.readableFile(spec, "file", datasetDir);
        PolicyChecks.parentAndChildLevels(spec, declared);
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) throws IOException {
        String file = spec.requiredString("file");
        JsonNode root = resources.readJson(file);
        JsonNode anchorsNode = root.path("anchors");
        if (!anchorsNode.isObject()) {
            throw new IllegalArgumentException(file + ": 'anchors' must be an object");
        }
        JsonNode canonical = root.path("canonical");

        Map<String, Anchor> anchors = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = anchorsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            String id;
            String name;
            if (value.isTextual()) {
                id = value.asText();
                name = canonical.path(id).asText(null);
            } else if (value.isObject()) {
                id = value.path("id").asText(null);
                name = value.hasNonNull("name") ? value.path("name").asText() : canonical.path(String.valueOf(id)).asText(null);
            } else {
                throw new IllegalArgumentException(file + ": anchor '" + entry.getKey() + "' must be an id or an object");
            }
            if (id == null || id.isBlank() || name == null || name.isBlank()) {
                throw new IllegalArgumentException(file + ": anchor '" + entry.getKey() + "' has no id or no resolvable name");
            }
            anchors.put(entry.getKey().trim(), new Anchor(id, name.trim()));
        }
        return new SemanticAnchorFillPolicy(spec.requiredInt("parent_level"), spec.intList("child_levels"), anchors);
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.SEMANTIC_ANCHOR_FILL;
    }

    @Override
    protected Optional<DraftNode> parentFor(DraftNode child, int parentLevel) {
        return Optional.ofNullable(anchors.get(child.name()))
                .map(a -> new DraftNode(parentLevel, a.id(), a.name(), NodeSource.SEMANTIC_ANCHOR, null));
    }
}
