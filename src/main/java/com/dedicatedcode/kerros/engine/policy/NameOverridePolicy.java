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
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Applies a semantic overlay: display names replaced by feature id, plus free-form metadata
 * attached to every result under the overlay's name. The overlay only touches names and
 * metadata.
 */
class NameOverridePolicy implements SupplementationPolicy {

    private static final Set<String> ALLOWED_KEYS = Set.of("overlay_name", "name_overrides_by_id", "result_metadata");

    private final String overlayName;
    private final Map<String, String> overrides;
    private final Map<String, Object> metadata;

    NameOverridePolicy(String overlayName, Map<String, String> overrides, Map<String, Object> metadata) {
        this.overlayName = overlayName;
        this.overrides = Map.copyOf(overrides);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        PolicyChecks.readableFile(spec, "file", datasetDir);
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) throws IOException {
        String file = spec.requiredString("file");
        JsonNode root = resources.readJson(file);
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!ALLOWED_KEYS.contains(key)) {
                throw new IllegalArgumentException(file + ": unsupported overlay key '" + key + "'");
            }
        }

        Map<String, String> overrides = new HashMap<>();
        JsonNode byId = root.path("name_overrides_by_id");
        if (!byId.isMissingNode()) {
            if (!byId.isObject()) {
                throw new IllegalArgumentException(file + ": 'name_overrides_by_id' must be an object");
            }
            byId.fields().forEachRemaining(e -> {
                if (!e.getValue().isTextual() || e.getValue().asText().isBlank()) {
                    throw new IllegalArgumentException(file + ": override for '" + e.getKey() + "' must be a non-empty string");
                }
                overrides.put(e.getKey(), e.getValue().asText().trim());
            });
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode meta = root.path("result_metadata");
        if (!meta.isMissingNode()) {
            if (!meta.isObject()) {
                throw new IllegalArgumentException(file + ": 'result_metadata' must be an object");
            }
            metadata = resources.objectMapper().convertValue(meta, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        }

        if (overrides.isEmpty() && metadata.isEmpty()) {
            throw new IllegalArgumentException(file + ": overlay defines neither name overrides nor result metadata");
        }
        String overlayName = spec.optionalString("overlay_name")
                .orElseGet(() -> root.path("overlay_name").asText(stem(file)));
        return new NameOverridePolicy(overlayName, overrides, metadata);
    }

    private static String stem(String file) {
        String name = Path.of(file).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.NAME_OVERRIDE;
    }

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        DraftHierarchy current = draft;
        for (DraftNode node : draft.resolved()) {
            String name = overrides.get(node.id());
            if (name != null && !name.equals(node.name())) {
                current = current.with(node.withName(name));
            }
        }
        if (!metadata.isEmpty() && !metadata.equals(current.metadata().get(overlayName))) {
            current = current.withMetadata(overlayName, metadata);
        }
        return current;
    }
}
