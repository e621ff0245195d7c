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

package com.dedicatedcode.kerros.engine.manifest;

import com.dedicatedcode.kerros.engine.policy.PolicyKind;
import com.dedicatedcode.kerros.exception.ManifestException;
import com.dedicatedcode.kerros.exception.UnknownPolicyException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses and validates the {@code manifest.json} of an unpacked dataset directory.
 * Either a complete {@link DatasetManifest} is returned or an exception is thrown.
 */
public class ManifestLoader {

    private static final Logger logger = LoggerFactory.getLogger(ManifestLoader.class);

    public static final String MANIFEST_FILE_NAME = "manifest.json";

    private final ObjectMapper objectMapper;

    public ManifestLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse the manifest of the given dataset directory.
     *
     * @param datasetDir checksum-verified, fully unpacked dataset directory
     * @return the validated manifest
     * @throws ManifestException      if the manifest is missing, malformed or inconsistent
     * @throws UnknownPolicyException if a policy name is not part of the catalog
     */
    public DatasetManifest parse(Path datasetDir) {
        if (!Files.isDirectory(datasetDir)) {
            throw new ManifestException(datasetDir, "dataset directory does not exist");
        }
        Path manifestPath = datasetDir.resolve(MANIFEST_FILE_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestException(datasetDir, MANIFEST_FILE_NAME + " is missing");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(manifestPath.toFile());
        } catch (IOException e) {
            throw new ManifestException(datasetDir, MANIFEST_FILE_NAME + " is malformed JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestException(datasetDir, MANIFEST_FILE_NAME + " must be a JSON object");
        }

        String datasetId = requiredText(datasetDir, root, "dataset_id");
        String version = requiredText(datasetDir, root, "dataset_version");
        String checksum = requiredText(datasetDir, root, "checksum");
        RegionSpec region = parseRegion(datasetDir, root.get("region"));
        LocaleSpec locale = parseLocale(datasetDir, root.get("locale"));
        FieldSpec fields = parseFields(datasetDir, root.get("fields"));
        List<LevelSpec> levels = parseLevels(datasetDir, root.get("levels"));
        List<PolicySpec> policies = parsePolicies(datasetDir, root.get("policies"), levels);
        Map<String, String> fileChecksums = parseFileChecksums(datasetDir, root.get("files"));

        logger.debug("Parsed manifest {}@{} with levels {} and {} policies",
                datasetId, version, levels.stream().map(LevelSpec::level).toList(), policies.size());
        return new DatasetManifest(datasetId, version, checksum, region, locale, fields, levels, policies, fileChecksums);
    }

    /**
     * Resolve a file named by the manifest, rejecting absolute paths and paths that leave
     * the dataset directory.
     */
    public static Path resolveDatasetFile(Path datasetDir, String relative) {
        Path rel = Path.of(relative);
        if (rel.isAbsolute()) {
            throw new IllegalArgumentException("'" + relative + "' must be a relative path");
        }
        Path root = datasetDir.toAbsolutePath().normalize();
        Path resolved = root.resolve(rel).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("'" + relative + "' points outside the dataset directory");
        }
        return resolved;
    }

    private RegionSpec parseRegion(Path datasetDir, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ManifestException(datasetDir, "region must be an object");
        }
        String iso2 = requiredText(datasetDir, node, "iso2").toUpperCase(Locale.ROOT);
        JsonNode name = node.get("name");
        String regionName = name != null && name.isTextual() && !name.asText().isBlank() ? name.asText().trim() : iso2;
        return new RegionSpec(iso2, regionName);
    }

    private LocaleSpec parseLocale(Path datasetDir, JsonNode node) {
        if (node == null || node.isNull()) {
            return LocaleSpec.DEFAULTS;
        }
        if (!node.isObject()) {
            throw new ManifestException(datasetDir, "locale must be an object when present");
        }
        String language = optionalText(datasetDir, node, "language", null);

        List<String> fallbacks = new ArrayList<>();
        JsonNode fallbackNode = node.get("name_fallbacks");
        if (fallbackNode != null && !fallbackNode.isNull()) {
            if (!fallbackNode.isArray()) {
                throw new ManifestException(datasetDir, "locale.name_fallbacks must be a list of strings");
            }
            for (JsonNode entry : fallbackNode) {
                if (!entry.isTextual() || entry.asText().isBlank()) {
                    throw new ManifestException(datasetDir, "locale.name_fallbacks entries must be non-empty strings");
                }
                fallbacks.add(entry.asText().trim());
            }
        }

        String orderKey = optionalText(datasetDir, node, "summary_order", SummaryOrder.COARSE_FIRST.key());
        SummaryOrder order = SummaryOrder.fromKey(orderKey)
                .orElseThrow(() -> new ManifestException(datasetDir, "locale.summary_order must be coarse_first or fine_first"));

        JsonNode separatorNode = node.get("summary_separator");
        String separator = LocaleSpec.DEFAULTS.summarySeparator();
        if (separatorNode != null && !separatorNode.isNull()) {
            if (!separatorNode.isTextual()) {
                throw new ManifestException(datasetDir, "locale.summary_separator must be a string");
            }
            // an empty separator is legitimate for scripts written without spaces
            separator = separatorNode.asText();
        }
        return new LocaleSpec(language, fallbacks, order, separator);
    }

    private FieldSpec parseFields(Path datasetDir, JsonNode node) {
        if (node == null || node.isNull()) {
            return FieldSpec.DEFAULTS;
        }
        if (!node.isObject()) {
            throw new ManifestException(datasetDir, "fields must be an object when present");
        }
        return new FieldSpec(
                optionalText(datasetDir, node, "id", FieldSpec.DEFAULTS.id()),
                optionalText(datasetDir, node, "name", FieldSpec.DEFAULTS.name()),
                optionalText(datasetDir, node, "parent", FieldSpec.DEFAULTS.parent()));
    }

    private List<LevelSpec> parseLevels(Path datasetDir, JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ManifestException(datasetDir, "levels must be a non-empty list");
        }
        List<LevelSpec> levels = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Integer previous = null;
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (!entry.isObject()) {
                throw new ManifestException(datasetDir, "levels[" + i + "] must be an object");
            }
            JsonNode levelNode = entry.get("level");
            if (levelNode == null || !levelNode.isInt()) {
                throw new ManifestException(datasetDir, "levels[" + i + "].level must be an integer");
            }
            int level = levelNode.asInt();
            if (!seen.add(level)) {
                throw new ManifestException(datasetDir, "level " + level + " is declared more than once");
            }
            if (previous != null && level <= previous) {
                throw new ManifestException(datasetDir, "levels must be strictly increasing, found " + level + " after " + previous);
            }
            String label = requiredText(datasetDir, entry, "label");
            String geometry = requiredText(datasetDir, entry, "geometry");
            checkReadableFile(datasetDir, geometry, "levels[" + i + "].geometry");

            Integer parentLevel = null;
            JsonNode parentNode = entry.get("parent_level");
            if (parentNode != null && !parentNode.isNull()) {
                if (!parentNode.isInt()) {
                    throw new ManifestException(datasetDir, "levels[" + i + "].parent_level must be an integer");
                }
                parentLevel = parentNode.asInt();
                if (!seen.contains(parentLevel) || parentLevel >= level) {
                    throw new ManifestException(datasetDir,
                            "levels[" + i + "].parent_level " + parentLevel + " must be a declared level coarser than " + level);
                }
            }
            levels.add(new LevelSpec(level, label, geometry, parentLevel));
            previous = level;
        }
        return levels;
    }

    private List<PolicySpec> parsePolicies(Path datasetDir, JsonNode node, List<LevelSpec> levels) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ManifestException(datasetDir, "policies must be a list");
        }
        Set<Integer> levelNumbers = new HashSet<>();
        levels.forEach(l -> levelNumbers.add(l.level()));

        List<PolicySpec> policies = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String name;
            Map<String, Object> params = new LinkedHashMap<>();
            if (entry.isTextual()) {
                name = entry.asText().trim();
            } else if (entry.isObject()) {
                name = requiredText(datasetDir, entry, "name");
                Map<String, Object> raw = objectMapper.convertValue(entry, new TypeReference<>() {});
                raw.remove("name");
                params.putAll(raw);
            } else {
                throw new ManifestException(datasetDir, "policies[" + i + "] must be a string or an object");
            }

            PolicyKind kind = PolicyKind.fromName(name)
                    .orElseThrow(() -> new UnknownPolicyException(datasetDir, name));
            PolicySpec spec = new PolicySpec(kind, params);
            try {
                kind.validate(spec, levelNumbers, datasetDir);
            } catch (IllegalArgumentException e) {
                throw new ManifestException(datasetDir, "policies[" + i + "]: " + e.getMessage(), e);
            }
            policies.add(spec);
        }
        return policies;
    }

    private Map<String, String> parseFileChecksums(Path datasetDir, JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ManifestException(datasetDir, "files must be an object of path -> sha256");
        }
        Map<String, String> checksums = new LinkedHashMap<>();
        var it = node.fields();
        while (it.hasNext()) {
            var field = it.next();
            JsonNode value = field.getValue();
            // accept both {"file": "hex"} and {"file": {"sha256": "hex"}}
            JsonNode sha = value.isObject() ? value.get("sha256") : value;
            if (sha == null || !sha.isTextual() || sha.asText().isBlank()) {
                throw new ManifestException(datasetDir, "files." + field.getKey() + " must carry a sha256 checksum");
            }
            try {
                resolveDatasetFile(datasetDir, field.getKey());
            } catch (IllegalArgumentException e) {
                throw new ManifestException(datasetDir, "files: " + e.getMessage(), e);
            }
            checksums.put(field.getKey(), sha.asText().trim().toLowerCase(Locale.ROOT));
        }
        return checksums;
    }

    private void checkReadableFile(Path datasetDir, String relative, String field) {
        Path file;
        try {
            file = resolveDatasetFile(datasetDir, relative);
        } catch (IllegalArgumentException e) {
            throw new ManifestException(datasetDir, field + ": " + e.getMessage(), e);
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new ManifestException(datasetDir, field + " file '" + relative + "' is missing or unreadable");
        }
    }

    private String requiredText(Path datasetDir, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ManifestException(datasetDir, field + " is required");
        }
        return value.asText().trim();
    }

    private String optionalText(Path datasetDir, JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ManifestException(datasetDir, field + " must be a non-empty string when present");
        }
        return value.asText().trim();
    }
}
