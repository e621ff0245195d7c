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

import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.manifest.ManifestLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Load-time access to the dataset for policies that carry their own data files.
 *
 * @param defaultLanguage service-wide display language, used where neither a policy nor the manifest names one
 */
public record PolicyResources(Path datasetDir, DatasetManifest manifest, ObjectMapper objectMapper, String defaultLanguage) {

    public JsonNode readJson(String relative) throws IOException {
        Path file = ManifestLoader.resolveDatasetFile(datasetDir, relative);
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException(relative + " must be a JSON object");
        }
        return root;
    }
}
