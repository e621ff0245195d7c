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

import com.dedicatedcode.kerros.engine.manifest.ManifestLoader;
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class PolicyChecks {

    private PolicyChecks() {
    }

    static void declaredLevels(PolicySpec spec, String key, Set<Integer> levels) {
        for (int level : spec.intList(key)) {
            if (!levels.contains(level)) {
                throw new IllegalArgumentException(spec.name() + "." + key + " contains undeclared level " + level);
            }
        }
    }

    static void readableFile(PolicySpec spec, String key, Path datasetDir) {
        String relative = spec.requiredString(key);
        Path file = ManifestLoader.resolveDatasetFile(datasetDir, relative);
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IllegalArgumentException(spec.name() + "." + key + " file '" + relative + "' is missing or unreadable");
        }
    }

    /**
     * Validates the {@code parent_level}/{@code child_levels} pair of the lookup-table fills.
     */
    static void parentAndChildLevels(PolicySpec spec, Set<Integer> levels) {
        int parent = spec.requiredInt("parent_level");
        if (!levels.contains(parent)) {
            throw new IllegalArgumentException(spec.name() + ".parent_level " + parent + " is not declared");
        }
        List<Integer> children = spec.intList("child_levels");
        if (children.isEmpty()) {
            throw new IllegalArgumentException(spec.name() + ".child_levels must be a non-empty list");
        }
        declaredLevels(spec, "child_levels", levels);
        for (int child : children) {
            if (child <= parent) {
                throw new IllegalArgumentException(spec.name() + ".child_levels must be finer than parent_level " + parent);
            }
        }
    }
}
