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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated declaration of a dataset: its identity, levels, supplementation chain and
 * display settings. Instances only come out of {@link ManifestLoader} and are immutable.
 */
public record DatasetManifest(
        String datasetId,
        String version,
        String checksum,
        RegionSpec region,
        LocaleSpec locale,
        FieldSpec fields,
        List<LevelSpec> levels,
        List<PolicySpec> policies,
        Map<String, String> fileChecksums
) {

    public DatasetManifest {
        levels = List.copyOf(levels);
        policies = List.copyOf(policies);
        fileChecksums = Map.copyOf(fileChecksums);
    }

    public List<Integer> levelNumbers() {
        return levels.stream().map(LevelSpec::level).toList();
    }

    public Optional<LevelSpec> level(int level) {
        return levels.stream().filter(l -> l.level() == level).findFirst();
    }

    /**
     * The level a feature of {@code level} is expected to nest in: the declared parent level,
     * or otherwise the next coarser declared level. Empty for the root level.
     */
    public Optional<Integer> expectedParentLevel(int level) {
        Integer previous = null;
        for (LevelSpec spec : levels) {
            if (spec.level() == level) {
                if (spec.parentLevel() != null) {
                    return Optional.of(spec.parentLevel());
                }
                return Optional.ofNullable(previous);
            }
            previous = spec.level();
        }
        return Optional.empty();
    }
}
