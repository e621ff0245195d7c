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

package com.dedicatedcode.kerros.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final, ranked answer of a lookup.
 *
 * @param nodes         resolved levels ordered by level, ranks 0..n-1
 * @param missingLevels declared levels that stayed holes, ascending
 * @param metadata      overlay metadata keyed by overlay name in the order the overlays ran, possibly empty
 */
public record HierarchyResult(
        List<HierarchyNode> nodes,
        LookupStatus status,
        List<Integer> missingLevels,
        String regionIso2,
        String regionName,
        String summaryText,
        String datasetId,
        String datasetVersion,
        Map<String, Map<String, Object>> metadata
) {

    public HierarchyResult {
        nodes = List.copyOf(nodes);
        missingLevels = List.copyOf(missingLevels);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
