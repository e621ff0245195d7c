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

import com.dedicatedcode.kerros.TestDatasets;
import com.dedicatedcode.kerros.engine.spatial.SpatialIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dedicatedcode.kerros.TestDatasets.box;
import static com.dedicatedcode.kerros.TestDatasets.feature;
import static org.assertj.core.api.Assertions.assertThat;

class HierarchyComposerTest {

    @TempDir
    Path dir;

    private HierarchyComposer composer() throws IOException {
        return new HierarchyComposer(TestDatasets.parseManifest(dir), TestDatasets.buildIndex(dir));
    }

    @Test
    void resolvesEveryLevelCoarsestFirst() throws IOException {
        TestDatasets.taipei(dir);

        DraftHierarchy draft = composer().resolve(SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));

        assertThat(draft.isComplete()).isTrue();
        assertThat(draft.resolved()).containsExactly(
                new DraftNode(4, TestDatasets.TAIPEI, "臺北市", NodeSource.POLYGON, null),
                new DraftNode(7, TestDatasets.XINYI, "信義區", NodeSource.POLYGON, TestDatasets.TAIPEI));
    }

    @Test
    void leavesHoleAndKeepsResolvingFinerLevels() throws IOException {
        TestDatasets.taipei(dir);

        DraftHierarchy draft = composer().resolve(SpatialIndex.point(TestDatasets.GAP_LAT, TestDatasets.GAP_LON));

        assertThat(draft.holes()).containsExactly(7);
        assertThat(draft.node(4)).map(DraftNode::id).contains(TestDatasets.TAIPEI);
    }

    @Test
    void outsideCoverageEveryLevelIsAHole() throws IOException {
        TestDatasets.taipei(dir);

        DraftHierarchy draft = composer().resolve(SpatialIndex.point(0, 0));

        assertThat(draft.resolved()).isEmpty();
        assertThat(draft.holes()).containsExactly(4, 7);
    }

    @Test
    void prefersCandidateLinkedToResolvedParent() throws IOException {
        TestDatasets.taipei(dir);
        List<Map<String, Object>> districts = new ArrayList<>(TestDatasets.districts());
        // smaller than Xinyi, but recorded under New Taipei
        districts.add(feature("tw_stray", "Stray", TestDatasets.NEW_TAIPEI, box(121.56, 25.02, 121.57, 25.04)));
        TestDatasets.writeJson(dir.resolve("level_7.geojson"), TestDatasets.collection(districts));

        DraftHierarchy draft = composer().resolve(SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));

        assertThat(draft.node(7)).map(DraftNode::id).contains(TestDatasets.XINYI);
    }

    @Test
    void fallsBackToMostSpecificCandidateWithoutMatchingLink() throws IOException {
        TestDatasets.taipei(dir);
        List<Map<String, Object>> districts = new ArrayList<>(TestDatasets.districts());
        districts.add(feature("tw_stray", "Stray", null, box(121.56, 25.02, 121.57, 25.04)));
        List<Map<String, Object>> unlinked = new ArrayList<>();
        for (Map<String, Object> district : districts) {
            @SuppressWarnings("unchecked")
            Map<String, Object> properties = new LinkedHashMap<>((Map<String, Object>) district.get("properties"));
            properties.remove("parent_id");
            unlinked.add(Map.of("type", "Feature", "properties", properties, "geometry", district.get("geometry")));
        }
        TestDatasets.writeJson(dir.resolve("level_7.geojson"), TestDatasets.collection(unlinked));

        DraftHierarchy draft = composer().resolve(SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));

        assertThat(draft.node(7)).map(DraftNode::id).contains("tw_stray");
    }

    @Test
    void resolutionIsDeterministic() throws IOException {
        TestDatasets.taipei(dir);
        HierarchyComposer composer = composer();

        DraftHierarchy first = composer.resolve(SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));
        for (int i = 0; i < 20; i++) {
            assertThat(composer.resolve(SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON))).isEqualTo(first);
        }
    }
}
