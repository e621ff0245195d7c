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

import com.dedicatedcode.kerros.TestDatasets;
import com.dedicatedcode.kerros.engine.hierarchy.DraftHierarchy;
import com.dedicatedcode.kerros.engine.hierarchy.DraftNode;
import com.dedicatedcode.kerros.engine.hierarchy.NodeSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NearestCentroidFillPolicyTest {

    @TempDir
    Path dir;

    private PolicyFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PolicyFixture(dir);
    }

    @Test
    void fillsHoleWithClosestCentroidInsideAncestor() {
        NearestCentroidFillPolicy policy = new NearestCentroidFillPolicy(null, List.of());
        DraftHierarchy draft = fixture.draft(PolicyFixture.taipei());

        DraftHierarchy filled = policy.apply(draft, fixture.at(TestDatasets.GAP_LAT, TestDatasets.GAP_LON));

        assertThat(filled.node(7)).contains(
                new DraftNode(7, TestDatasets.XINYI, "信義區", NodeSource.NEAREST_CENTROID, TestDatasets.TAIPEI));
    }

    @Test
    void onlyConsidersCentroidsInsideTheAncestor() {
        NearestCentroidFillPolicy policy = new NearestCentroidFillPolicy(null, List.of());
        DraftHierarchy draft = fixture.draft(PolicyFixture.newTaipei());

        // Da'an's centroid is closer, but it lies outside New Taipei
        DraftHierarchy filled = policy.apply(draft, fixture.at(25.29, 121.449));

        assertThat(filled.node(7)).map(DraftNode::id).contains(TestDatasets.BANQIAO);
    }

    @Test
    void respectsMaximumDistance() {
        NearestCentroidFillPolicy policy = new NearestCentroidFillPolicy(1.0, List.of());

        DraftHierarchy filled = policy.apply(fixture.draft(PolicyFixture.taipei()), fixture.at(TestDatasets.GAP_LAT, TestDatasets.GAP_LON));

        assertThat(filled.holes()).containsExactly(7);
    }

    @Test
    void needsAResolvedAncestor() {
        NearestCentroidFillPolicy policy = new NearestCentroidFillPolicy(null, List.of());

        DraftHierarchy filled = policy.apply(fixture.draft(), fixture.at(TestDatasets.GAP_LAT, TestDatasets.GAP_LON));

        assertThat(filled.resolved()).isEmpty();
    }

    @Test
    void skipsLevelsOutsideItsScope() throws IOException {
        SupplementationPolicy policy = fixture.create(PolicyKind.NEAREST_CENTROID_FILL, Map.of("levels", List.of(4)));

        DraftHierarchy filled = policy.apply(fixture.draft(PolicyFixture.taipei()), fixture.at(TestDatasets.GAP_LAT, TestDatasets.GAP_LON));

        assertThat(filled.holes()).containsExactly(7);
    }
}
