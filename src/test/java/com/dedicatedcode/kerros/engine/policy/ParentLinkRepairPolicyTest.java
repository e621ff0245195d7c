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

import static org.assertj.core.api.Assertions.assertThat;

class ParentLinkRepairPolicyTest {

    @TempDir
    Path dir;

    private PolicyFixture fixture;
    private final ParentLinkRepairPolicy policy = new ParentLinkRepairPolicy();

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PolicyFixture(dir);
    }

    @Test
    void fillsMissingParentFromStoredLink() {
        DraftHierarchy draft = fixture.draft(PolicyFixture.xinyi());

        DraftHierarchy repaired = policy.apply(draft, fixture.at(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));

        assertThat(repaired.node(4)).contains(new DraftNode(4, TestDatasets.TAIPEI, "臺北市", NodeSource.PARENT_LINK, null));
        assertThat(repaired.node(7)).contains(PolicyFixture.xinyi());
    }

    @Test
    void rewritesLinkThatDisagreesWithResolvedParent() {
        DraftHierarchy draft = fixture.draft(PolicyFixture.newTaipei(), PolicyFixture.xinyi());

        DraftHierarchy repaired = policy.apply(draft, fixture.at(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON));

        assertThat(repaired.node(4)).contains(PolicyFixture.newTaipei());
        assertThat(repaired.node(7)).map(DraftNode::id).contains(TestDatasets.XINYI);
        assertThat(repaired.node(7)).map(DraftNode::parentId).contains(TestDatasets.NEW_TAIPEI);
    }

    @Test
    void ignoresLinksToUnknownOrWrongLevelFeatures() {
        DraftNode dangling = new DraftNode(7, TestDatasets.XINYI, "信義區", NodeSource.POLYGON, "tw_gone");
        DraftNode sideways = new DraftNode(7, TestDatasets.XINYI, "信義區", NodeSource.POLYGON, TestDatasets.DAAN);

        assertThat(policy.apply(fixture.draft(dangling), fixture.at(0, 0)).holes()).containsExactly(4);
        assertThat(policy.apply(fixture.draft(sideways), fixture.at(0, 0)).holes()).containsExactly(4);
    }

    @Test
    void isIdempotent() {
        PolicyContext context = fixture.at(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON);
        DraftHierarchy once = policy.apply(fixture.draft(PolicyFixture.newTaipei(), PolicyFixture.xinyi()), context);

        assertThat(policy.apply(once, context)).isEqualTo(once);
    }
}
