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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameOverridePolicyTest {

    @TempDir
    Path dir;

    private PolicyFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new PolicyFixture(dir);
    }

    private SupplementationPolicy policy(Object overlay) throws IOException {
        TestDatasets.writeJson(dir.resolve("overrides.json"), overlay);
        return fixture.create(PolicyKind.NAME_OVERRIDE, Map.of("file", "overrides.json"));
    }

    @Test
    void replacesNamesAndAttachesMetadata() throws IOException {
        SupplementationPolicy policy = policy(Map.of(
                "name_overrides_by_id", Map.of(TestDatasets.XINYI, "Xinyi"),
                "result_metadata", Map.of("curated", true, "note", "tw overlay")));

        DraftHierarchy draft = policy.apply(fixture.draft(PolicyFixture.taipei(), PolicyFixture.xinyi()), fixture.at(0, 0));

        assertThat(draft.node(7)).map(DraftNode::name).contains("Xinyi");
        assertThat(draft.node(7)).map(DraftNode::id).contains(TestDatasets.XINYI);
        assertThat(draft.node(4)).contains(PolicyFixture.taipei());
        assertThat(draft.metadata()).containsOnlyKeys("overrides");
        assertThat(draft.metadata().get("overrides")).containsEntry("curated", true).containsEntry("note", "tw overlay");
    }

    @Test
    void overlayNameCanBeSetInTheFile() throws IOException {
        SupplementationPolicy policy = policy(Map.of("overlay_name", "tw_semantics", "result_metadata", Map.of("v", 2)));

        DraftHierarchy draft = policy.apply(fixture.draft(), fixture.at(0, 0));

        assertThat(draft.metadata()).containsOnlyKeys("tw_semantics");
    }

    @Test
    void neverFillsHoles() throws IOException {
        SupplementationPolicy policy = policy(Map.of("name_overrides_by_id", Map.of(TestDatasets.TAIPEI, "Taipei")));

        DraftHierarchy draft = policy.apply(fixture.draft(PolicyFixture.xinyi()), fixture.at(0, 0));

        assertThat(draft.holes()).containsExactly(4);
    }

    @Test
    void isIdempotent() throws IOException {
        SupplementationPolicy policy = policy(Map.of(
                "name_overrides_by_id", Map.of(TestDatasets.XINYI, "Xinyi"),
                "result_metadata", Map.of("curated", true)));
        DraftHierarchy once = policy.apply(fixture.draft(PolicyFixture.xinyi()), fixture.at(0, 0));

        assertThat(policy.apply(once, fixture.at(0, 0))).isEqualTo(once);
    }

    @Test
    void rejectsEmptyOverlay() {
        assertThatThrownBy(() -> policy(Map.of("name_overrides_by_id", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("neither name overrides nor result metadata");
    }

    @Test
    void rejectsUnsupportedKeys() {
        assertThatThrownBy(() -> policy(Map.of("name_overrides_by_id", Map.of("a", "b"), "lookup_status", "ok")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookup_status");
    }
}
