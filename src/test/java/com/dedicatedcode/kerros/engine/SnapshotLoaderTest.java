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

import com.dedicatedcode.kerros.TestDatasets;
import com.dedicatedcode.kerros.engine.policy.PolicyKind;
import com.dedicatedcode.kerros.engine.policy.SupplementationPolicy;
import com.dedicatedcode.kerros.exception.DatasetLoadException;
import com.dedicatedcode.kerros.exception.LoadCancelledException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.dedicatedcode.kerros.TestDatasets.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotLoaderTest {

    @TempDir
    Path dir;

    private final SnapshotLoader loader = new SnapshotLoader(TestDatasets.MAPPER, true);

    @Test
    void buildsIndexAndPolicyChain() throws IOException {
        TestDatasets.taipei(dir, "parent_link_repair", policy("nearby_fill", "max_distance_km", 5), "name_normalization");

        DatasetSnapshot snapshot = loader.load(dir, 3, () -> false);

        assertThat(snapshot.generation()).isEqualTo(3);
        assertThat(snapshot.index().featureCount()).isEqualTo(5);
        assertThat(snapshot.pipeline().policies()).extracting(SupplementationPolicy::kind)
                .containsExactly(PolicyKind.PARENT_LINK_REPAIR, PolicyKind.NEARBY_FILL, PolicyKind.NAME_NORMALIZATION);
        assertThat(snapshot.loadedAt()).isNotNull();
    }

    @Test
    void verifiesFileChecksums() throws IOException {
        TestDatasets.taipei(dir);
        String sha = SnapshotLoader.sha256(dir, dir.resolve("level_4.geojson"));
        TestDatasets.editManifest(dir, m -> m.put("files", Map.of("level_4.geojson", sha.toUpperCase())));

        assertThat(loader.load(dir, 1, () -> false).manifest().fileChecksums()).containsEntry("level_4.geojson", sha);
    }

    @Test
    void rejectsChecksumMismatch() throws IOException {
        TestDatasets.taipei(dir);
        TestDatasets.editManifest(dir, m -> m.put("files", Map.of("level_4.geojson", "00")));

        assertThatThrownBy(() -> loader.load(dir, 1, () -> false))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("Checksum mismatch for level_4.geojson");
    }

    @Test
    void skipsChecksumsWhenDisabled() throws IOException {
        TestDatasets.taipei(dir);
        TestDatasets.editManifest(dir, m -> m.put("files", Map.of("level_4.geojson", "00")));

        assertThat(new SnapshotLoader(TestDatasets.MAPPER, false).load(dir, 1, () -> false)).isNotNull();
    }

    @Test
    void reportsBrokenGeometryFileAsLoadFailure() throws IOException {
        TestDatasets.taipei(dir);
        Files.writeString(dir.resolve("level_7.geojson"), "{\"type\": \"FeatureCollection\", \"features\": [{\"properties\": {}}]}");

        assertThatThrownBy(() -> loader.load(dir, 1, () -> false))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("level_7.geojson");
    }

    @Test
    void reportsDuplicateIdsAsLoadFailure() throws IOException {
        TestDatasets.taipei(dir);
        TestDatasets.writeJson(dir.resolve("level_7.geojson"), TestDatasets.collection(List.of(
                TestDatasets.feature(TestDatasets.TAIPEI, "dup", null, TestDatasets.box(121.5, 25.0, 121.6, 25.1)))));

        assertThatThrownBy(() -> loader.load(dir, 1, () -> false))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining(TestDatasets.TAIPEI);
    }

    @Test
    void reportsUnusablePolicyDataAsLoadFailure() throws IOException {
        TestDatasets.taipei(dir, policy("name_override", "file", "overrides.json"));
        Files.writeString(dir.resolve("overrides.json"), "{}");

        assertThatThrownBy(() -> loader.load(dir, 1, () -> false))
                .isInstanceOf(DatasetLoadException.class)
                .hasMessageContaining("name_override");
    }

    @Test
    void stopsBetweenStagesWhenCancelled() throws IOException {
        TestDatasets.taipei(dir);
        AtomicInteger checks = new AtomicInteger();

        assertThatThrownBy(() -> loader.load(dir, 1, () -> checks.incrementAndGet() > 2))
                .isInstanceOfSatisfying(LoadCancelledException.class,
                        e -> assertThat(e.getDatasetDir()).isEqualTo(dir));
        assertThat(checks.get()).isEqualTo(3);
    }
}
