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

package com.dedicatedcode.kerros.engine.spatial;

import com.dedicatedcode.kerros.TestDatasets;
import com.dedicatedcode.kerros.engine.manifest.FieldSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dedicatedcode.kerros.TestDatasets.box;
import static com.dedicatedcode.kerros.TestDatasets.collection;
import static com.dedicatedcode.kerros.TestDatasets.feature;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpatialIndexTest {

    @TempDir
    Path dir;

    @Test
    void findsContainingFeaturePerLevel() throws IOException {
        SpatialIndex index = TestDatasets.buildIndex(TestDatasets.taipei(dir));

        assertThat(index.levels()).containsExactly(4, 7);
        assertThat(index.featureCount()).isEqualTo(5);
        assertThat(index.query(4, SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON)))
                .extracting(IndexedFeature::id).containsExactly(TestDatasets.TAIPEI);
        assertThat(index.query(7, SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON)))
                .extracting(IndexedFeature::id).containsExactly(TestDatasets.XINYI);
        assertThat(index.query(7, SpatialIndex.point(TestDatasets.GAP_LAT, TestDatasets.GAP_LON))).isEmpty();
        assertThat(index.query(9, SpatialIndex.point(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON))).isEmpty();
    }

    @Test
    void pointsOnASharedBoundaryBelongToBothSidesSmallerFirst() throws IOException {
        SpatialIndex index = TestDatasets.buildIndex(TestDatasets.taipei(dir));

        List<IndexedFeature> onEdge = index.query(4, SpatialIndex.point(25.0, 121.45));

        assertThat(onEdge).extracting(IndexedFeature::id).containsExactly(TestDatasets.TAIPEI, TestDatasets.NEW_TAIPEI);
    }

    @Test
    void equalAreasAreOrderedById() {
        Map<Integer, List<AdminFeature>> features = Map.of(4, List.of(
                adminFeature(4, "b", 0, 0, 1, 1),
                adminFeature(4, "a", 0, 0, 1, 1),
                adminFeature(4, "c", 0, 0, 2, 2)));

        SpatialIndex index = SpatialIndex.build(features);

        for (int i = 0; i < 3; i++) {
            assertThat(index.query(4, SpatialIndex.point(0.5, 0.5))).extracting(IndexedFeature::id).containsExactly("a", "b", "c");
        }
    }

    @Test
    void candidatesAreOrderedById() throws IOException {
        SpatialIndex index = TestDatasets.buildIndex(TestDatasets.taipei(dir));

        List<IndexedFeature> candidates = index.candidates(7, new Envelope(121.0, 122.0, 24.0, 26.0));

        assertThat(candidates).extracting(IndexedFeature::id)
                .containsExactly(TestDatasets.XINYI, TestDatasets.DAAN, TestDatasets.BANQIAO);
    }

    @Test
    void looksUpFeaturesById() throws IOException {
        SpatialIndex index = TestDatasets.buildIndex(TestDatasets.taipei(dir));

        assertThat(index.feature(TestDatasets.DAAN)).hasValueSatisfying(f -> assertThat(f.feature().level()).isEqualTo(7));
        assertThat(index.feature("nope")).isEmpty();
        assertThat(index.feature(null)).isEmpty();
    }

    @Test
    void rejectsDuplicateIdsAcrossLevels() {
        Map<Integer, List<AdminFeature>> features = new LinkedHashMap<>();
        features.put(4, List.of(adminFeature(4, "dup", 0, 0, 1, 1)));
        features.put(7, List.of(adminFeature(7, "dup", 0, 0, 1, 1)));

        assertThatThrownBy(() -> SpatialIndex.build(features))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dup");
    }

    private AdminFeature adminFeature(int level, String id, double minLon, double minLat, double maxLon, double maxLat) {
        try {
            Path file = dir.resolve(level + "-" + id + "-" + maxLon + ".geojson");
            TestDatasets.writeJson(file, collection(List.of(feature(id, id.toUpperCase(), null, box(minLon, minLat, maxLon, maxLat)))));
            return new GeoJsonFeatureReader(TestDatasets.MAPPER).read(file, level, FieldSpec.DEFAULTS).get(0);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
