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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.dedicatedcode.kerros.TestDatasets.box;
import static com.dedicatedcode.kerros.TestDatasets.collection;
import static com.dedicatedcode.kerros.TestDatasets.feature;
import static com.dedicatedcode.kerros.TestDatasets.ring;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

class GeoJsonFeatureReaderTest {

    @TempDir
    Path dir;

    private final GeoJsonFeatureReader reader = new GeoJsonFeatureReader(TestDatasets.MAPPER);

    private Path write(List<Map<String, Object>> features) throws IOException {
        Path file = dir.resolve("level.geojson");
        TestDatasets.writeJson(file, collection(features));
        return file;
    }

    @Test
    void readsPolygonsWithNamesAndParentHint() throws IOException {
        Path file = write(TestDatasets.districts());

        List<AdminFeature> features = reader.read(file, 7, FieldSpec.DEFAULTS);

        assertThat(features).extracting(AdminFeature::id)
                .containsExactly(TestDatasets.XINYI, TestDatasets.DAAN, TestDatasets.BANQIAO);
        AdminFeature xinyi = features.get(0);
        assertThat(xinyi.level()).isEqualTo(7);
        assertThat(xinyi.name()).isEqualTo("信義區");
        assertThat(xinyi.names()).containsEntry("name", "信義區").containsEntry("name:en", "Xinyi District");
        assertThat(xinyi.parentId()).isEqualTo(TestDatasets.TAIPEI);
        assertThat(xinyi.area()).isCloseTo(0.05 * 0.04, offset(1e-9));
        assertThat(xinyi.centroid().getX()).isCloseTo(121.575, offset(1e-9));
    }

    @Test
    void keepsInteriorRingsAsHoles() throws IOException {
        Map<String, Object> donut = Map.of("type", "Polygon", "coordinates",
                List.of(ring(0, 0, 10, 10), ring(4, 4, 6, 6)));
        Path file = write(List.of(feature("d", "Donut", null, donut)));

        AdminFeature feature = reader.read(file, 4, FieldSpec.DEFAULTS).get(0);

        assertThat(feature.geometry().covers(SpatialIndex.point(2, 2))).isTrue();
        assertThat(feature.geometry().covers(SpatialIndex.point(5, 5))).isFalse();
        assertThat(feature.area()).isEqualTo(96.0);
    }

    @Test
    void readsMultiPolygons() throws IOException {
        Map<String, Object> islands = Map.of("type", "MultiPolygon", "coordinates",
                List.of(List.of(ring(0, 0, 1, 1)), List.of(ring(5, 5, 6, 6))));
        Path file = write(List.of(feature("m", "Islands", null, islands)));

        AdminFeature feature = reader.read(file, 4, FieldSpec.DEFAULTS).get(0);

        assertThat(feature.geometry().getNumGeometries()).isEqualTo(2);
        assertThat(feature.geometry().covers(SpatialIndex.point(5.5, 5.5))).isTrue();
    }

    @Test
    void usesConfiguredPropertyNames() throws IOException {
        Map<String, Object> properties = Map.of("ref", "x1", "label", "Custom", "label:en", "Custom EN", "up", "x0");
        Path file = write(List.of(Map.of("type", "Feature", "properties", properties, "geometry", box(0, 0, 1, 1))));

        AdminFeature feature = reader.read(file, 4, new FieldSpec("ref", "label", "up")).get(0);

        assertThat(feature.id()).isEqualTo("x1");
        assertThat(feature.name()).isEqualTo("Custom");
        assertThat(feature.names()).containsEntry("label:en", "Custom EN");
        assertThat(feature.parentId()).isEqualTo("x0");
    }

    @Test
    void skipsNonPolygonalGeometries() throws IOException {
        Map<String, Object> point = Map.of("type", "Point", "coordinates", List.of(1.0, 1.0));
        Path file = write(List.of(feature("p", "Point", null, point), feature("b", "Box", null, box(0, 0, 1, 1))));

        assertThat(reader.read(file, 4, FieldSpec.DEFAULTS)).extracting(AdminFeature::id).containsExactly("b");
    }

    @Test
    void repairsSelfIntersectingRings() throws IOException {
        Map<String, Object> bowtie = Map.of("type", "Polygon", "coordinates", List.of(List.of(
                List.of(0.0, 0.0), List.of(2.0, 2.0), List.of(2.0, 0.0), List.of(0.0, 2.0), List.of(0.0, 0.0))));
        Path file = write(List.of(feature("bt", "Bowtie", null, bowtie)));

        List<AdminFeature> features = reader.read(file, 4, FieldSpec.DEFAULTS);

        assertThat(features).hasSize(1);
        assertThat(features.get(0).geometry().isValid()).isTrue();
    }

    @Test
    void rejectsFeatureWithoutId() throws IOException {
        Path file = write(List.of(Map.of("type", "Feature", "properties", Map.of("name", "Nameless"), "geometry", box(0, 0, 1, 1))));

        assertThatThrownBy(() -> reader.read(file, 4, FieldSpec.DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("osm_id");
    }

    @Test
    void rejectsContradictingAdminLevel() throws IOException {
        Path file = write(List.of(feature("a", "A", null, box(0, 0, 1, 1), "admin_level", "8")));

        assertThatThrownBy(() -> reader.read(file, 4, FieldSpec.DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("admin_level=8");
    }

    @Test
    void rejectsSomethingThatIsNotAFeatureCollection() throws IOException {
        Path file = dir.resolve("broken.geojson");
        Files.writeString(file, "{\"type\": \"Feature\"}");

        assertThatThrownBy(() -> reader.read(file, 4, FieldSpec.DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FeatureCollection");
    }
}
