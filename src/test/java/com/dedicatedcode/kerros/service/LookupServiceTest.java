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

package com.dedicatedcode.kerros.service;

import com.dedicatedcode.kerros.TestDatasets;
import com.dedicatedcode.kerros.config.KerrosConfiguration;
import com.dedicatedcode.kerros.dto.LookupResponse;
import com.dedicatedcode.kerros.exception.DatasetNotLoadedException;
import com.dedicatedcode.kerros.exception.KerrosException;
import com.dedicatedcode.kerros.engine.SnapshotHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.dedicatedcode.kerros.TestDatasets.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LookupServiceTest {

    @TempDir
    Path tempDir;

    private LookupService service(Path dataDir) {
        KerrosConfiguration config = new KerrosConfiguration();
        config.setDataDir(dataDir.toString());
        config.setEngineName("kerros-test");
        LookupService service = new LookupService(config, TestDatasets.MAPPER);
        service.init();
        return service;
    }

    @Test
    void startsWithoutDatasetWhenDirectoryIsMissing() {
        LookupService service = service(tempDir.resolve("absent"));

        assertThat(service.active()).isEmpty();
        assertThatThrownBy(() -> service.lookup(TestDatasets.TAIPEI_LAT, TestDatasets.TAIPEI_LON))
                .isInstanceOf(DatasetNotLoadedException.class);
    }

    @Test
    void startsWithoutDatasetWhenManifestIsBroken() throws IOException {
        Path dir = TestDatasets.taipei(tempDir.resolve("tw"));
        TestDatasets.editManifest(dir, manifest -> manifest.remove("levels"));

        assertThat(service(dir).active()).isEmpty();
    }

    @Test
    void mapsResultToResponse() throws IOException {
        LookupService service = service(TestDatasets.taipei(tempDir.resolve("tw"),
                policy("nearest_centroid_fill", "max_distance_km", 25)));

        LookupResponse response = service.lookup(TestDatasets.GAP_LAT, TestDatasets.GAP_LON);

        assertThat(response.getEngine()).isEqualTo("kerros-test");
        assertThat(response.getLookupStatus()).isEqualTo("ok");
        assertThat(response.getIsoContext().getIso2()).isEqualTo("TW");
        assertThat(response.getResult().getAdminHierarchy())
                .extracting(LookupResponse.HierarchyItem::getSource)
                .containsExactly("polygon", "nearest_centroid");
        assertThat(response.getResult().getMissingLevels()).isEmpty();
        assertThat(response.getDataset().getVersion()).isEqualTo("2024.06.0");
        assertThat(response.getVersion()).isEqualTo("0.3.0");
    }

    @Test
    void reloadFallsBackToConfiguredDirectory() throws IOException {
        Path dir = TestDatasets.taipei(tempDir.resolve("tw"));
        LookupService service = service(dir);
        TestDatasets.editManifest(dir, manifest -> manifest.put("dataset_version", "2024.07.0"));

        SnapshotHandle handle = service.reload(" ");

        assertThat(handle.datasetVersion()).isEqualTo("2024.07.0");
        assertThat(handle.generation()).isEqualTo(2);
        assertThatThrownBy(() -> service.reload(tempDir.resolve("nothing").toString()))
                .isInstanceOf(KerrosException.class);
        assertThat(service.active()).map(SnapshotHandle::datasetVersion).contains("2024.07.0");
    }
}
