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

import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.manifest.ManifestLoader;
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;
import com.dedicatedcode.kerros.engine.policy.PolicyResources;
import com.dedicatedcode.kerros.engine.policy.SupplementationPipeline;
import com.dedicatedcode.kerros.engine.policy.SupplementationPolicy;
import com.dedicatedcode.kerros.engine.spatial.GeoJsonFeatureReader;
import com.dedicatedcode.kerros.engine.spatial.SpatialIndex;
import com.dedicatedcode.kerros.exception.DatasetLoadException;
import com.dedicatedcode.kerros.exception.LoadCancelledException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Builds a {@link DatasetSnapshot} from a dataset directory: manifest, checksums, level
 * geometries, index and policy chain, in that order. Cancellation is checked between stages.
 */
public class SnapshotLoader {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotLoader.class);

    private final ObjectMapper objectMapper;
    private final ManifestLoader manifestLoader;
    private final GeoJsonFeatureReader featureReader;
    private final boolean verifyChecksums;
    private final String defaultLanguage;

    public SnapshotLoader(ObjectMapper objectMapper, boolean verifyChecksums) {
        this(objectMapper, verifyChecksums, null);
    }

    public SnapshotLoader(ObjectMapper objectMapper, boolean verifyChecksums, String defaultLanguage) {
        this.objectMapper = objectMapper;
        this.defaultLanguage = defaultLanguage;
        this.manifestLoader = new ManifestLoader(objectMapper);
        this.featureReader = new GeoJsonFeatureReader(objectMapper);
        this.verifyChecksums = verifyChecksums;
    }

    public DatasetSnapshot load(Path datasetDir, long generation, BooleanSupplier cancelRequested) {
        long start = System.currentTimeMillis();
        checkCancelled(datasetDir, "manifest", cancelRequested);
        DatasetManifest manifest = manifestLoader.parse(datasetDir);

        if (verifyChecksums) {
            checkCancelled(datasetDir, "checksums", cancelRequested);
            verifyChecksums(datasetDir, manifest);
        }

        SpatialIndex index;
        try {
            index = SpatialIndex.build(manifest, datasetDir, featureReader,
                    level -> checkCancelled(datasetDir, "level " + level, cancelRequested));
        } catch (IOException | IllegalArgumentException e) {
            throw new DatasetLoadException(datasetDir, e.getMessage(), e);
        }

        checkCancelled(datasetDir, "policies", cancelRequested);
        SupplementationPipeline pipeline = createPipeline(datasetDir, manifest);

        logger.info("Built snapshot {}@{} generation {} with {} features in {}ms",
                manifest.datasetId(), manifest.version(), generation, index.featureCount(), System.currentTimeMillis() - start);
        return new DatasetSnapshot(datasetDir, manifest, index, pipeline, generation, Instant.now());
    }

    private SupplementationPipeline createPipeline(Path datasetDir, DatasetManifest manifest) {
        PolicyResources resources = new PolicyResources(datasetDir, manifest, objectMapper, defaultLanguage);
        List<SupplementationPolicy> policies = new ArrayList<>();
        for (PolicySpec spec : manifest.policies()) {
            try {
                policies.add(spec.kind().create(spec, resources));
            } catch (IOException e) {
                throw new DatasetLoadException(datasetDir, "Could not read data of policy " + spec.name() + ": " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new DatasetLoadException(datasetDir, "Invalid data of policy " + spec.name() + ": " + e.getMessage(), e);
            }
        }
        return new SupplementationPipeline(policies);
    }

    private void verifyChecksums(Path datasetDir, DatasetManifest manifest) {
        for (Map.Entry<String, String> entry : manifest.fileChecksums().entrySet()) {
            Path file = ManifestLoader.resolveDatasetFile(datasetDir, entry.getKey());
            if (!Files.isRegularFile(file)) {
                throw new DatasetLoadException(datasetDir, "Checksummed file " + entry.getKey() + " is missing");
            }
            String actual = sha256(datasetDir, file);
            if (!actual.equals(entry.getValue())) {
                throw new DatasetLoadException(datasetDir,
                        "Checksum mismatch for " + entry.getKey() + ": expected " + entry.getValue() + " but was " + actual);
            }
        }
        if (!manifest.fileChecksums().isEmpty()) {
            logger.debug("Verified {} file checksums of {}", manifest.fileChecksums().size(), manifest.datasetId());
        }
    }

    static String sha256(Path datasetDir, Path file) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            throw new DatasetLoadException(datasetDir, "Could not checksum " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void checkCancelled(Path datasetDir, String stage, BooleanSupplier cancelRequested) {
        if (cancelRequested.getAsBoolean()) {
            throw new LoadCancelledException(datasetDir, stage);
        }
    }
}
