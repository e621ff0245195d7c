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

import com.dedicatedcode.kerros.config.KerrosConfiguration;
import com.dedicatedcode.kerros.dto.LookupResponse;
import com.dedicatedcode.kerros.engine.HierarchyNode;
import com.dedicatedcode.kerros.engine.HierarchyResult;
import com.dedicatedcode.kerros.engine.LookupEngine;
import com.dedicatedcode.kerros.engine.SnapshotHandle;
import com.dedicatedcode.kerros.engine.SnapshotLoader;
import com.dedicatedcode.kerros.exception.KerrosException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Owns the lookup engine of the running service and maps its results to the API representation.
 */
@Service
public class LookupService {

    private static final Logger logger = LoggerFactory.getLogger(LookupService.class);

    private final KerrosConfiguration config;
    private final LookupEngine engine;

    public LookupService(KerrosConfiguration config, ObjectMapper objectMapper) {
        this.config = config;
        this.engine = new LookupEngine(new SnapshotLoader(objectMapper, config.isVerifyChecksums(),
                config.getQuery().getDefaultLanguage()));
    }

    @PostConstruct
    public void init() {
        Path dataDir = Paths.get(config.getDataDir());
        if (!Files.isDirectory(dataDir)) {
            logger.warn("Dataset directory {} does not exist, starting without a dataset", dataDir.toAbsolutePath());
            return;
        }
        try {
            engine.initialize(dataDir);
        } catch (KerrosException e) {
            logger.error("Could not load dataset from {}, starting without a dataset", dataDir.toAbsolutePath(), e);
        }
    }

    /**
     * @throws com.dedicatedcode.kerros.exception.InvalidCoordinateException for out of range coordinates
     * @throws com.dedicatedcode.kerros.exception.DatasetNotLoadedException  if no dataset is active
     */
    public LookupResponse lookup(double lat, double lon) {
        return toResponse(engine.lookup(lat, lon));
    }

    /**
     * Reload the configured dataset directory, or {@code datasetDir} when given. The active
     * dataset stays in place if the reload fails.
     */
    public SnapshotHandle reload(String datasetDir) {
        Path dir = Paths.get(datasetDir == null || datasetDir.isBlank() ? config.getDataDir() : datasetDir);
        return engine.reload(dir, () -> Thread.currentThread().isInterrupted());
    }

    public Optional<SnapshotHandle> active() {
        return engine.active();
    }

    private LookupResponse toResponse(HierarchyResult result) {
        List<LookupResponse.HierarchyItem> items = result.nodes().stream()
                .map(this::toItem)
                .toList();

        LookupResponse response = new LookupResponse();
        response.setEngine(config.getEngineName());
        response.setLookupStatus(result.status().key());
        response.setSummaryText(result.summaryText());
        response.setIsoContext(new LookupResponse.IsoContext(result.regionIso2(), result.regionName()));
        response.setResult(new LookupResponse.Result(items, result.missingLevels(), result.metadata()));
        response.setDataset(new LookupResponse.DatasetInfo(result.datasetId(), result.datasetVersion()));
        response.setVersion(LookupEngine.ENGINE_VERSION);
        return response;
    }

    private LookupResponse.HierarchyItem toItem(HierarchyNode node) {
        return new LookupResponse.HierarchyItem(node.level(), node.name(), node.id(), node.rank(), node.source().tag());
    }
}
