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

import com.dedicatedcode.kerros.engine.hierarchy.HierarchyComposer;
import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.policy.SupplementationPipeline;
import com.dedicatedcode.kerros.engine.spatial.SpatialIndex;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Everything a lookup needs from one loaded dataset. Built completely by {@link SnapshotLoader}
 * and never changed afterwards.
 */
public final class DatasetSnapshot {

    private final Path datasetDir;
    private final DatasetManifest manifest;
    private final SpatialIndex index;
    private final HierarchyComposer composer;
    private final SupplementationPipeline pipeline;
    private final long generation;
    private final Instant loadedAt;

    DatasetSnapshot(Path datasetDir, DatasetManifest manifest, SpatialIndex index,
                    SupplementationPipeline pipeline, long generation, Instant loadedAt) {
        this.datasetDir = datasetDir;
        this.manifest = manifest;
        this.index = index;
        this.composer = new HierarchyComposer(manifest, index);
        this.pipeline = pipeline;
        this.generation = generation;
        this.loadedAt = loadedAt;
    }

    public Path datasetDir() {
        return datasetDir;
    }

    public DatasetManifest manifest() {
        return manifest;
    }

    public SpatialIndex index() {
        return index;
    }

    HierarchyComposer composer() {
        return composer;
    }

    public SupplementationPipeline pipeline() {
        return pipeline;
    }

    public long generation() {
        return generation;
    }

    public Instant loadedAt() {
        return loadedAt;
    }
}
