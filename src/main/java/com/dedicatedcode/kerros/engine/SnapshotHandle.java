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

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Read-only reference to exactly one loaded snapshot. Lookups through a handle keep using
 * that snapshot even after a newer one has been activated.
 */
public final class SnapshotHandle {

    private final DatasetSnapshot snapshot;

    SnapshotHandle(DatasetSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    DatasetSnapshot snapshot() {
        return snapshot;
    }

    public String datasetId() {
        return snapshot.manifest().datasetId();
    }

    public String datasetVersion() {
        return snapshot.manifest().version();
    }

    /**
     * The dataset checksum declared in the manifest.
     */
    public String datasetChecksum() {
        return snapshot.manifest().checksum();
    }

    public long generation() {
        return snapshot.generation();
    }

    public Instant loadedAt() {
        return snapshot.loadedAt();
    }

    public Path datasetDir() {
        return snapshot.datasetDir();
    }

    public List<Integer> levels() {
        return snapshot.manifest().levelNumbers();
    }

    public int featureCount() {
        return snapshot.index().featureCount();
    }

    @Override
    public String toString() {
        return datasetId() + "@" + datasetVersion() + "#" + generation();
    }
}
