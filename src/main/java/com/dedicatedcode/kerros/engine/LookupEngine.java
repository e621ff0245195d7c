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

import com.dedicatedcode.kerros.engine.hierarchy.DraftHierarchy;
import com.dedicatedcode.kerros.engine.hierarchy.DraftNode;
import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.manifest.LocaleSpec;
import com.dedicatedcode.kerros.engine.manifest.SummaryOrder;
import com.dedicatedcode.kerros.engine.policy.PolicyContext;
import com.dedicatedcode.kerros.engine.spatial.SpatialIndex;
import com.dedicatedcode.kerros.exception.DatasetNotLoadedException;
import com.dedicatedcode.kerros.exception.InvalidCoordinateException;
import com.dedicatedcode.kerros.exception.LoadCancelledException;
import org.locationtech.jts.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Entry point of the lookup engine. Holds the active dataset snapshot and answers point
 * lookups against it.
 * <p>
 * Lookups never block: they read the current snapshot once and work on it. Loads are
 * serialized and only replace the active snapshot after a complete build, so a failed or
 * cancelled load leaves the previous snapshot serving.
 */
public class LookupEngine {

    private static final Logger logger = LoggerFactory.getLogger(LookupEngine.class);

    public static final String ENGINE_VERSION = "0.3.0";

    private final SnapshotLoader loader;
    private final AtomicReference<DatasetSnapshot> active = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();
    private final ReentrantLock loadLock = new ReentrantLock();

    public LookupEngine(SnapshotLoader loader) {
        this.loader = loader;
    }

    /**
     * Load the dataset and make it the active snapshot.
     *
     * @throws com.dedicatedcode.kerros.exception.ManifestException    if the manifest is invalid
     * @throws com.dedicatedcode.kerros.exception.DatasetLoadException if geometries, checksums or policy data fail
     */
    public SnapshotHandle initialize(Path datasetDir) {
        return reload(datasetDir, () -> false);
    }

    /**
     * Build a new snapshot from {@code datasetDir} and swap it in. {@code cancelRequested} is
     * polled between build stages and once more right before the swap.
     *
     * @throws LoadCancelledException if cancellation was requested before the swap
     */
    public SnapshotHandle reload(Path datasetDir, BooleanSupplier cancelRequested) {
        loadLock.lock();
        try {
            DatasetSnapshot previous = active.get();
            logger.info("Loading dataset from {}", datasetDir);
            DatasetSnapshot snapshot = loader.load(datasetDir, generations.incrementAndGet(), cancelRequested);
            if (cancelRequested.getAsBoolean()) {
                throw new LoadCancelledException(datasetDir, "activation");
            }
            active.set(snapshot);
            SnapshotHandle handle = new SnapshotHandle(snapshot);
            if (previous == null) {
                logger.info("Activated dataset {}", handle);
            } else {
                logger.info("Replaced dataset {}@{}#{} with {}", previous.manifest().datasetId(),
                        previous.manifest().version(), previous.generation(), handle);
            }
            return handle;
        } finally {
            loadLock.unlock();
        }
    }

    public Optional<SnapshotHandle> active() {
        return Optional.ofNullable(active.get()).map(SnapshotHandle::new);
    }

    /**
     * Look up the administrative hierarchy at a point using the active snapshot.
     *
     * @throws InvalidCoordinateException if the coordinate is out of range or not finite
     * @throws DatasetNotLoadedException  if no snapshot has been loaded yet
     */
    public HierarchyResult lookup(double lat, double lon) {
        validate(lat, lon);
        DatasetSnapshot snapshot = active.get();
        if (snapshot == null) {
            throw new DatasetNotLoadedException();
        }
        return lookup(snapshot, lat, lon);
    }

    /**
     * Look up the hierarchy against the snapshot the handle refers to, whatever is active now.
     */
    public HierarchyResult lookup(SnapshotHandle handle, double lat, double lon) {
        validate(lat, lon);
        return lookup(handle.snapshot(), lat, lon);
    }

    private HierarchyResult lookup(DatasetSnapshot snapshot, double lat, double lon) {
        Point point = SpatialIndex.point(lat, lon);
        DraftHierarchy draft = snapshot.composer().resolve(point);
        DraftHierarchy supplemented = snapshot.pipeline()
                .apply(draft, new PolicyContext(point, snapshot.manifest(), snapshot.index()));
        HierarchyResult result = assemble(snapshot.manifest(), supplemented);
        logger.debug("Lookup ({}, {}) -> {} {}", lat, lon, result.status().key(), result.summaryText());
        return result;
    }

    static HierarchyResult assemble(DatasetManifest manifest, DraftHierarchy draft) {
        List<HierarchyNode> nodes = new ArrayList<>();
        int rank = 0;
        for (DraftNode node : draft.resolved()) {
            nodes.add(new HierarchyNode(node.level(), node.name(), node.id(), rank++, node.source(), node.parentId()));
        }
        List<Integer> missing = draft.holes();

        LookupStatus status;
        if (nodes.isEmpty()) {
            status = LookupStatus.NOT_FOUND;
        } else if (!draft.isComplete()) {
            status = LookupStatus.PARTIAL;
        } else {
            status = LookupStatus.OK;
        }

        return new HierarchyResult(nodes, status, missing,
                manifest.region().iso2(), manifest.region().name(),
                summary(manifest.locale(), nodes),
                manifest.datasetId(), manifest.version(), draft.metadata());
    }

    private static String summary(LocaleSpec locale, List<HierarchyNode> nodes) {
        List<String> names = nodes.stream().map(HierarchyNode::name).collect(Collectors.toCollection(ArrayList::new));
        if (locale.summaryOrder() == SummaryOrder.FINE_FIRST) {
            Collections.reverse(names);
        }
        return String.join(locale.summarySeparator(), names);
    }

    private static void validate(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            throw new InvalidCoordinateException(lat, lon, "Coordinates must be finite numbers");
        }
        if (lat < -90 || lat > 90) {
            throw new InvalidCoordinateException(lat, lon, "Latitude must be between -90 and 90");
        }
        if (lon < -180 || lon > 180) {
            throw new InvalidCoordinateException(lat, lon, "Longitude must be between -180 and 180");
        }
    }
}
