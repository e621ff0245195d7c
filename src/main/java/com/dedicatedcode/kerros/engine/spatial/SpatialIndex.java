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

import com.dedicatedcode.kerros.engine.manifest.DatasetManifest;
import com.dedicatedcode.kerros.engine.manifest.LevelSpec;
import com.dedicatedcode.kerros.engine.manifest.ManifestLoader;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntConsumer;

/**
 * Per-level containment structures of one dataset plus an identifier catalog over all
 * features. Immutable once built.
 */
public final class SpatialIndex {

    private static final Logger logger = LoggerFactory.getLogger(SpatialIndex.class);

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    private final Map<Integer, LevelIndex> levels;
    private final Map<String, IndexedFeature> byId;

    private SpatialIndex(Map<Integer, LevelIndex> levels, Map<String, IndexedFeature> byId) {
        this.levels = Collections.unmodifiableMap(levels);
        this.byId = Collections.unmodifiableMap(byId);
    }

    /**
     * Read the geometry file of every declared level and build the index over them.
     *
     * @param beforeLevel called with the level number before its file is read
     * @throws IOException              if a geometry file cannot be read
     * @throws IllegalArgumentException if a file holds unusable features or two features share an identifier
     */
    public static SpatialIndex build(DatasetManifest manifest, Path datasetDir, GeoJsonFeatureReader reader,
                                     IntConsumer beforeLevel) throws IOException {
        Map<Integer, List<AdminFeature>> featuresByLevel = new LinkedHashMap<>();
        for (LevelSpec level : manifest.levels()) {
            beforeLevel.accept(level.level());
            Path file = ManifestLoader.resolveDatasetFile(datasetDir, level.geometry());
            try {
                List<AdminFeature> features = reader.read(file, level.level(), manifest.fields());
                logger.info("Read {} features for level {} ({}) from {}", features.size(), level.level(), level.label(), file.getFileName());
                featuresByLevel.put(level.level(), features);
            } catch (IOException e) {
                throw new IOException("Could not read " + level.geometry() + ": " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid geometry file " + level.geometry() + ": " + e.getMessage(), e);
            }
        }
        return build(featuresByLevel);
    }

    /**
     * Build the index from already loaded features.
     *
     * @param featuresByLevel features keyed by level, in ascending level order
     * @throws IllegalArgumentException if two features share an identifier
     */
    public static SpatialIndex build(Map<Integer, List<AdminFeature>> featuresByLevel) {
        Map<Integer, LevelIndex> levels = new LinkedHashMap<>();
        Map<String, IndexedFeature> byId = new HashMap<>();
        featuresByLevel.forEach((level, features) -> {
            LevelIndex levelIndex = new LevelIndex(features);
            levels.put(level, levelIndex);
            for (IndexedFeature indexed : levelIndex.features()) {
                IndexedFeature previous = byId.put(indexed.id(), indexed);
                if (previous != null) {
                    throw new IllegalArgumentException("Feature id '" + indexed.id() + "' is used at level "
                            + previous.feature().level() + " and level " + level);
                }
            }
        });
        return new SpatialIndex(levels, byId);
    }

    public static Point point(double lat, double lon) {
        return GEOMETRY_FACTORY.createPoint(new Coordinate(lon, lat));
    }

    /**
     * Features of {@code level} containing the point, boundary inclusive, ordered by
     * ascending area and then identifier. Empty for unknown levels.
     */
    public List<IndexedFeature> query(int level, Point point) {
        LevelIndex index = levels.get(level);
        return index == null ? List.of() : index.containing(point);
    }

    /**
     * Features of {@code level} whose envelope intersects {@code envelope}, in identifier order.
     */
    public List<IndexedFeature> candidates(int level, Envelope envelope) {
        LevelIndex index = levels.get(level);
        return index == null ? List.of() : index.candidates(envelope);
    }

    public Optional<IndexedFeature> feature(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    public Set<Integer> levels() {
        return levels.keySet();
    }

    public int featureCount() {
        return byId.size();
    }
}
