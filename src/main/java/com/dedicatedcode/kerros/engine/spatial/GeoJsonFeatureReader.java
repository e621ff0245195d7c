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

import com.dedicatedcode.kerros.engine.manifest.FieldSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one level's GeoJSON FeatureCollection into {@link AdminFeature}s.
 */
public class GeoJsonFeatureReader {

    private static final Logger logger = LoggerFactory.getLogger(GeoJsonFeatureReader.class);
    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    private final ObjectMapper objectMapper;

    public GeoJsonFeatureReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Read all polygonal features of a level file.
     *
     * @param file   the GeoJSON file
     * @param level  level the file was declared for
     * @param fields property names carrying id, name and parent hint
     * @return features in file order
     * @throws IOException              if the file cannot be read or is not JSON
     * @throws IllegalArgumentException if the content is not a usable FeatureCollection
     */
    public List<AdminFeature> read(Path file, int level, FieldSpec fields) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())) {
            throw new IllegalArgumentException(file.getFileName() + " is not a GeoJSON FeatureCollection");
        }
        JsonNode features = root.get("features");
        if (features == null || !features.isArray()) {
            throw new IllegalArgumentException(file.getFileName() + " has no features array");
        }

        List<AdminFeature> loaded = new ArrayList<>();
        int index = 0;
        for (JsonNode feature : features) {
            AdminFeature parsed = parseFeature(feature, level, fields, file, index++);
            if (parsed != null) {
                loaded.add(parsed);
            }
        }
        logger.debug("Read {} features for level {} from {}", loaded.size(), level, file.getFileName());
        return loaded;
    }

    private AdminFeature parseFeature(JsonNode feature, int level, FieldSpec fields, Path file, int index) {
        JsonNode properties = feature.path("properties");
        String where = file.getFileName() + " feature #" + index;

        String id = scalarText(properties.get(fields.id()));
        if (id == null) {
            id = scalarText(feature.get("id"));
        }
        if (id == null) {
            throw new IllegalArgumentException(where + " has no '" + fields.id() + "' property");
        }
        String name = scalarText(properties.get(fields.name()));
        if (name == null) {
            throw new IllegalArgumentException(where + " (" + id + ") has no '" + fields.name() + "' property");
        }
        checkDeclaredLevel(properties, level, where, id);

        Map<String, String> names = new LinkedHashMap<>();
        var it = properties.fields();
        while (it.hasNext()) {
            var property = it.next();
            String key = property.getKey();
            if (key.equals(fields.name()) || key.startsWith(fields.name() + ":")) {
                String value = scalarText(property.getValue());
                if (value != null) {
                    names.put(key, value);
                }
            }
        }
        String parentId = scalarText(properties.get(fields.parent()));

        JsonNode geometryNode = feature.get("geometry");
        if (geometryNode == null || geometryNode.isNull()) {
            logger.warn("Skipping {} ({}): no geometry", where, id);
            return null;
        }
        Geometry geometry = parseGeometry(geometryNode, where);
        if (geometry == null || geometry.isEmpty()) {
            logger.warn("Skipping {} ({}): unsupported or empty geometry", where, id);
            return null;
        }
        if (!geometry.isValid()) {
            logger.warn("Repairing invalid geometry of {} ({}) with buffer(0)", where, id);
            geometry = geometry.buffer(0);
            if (geometry.isEmpty()) {
                logger.warn("Skipping {} ({}): geometry empty after repair", where, id);
                return null;
            }
        }
        return new AdminFeature(id, level, name, names, parentId, geometry, geometry.getArea(), geometry.getCentroid());
    }

    private void checkDeclaredLevel(JsonNode properties, int level, String where, String id) {
        for (String key : List.of("admin_level", "level")) {
            JsonNode value = properties.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            String text = scalarText(value);
            try {
                if (text != null && Integer.parseInt(text) != level) {
                    throw new IllegalArgumentException(where + " (" + id + ") declares " + key + "=" + text
                            + " but is stored in the file of level " + level);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(where + " (" + id + ") has a non-numeric " + key, e);
            }
            return;
        }
    }

    private Geometry parseGeometry(JsonNode node, String where) {
        String type = node.path("type").asText();
        return switch (type) {
            case "Polygon" -> buildPolygon(node.get("coordinates"), where);
            case "MultiPolygon" -> buildMultiPolygon(node.get("coordinates"), where);
            default -> null;
        };
    }

    private Polygon buildPolygon(JsonNode rings, String where) {
        if (rings == null || !rings.isArray() || rings.isEmpty()) {
            return null;
        }
        LinearRing shell = buildLinearRing(rings.get(0), where);
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = buildLinearRing(rings.get(i), where);
        }
        return GEOMETRY_FACTORY.createPolygon(shell, holes);
    }

    private Geometry buildMultiPolygon(JsonNode polygonsNode, String where) {
        if (polygonsNode == null || !polygonsNode.isArray()) {
            return null;
        }
        List<Polygon> polygons = new ArrayList<>();
        for (JsonNode polygonNode : polygonsNode) {
            Polygon polygon = buildPolygon(polygonNode, where);
            if (polygon != null) {
                polygons.add(polygon);
            }
        }
        if (polygons.isEmpty()) {
            return null;
        }
        return GEOMETRY_FACTORY.createMultiPolygon(polygons.toArray(Polygon[]::new));
    }

    private LinearRing buildLinearRing(JsonNode ringNode, String where) {
        if (ringNode == null || !ringNode.isArray()) {
            throw new IllegalArgumentException(where + " has a malformed ring");
        }
        List<Coordinate> coordinates = new ArrayList<>();
        for (JsonNode coord : ringNode) {
            if (!coord.isArray() || coord.size() < 2 || !coord.get(0).isNumber() || !coord.get(1).isNumber()) {
                throw new IllegalArgumentException(where + " has a malformed coordinate " + coord);
            }
            coordinates.add(new Coordinate(coord.get(0).asDouble(), coord.get(1).asDouble()));
        }
        if (coordinates.size() < 3) {
            throw new IllegalArgumentException(where + " has a ring with fewer than 3 points");
        }
        Coordinate first = coordinates.get(0);
        Coordinate last = coordinates.get(coordinates.size() - 1);
        if (!first.equals2D(last)) {
            coordinates.add(first);
        }
        if (coordinates.size() < 4) {
            throw new IllegalArgumentException(where + " has a degenerate ring");
        }
        return GEOMETRY_FACTORY.createLinearRing(coordinates.toArray(Coordinate[]::new));
    }

    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text.trim();
    }
}
