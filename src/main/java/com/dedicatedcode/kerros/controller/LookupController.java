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

package com.dedicatedcode.kerros.controller;

import com.dedicatedcode.kerros.config.KerrosConfiguration;
import com.dedicatedcode.kerros.dto.LookupRequest;
import com.dedicatedcode.kerros.dto.LookupResponse;
import com.dedicatedcode.kerros.engine.SnapshotHandle;
import com.dedicatedcode.kerros.exception.DatasetNotLoadedException;
import com.dedicatedcode.kerros.exception.InvalidCoordinateException;
import com.dedicatedcode.kerros.service.LookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for administrative hierarchy lookups.
 */
@RestController
@RequestMapping("/api/v1")
public class LookupController {

    private static final Logger logger = LoggerFactory.getLogger(LookupController.class);

    private static final String NO_CACHE = "no-store, no-cache, must-revalidate, proxy-revalidate, max-age=0";

    private final LookupService lookupService;
    private final KerrosConfiguration config;

    public LookupController(LookupService lookupService, KerrosConfiguration config) {
        this.lookupService = lookupService;
        this.config = config;
    }

    /**
     * Resolve the administrative hierarchy of a coordinate.
     *
     * @param lat Latitude in degrees
     * @param lon Longitude in degrees
     */
    @GetMapping("/lookup")
    public ResponseEntity<LookupResponse> lookup(@RequestParam double lat, @RequestParam double lon) {
        logger.debug("Lookup request: lat={}, lon={}", lat, lon);
        return respond(lookupService.lookup(lat, lon));
    }

    @PostMapping("/lookup")
    public ResponseEntity<?> lookup(@RequestBody LookupRequest request) {
        if (request.getLat() == null || request.getLon() == null) {
            return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Both lat and lon are required.");
        }
        logger.debug("Lookup request: lat={}, lon={}", request.getLat(), request.getLon());
        return respond(lookupService.lookup(request.getLat(), request.getLon()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Optional<SnapshotHandle> active = lookupService.active();
        Map<String, Object> response = new HashMap<>();
        response.put("status", active.isPresent() ? "ok" : "no_dataset");
        response.put("service", config.getEngineName());
        active.ifPresent(handle -> response.put("dataset", describe(handle)));
        return ResponseEntity.ok()
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    static Map<String, Object> describe(SnapshotHandle handle) {
        Map<String, Object> dataset = new LinkedHashMap<>();
        dataset.put("id", handle.datasetId());
        dataset.put("version", handle.datasetVersion());
        dataset.put("checksum", handle.datasetChecksum());
        dataset.put("generation", handle.generation());
        dataset.put("loaded_at", handle.loadedAt().toString());
        dataset.put("levels", handle.levels());
        dataset.put("features", handle.featureCount());
        return dataset;
    }

    @ExceptionHandler(InvalidCoordinateException.class)
    public ResponseEntity<Map<String, Object>> invalidCoordinate(InvalidCoordinateException e) {
        logger.debug("Rejected coordinate lat={}, lon={}: {}", e.getLat(), e.getLon(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_COORDINATE", e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> invalidRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Request needs numeric lat and lon.");
    }

    @ExceptionHandler(DatasetNotLoadedException.class)
    public ResponseEntity<Map<String, Object>> notLoaded(DatasetNotLoadedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "DATASET_NOT_LOADED", e.getMessage());
    }

    private ResponseEntity<LookupResponse> respond(LookupResponse response) {
        return ResponseEntity.ok()
                .header("Cache-Control", NO_CACHE)
                .body(response);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error_code", code);
        error.put("error_message", message);
        return ResponseEntity.status(status).body(error);
    }
}
