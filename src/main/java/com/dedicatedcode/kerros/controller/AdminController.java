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

import com.dedicatedcode.kerros.engine.SnapshotHandle;
import com.dedicatedcode.kerros.service.LookupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final LookupService lookupService;

    public AdminController(LookupService lookupService) {
        this.lookupService = lookupService;
    }

    @PostMapping(value = "/reload", produces = "application/json")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> reload(@RequestBody(required = false) Map<String, String> body) {
        String datasetDir = body != null ? body.get("dataset_dir") : null;
        logger.info("Dataset reload requested{}", datasetDir != null ? " from " + datasetDir : "");

        try {
            SnapshotHandle handle = lookupService.reload(datasetDir);
            logger.info("Dataset reload completed, now serving {}", handle);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("message", "Dataset reloaded from " + handle.datasetDir());
            response.put("dataset", LookupController.describe(handle));
            response.put("timestamp", System.currentTimeMillis());
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            logger.error("Failed to reload dataset", e);

            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", "Failed to reload dataset: " + e.getMessage());
            lookupService.active().ifPresent(active -> errorResponse.put("dataset", LookupController.describe(active)));
            errorResponse.put("timestamp", System.currentTimeMillis());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
        }
    }
}
