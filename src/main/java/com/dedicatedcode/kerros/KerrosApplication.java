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

package com.dedicatedcode.kerros;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KerrosApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(KerrosApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(KerrosApplication.class, args);
    }

    @Override
    public void run(String... args) {
        logger.info("KERROS is now serving data under the following endpoints:");
        logger.info("  Health Check:  GET  /api/v1/health");
        logger.info("  Lookup:        GET  /api/v1/lookup?lat=25.033&lon=121.5654");
        logger.info("  Lookup:        POST /api/v1/lookup {\"lat\": 25.033, \"lon\": 121.5654}");
        logger.info("  Reload:        POST /admin/reload (X-Admin-Token)");
        logger.info("");
        logger.info("Sample requests:");
        logger.info("  curl 'http://localhost:8080/api/v1/health'");
        logger.info("  curl 'http://localhost:8080/api/v1/lookup?lat=25.033&lon=121.5654'");
        logger.info("");
    }
}
