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

package com.dedicatedcode.kerros.exception;

import java.nio.file.Path;

/**
 * Raised when geometry or policy data of a dataset cannot be read, verified or indexed.
 */
public class DatasetLoadException extends KerrosException {

    private final Path datasetDir;

    public DatasetLoadException(Path datasetDir, String message) {
        super(message + " (dataset: " + datasetDir + ")");
        this.datasetDir = datasetDir;
    }

    public DatasetLoadException(Path datasetDir, String message, Throwable cause) {
        super(message + " (dataset: " + datasetDir + ")", cause);
        this.datasetDir = datasetDir;
    }

    public Path getDatasetDir() {
        return datasetDir;
    }
}
