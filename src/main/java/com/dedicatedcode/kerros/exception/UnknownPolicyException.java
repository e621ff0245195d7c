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
 * Raised when a manifest names a supplementation policy that is not part of the catalog.
 */
public class UnknownPolicyException extends ManifestException {

    private final String policyName;

    public UnknownPolicyException(Path datasetDir, String policyName) {
        super(datasetDir, "unknown policy '" + policyName + "'");
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
