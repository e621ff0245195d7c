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

package com.dedicatedcode.kerros.engine.policy;

import com.dedicatedcode.kerros.engine.manifest.PolicySpec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * The closed catalog of supplementation policies a manifest may name. Each kind carries the
 * validation of its parameters and the factory that instantiates it for a snapshot.
 */
public enum PolicyKind {
    PARENT_LINK_REPAIR("parent_link_repair",
            (spec, levels, dir) -> { },
            (spec, resources) -> new ParentLinkRepairPolicy()),
    NEAREST_CENTROID_FILL("nearest_centroid_fill",
            NearestCentroidFillPolicy::validate,
            NearestCentroidFillPolicy::create),
    NEARBY_FILL("nearby_fill",
            NearbyFillPolicy::validate,
            NearbyFillPolicy::create),
    ADMIN_TREE_FILL("admin_tree_fill",
            AdminTreeFillPolicy::validate,
            AdminTreeFillPolicy::create),
    SEMANTIC_ANCHOR_FILL("semantic_anchor_fill",
            SemanticAnchorFillPolicy::validate,
            SemanticAnchorFillPolicy::create),
    NAME_NORMALIZATION("name_normalization",
            NameNormalizationPolicy::validate,
            NameNormalizationPolicy::create),
    NAME_OVERRIDE("name_override",
            NameOverridePolicy::validate,
            NameOverridePolicy::create);

    @FunctionalInterface
    interface Validator {
        void validate(PolicySpec spec, Set<Integer> levels, Path datasetDir);
    }

    @FunctionalInterface
    interface Factory {
        SupplementationPolicy create(PolicySpec spec, PolicyResources resources) throws IOException;
    }

    private final String policyName;
    private final Validator validator;
    private final Factory factory;

    PolicyKind(String policyName, Validator validator, Factory factory) {
        this.policyName = policyName;
        this.validator = validator;
        this.factory = factory;
    }

    public String policyName() {
        return policyName;
    }

    public static Optional<PolicyKind> fromName(String name) {
        return Arrays.stream(values()).filter(k -> k.policyName.equals(name)).findFirst();
    }

    /**
     * Check the parameters of a declared policy against the dataset's levels and files.
     *
     * @throws IllegalArgumentException describing the first offending parameter
     */
    public void validate(PolicySpec spec, Set<Integer> levels, Path datasetDir) {
        validator.validate(spec, levels, datasetDir);
    }

    /**
     * Instantiate the policy, loading any data file it declares.
     *
     * @throws IOException              if a data file cannot be read
     * @throws IllegalArgumentException if a data file has unusable content
     */
    public SupplementationPolicy create(PolicySpec spec, PolicyResources resources) throws IOException {
        return factory.create(spec, resources);
    }
}
