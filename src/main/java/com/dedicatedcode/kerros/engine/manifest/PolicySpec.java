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

package com.dedicatedcode.kerros.engine.manifest;

import com.dedicatedcode.kerros.engine.policy.PolicyKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named supplementation step as declared in the manifest, together with its parameters.
 * Typed accessors throw {@link IllegalArgumentException} on a parameter of the wrong shape;
 * the manifest loader reports those as manifest errors.
 */
public record PolicySpec(PolicyKind kind, Map<String, Object> params) {

    public PolicySpec {
        params = Collections.unmodifiableMap(params);
    }

    public String name() {
        return kind.policyName();
    }

    public Optional<String> optionalString(String key) {
        Object value = params.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(name() + "." + key + " must be a non-empty string");
        }
        return Optional.of(s.trim());
    }

    public String requiredString(String key) {
        return optionalString(key)
                .orElseThrow(() -> new IllegalArgumentException(name() + "." + key + " is required"));
    }

    public Optional<Double> optionalPositiveNumber(String key) {
        Object value = params.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Number n) || !(n.doubleValue() > 0) || Double.isInfinite(n.doubleValue())) {
            throw new IllegalArgumentException(name() + "." + key + " must be a number > 0");
        }
        return Optional.of(n.doubleValue());
    }

    public double requiredPositiveNumber(String key) {
        return optionalPositiveNumber(key)
                .orElseThrow(() -> new IllegalArgumentException(name() + "." + key + " is required"));
    }

    public Optional<Integer> optionalInt(String key) {
        Object value = params.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Integer i)) {
            throw new IllegalArgumentException(name() + "." + key + " must be an integer");
        }
        return Optional.of(i);
    }

    public int requiredInt(String key) {
        return optionalInt(key)
                .orElseThrow(() -> new IllegalArgumentException(name() + "." + key + " is required"));
    }

    public List<Integer> intList(String key) {
        Object value = params.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> raw)) {
            throw new IllegalArgumentException(name() + "." + key + " must be a list of integers");
        }
        List<Integer> out = new ArrayList<>();
        for (Object item : raw) {
            if (!(item instanceof Integer i)) {
                throw new IllegalArgumentException(name() + "." + key + " entries must be integers");
            }
            if (!out.contains(i)) {
                out.add(i);
            }
        }
        return List.copyOf(out);
    }
}
