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

import com.dedicatedcode.kerros.engine.hierarchy.DraftHierarchy;
import com.dedicatedcode.kerros.engine.hierarchy.DraftNode;
import com.dedicatedcode.kerros.engine.manifest.LocaleSpec;
import com.dedicatedcode.kerros.engine.manifest.PolicySpec;
import com.dedicatedcode.kerros.engine.spatial.AdminFeature;
import com.dedicatedcode.kerros.engine.spatial.IndexedFeature;

import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the display name of every resolved node in the dataset's language and cleans it up.
 * <p>
 * A node is only localized while its name still is one of its feature's names, so names set
 * by an overlay earlier in the chain are cleaned but never replaced.
 */
class NameNormalizationPolicy implements SupplementationPolicy {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String language;
    private final String defaultLanguage;

    NameNormalizationPolicy(String language, String defaultLanguage) {
        this.language = language;
        this.defaultLanguage = defaultLanguage;
    }

    static void validate(PolicySpec spec, Set<Integer> declared, Path datasetDir) {
        spec.optionalString("language");
    }

    static SupplementationPolicy create(PolicySpec spec, PolicyResources resources) {
        return new NameNormalizationPolicy(spec.optionalString("language").orElse(null), resources.defaultLanguage());
    }

    static String normalize(String name) {
        String composed = Normalizer.normalize(name, Normalizer.Form.NFC);
        return WHITESPACE.matcher(composed.trim()).replaceAll(" ");
    }

    @Override
    public PolicyKind kind() {
        return PolicyKind.NAME_NORMALIZATION;
    }

    @Override
    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        List<String> preferred = preferredKeys(context.manifest().locale());
        DraftHierarchy current = draft;
        for (DraftNode node : draft.resolved()) {
            String name = normalize(node.name());
            Optional<AdminFeature> feature = context.index().feature(node.id()).map(IndexedFeature::feature);
            if (feature.isPresent() && isFeatureName(feature.get(), name)) {
                name = normalize(localized(feature.get(), preferred));
            }
            if (!name.equals(node.name())) {
                current = current.with(node.withName(name));
            }
        }
        return current;
    }

    private List<String> preferredKeys(LocaleSpec locale) {
        List<String> keys = new ArrayList<>();
        String lang = language != null ? language : locale.language();
        if (lang == null) {
            lang = defaultLanguage;
        }
        if (lang != null) {
            keys.add("name:" + lang);
        }
        for (String fallback : locale.nameFallbacks()) {
            keys.add("name:" + fallback);
        }
        return keys;
    }

    private static boolean isFeatureName(AdminFeature feature, String name) {
        if (normalize(feature.name()).equals(name)) {
            return true;
        }
        return feature.names().values().stream().map(NameNormalizationPolicy::normalize).anyMatch(name::equals);
    }

    private static String localized(AdminFeature feature, List<String> keys) {
        for (String key : keys) {
            String value = feature.names().get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return feature.name();
    }
}
