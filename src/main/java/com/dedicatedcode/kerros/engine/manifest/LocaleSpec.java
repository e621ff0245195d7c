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

import java.util.List;

/**
 * Display configuration of a dataset: which localized names to prefer and how the
 * summary line is put together.
 */
public record LocaleSpec(String language, List<String> nameFallbacks, SummaryOrder summaryOrder, String summarySeparator) {

    public static final LocaleSpec DEFAULTS = new LocaleSpec(null, List.of(), SummaryOrder.COARSE_FIRST, ", ");

    public LocaleSpec {
        nameFallbacks = List.copyOf(nameFallbacks);
    }
}
