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

/**
 * One step of the supplementation chain.
 * <p>
 * Implementations are pure: the result depends only on the draft and the context, no state
 * is kept between calls and no I/O happens. A policy may fill or replace holes and rewrite
 * display fields of resolved nodes; it must never drop, move or re-identify a resolved node.
 * Applying a policy to its own output must not change it.
 */
public interface SupplementationPolicy {

    PolicyKind kind();

    DraftHierarchy apply(DraftHierarchy draft, PolicyContext context);
}
