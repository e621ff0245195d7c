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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs a dataset's policy chain in declared order over a draft hierarchy.
 * <p>
 * After every step the pipeline checks that no resolved node was dropped or re-identified;
 * a step that breaks this is discarded and the chain goes on with the previous draft.
 * A failing step is treated the same way, so holes it would have filled stay holes.
 */
public class SupplementationPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SupplementationPipeline.class);

    private final List<SupplementationPolicy> policies;

    public SupplementationPipeline(List<SupplementationPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    public List<SupplementationPolicy> policies() {
        return policies;
    }

    public DraftHierarchy apply(DraftHierarchy draft, PolicyContext context) {
        DraftHierarchy current = draft;
        for (SupplementationPolicy policy : policies) {
            DraftHierarchy next;
            try {
                next = policy.apply(current, context);
            } catch (RuntimeException e) {
                logger.warn("Policy {} failed at {}, keeping previous draft", policy.kind().policyName(), context.point(), e);
                continue;
            }
            if (!preservesResolved(current, next)) {
                logger.warn("Policy {} altered resolved levels at {}, discarding its output",
                        policy.kind().policyName(), context.point());
                continue;
            }
            if (logger.isDebugEnabled() && !next.equals(current)) {
                logger.debug("Policy {} changed draft {} -> {}", policy.kind().policyName(), current, next);
            }
            current = next;
        }
        return current;
    }

    private boolean preservesResolved(DraftHierarchy before, DraftHierarchy after) {
        if (after == null || !before.levels().equals(after.levels())) {
            return false;
        }
        for (DraftNode node : before.resolved()) {
            Optional<DraftNode> kept = after.node(node.level());
            if (kept.isEmpty() || !kept.get().id().equals(node.id())) {
                return false;
            }
        }
        return true;
    }
}
