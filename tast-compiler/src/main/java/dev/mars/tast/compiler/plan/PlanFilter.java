/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tast.compiler.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Filters an already compiled plan by tag. The result equals compiling with
 * {@link Traversals#tagFiltered(TraversalStrategy, TagPredicate)} over the plan's
 * original strategy: retained steps keep their fields and relative order and are
 * renumbered from 1.
 */
public final class PlanFilter {

    private PlanFilter() {
    }

    public static Plan filter(Plan plan, TagPredicate predicate) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(predicate, "Tag predicate cannot be null");

        List<PlanStep> kept = new ArrayList<>();
        for (PlanStep step : plan.getSteps()) {
            if (predicate.test(new LinkedHashSet<>(step.getTags()))) {
                kept.add(step.withOrder(kept.size() + 1));
            }
        }
        return new Plan(plan.getName(), "tag-filtered:" + plan.getTraversal(), plan.getNodesTotal(),
                plan.getEdgesTotal(), plan.getConfig(), kept);
    }
}
