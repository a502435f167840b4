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

import dev.mars.tast.compiler.graph.DependencyGraph;
import dev.mars.tast.compiler.ir.IrNode;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The outcome of running a {@link TraversalStrategy}: the graph the traversal ran
 * over, the visiting order, and which of the visited nodes end up in the plan.
 * Plan fields are computed over the full order; only retained nodes are emitted.
 */
public final class Traversal {

    private final DependencyGraph universe;
    private final List<IrNode> order;
    private final Predicate<IrNode> retained;

    public Traversal(DependencyGraph universe, List<IrNode> order) {
        this(universe, order, node -> true);
    }

    public Traversal(DependencyGraph universe, List<IrNode> order, Predicate<IrNode> retained) {
        this.universe = Objects.requireNonNull(universe, "Universe cannot be null");
        this.order = List.copyOf(Objects.requireNonNull(order, "Order cannot be null"));
        this.retained = Objects.requireNonNull(retained, "Retention predicate cannot be null");
    }

    public DependencyGraph getUniverse() {
        return universe;
    }

    public List<IrNode> getOrder() {
        return order;
    }

    public boolean isRetained(IrNode node) {
        return retained.test(node);
    }

    /**
     * A traversal with the same order that additionally drops nodes failing {@code filter}.
     */
    public Traversal retainOnly(Predicate<IrNode> filter) {
        return new Traversal(universe, order, retained.and(filter));
    }
}
