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
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;

/**
 * Selects and orders the nodes of a graph for a plan. Implementations are
 * immutable and never modify the graph.
 *
 * @see Traversals
 */
public interface TraversalStrategy {

    /**
     * The tag recorded on the plan, e.g. {@code topological} or {@code subgraph:bfs}.
     */
    String getName();

    Traversal traverse(DependencyGraph graph) throws CycleException, CompilationException;
}
