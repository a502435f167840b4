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
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Factory for the built-in {@link TraversalStrategy} implementations.
 * Every strategy visits children in edge declaration order, so the same graph
 * always yields the same order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public final class Traversals {

    private static final TraversalStrategy TOPOLOGICAL = new TraversalStrategy() {
        @Override
        public String getName() {
            return "topological";
        }

        @Override
        public Traversal traverse(DependencyGraph graph) throws CycleException {
            return new Traversal(graph, graph.topologicalOrder());
        }

        @Override
        public String toString() {
            return getName();
        }
    };

    private Traversals() {
    }

    /**
     * Kahn's algorithm with ties broken by declaration order. Fails on cycles.
     */
    public static TraversalStrategy topological() {
        return TOPOLOGICAL;
    }

    /**
     * Pre-order depth-first walk from {@code root}; each reachable node is visited once.
     */
    public static TraversalStrategy depthFirst(String root) {
        Objects.requireNonNull(root, "Root cannot be null");
        return new Named("dfs") {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CompilationException {
                requireNode(graph, root);
                List<IrNode> order = new ArrayList<>();
                Set<String> visited = new HashSet<>();
                Deque<String> stack = new ArrayDeque<>();
                stack.push(root);
                while (!stack.isEmpty()) {
                    String current = stack.pop();
                    if (!visited.add(current)) {
                        continue;
                    }
                    order.add(graph.findNode(current).orElseThrow());
                    List<String> children = graph.successors(current);
                    for (int i = children.size() - 1; i >= 0; i--) {
                        if (!visited.contains(children.get(i))) {
                            stack.push(children.get(i));
                        }
                    }
                }
                return new Traversal(graph, order);
            }
        };
    }

    /**
     * Breadth-first walk from {@code root}; each reachable node is visited once.
     */
    public static TraversalStrategy breadthFirst(String root) {
        Objects.requireNonNull(root, "Root cannot be null");
        return new Named("bfs") {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CompilationException {
                List<IrNode> order = new ArrayList<>();
                for (String name : graph.reachableFrom(root)) {
                    order.add(graph.findNode(name).orElseThrow());
                }
                return new Traversal(graph, order);
            }
        };
    }

    /**
     * The path from {@code from} to {@code to} with the fewest edges, found by
     * unweighted breadth-first search. Among equally short paths the one using
     * earlier-declared edges wins.
     */
    public static TraversalStrategy shortestPath(String from, String to) {
        Objects.requireNonNull(from, "Start node cannot be null");
        Objects.requireNonNull(to, "End node cannot be null");
        return new Named("shortest-path") {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CompilationException {
                requireNode(graph, from);
                requireNode(graph, to);
                Map<String, String> parents = new HashMap<>();
                Deque<String> queue = new ArrayDeque<>();
                parents.put(from, null);
                queue.add(from);
                while (!queue.isEmpty() && !parents.containsKey(to)) {
                    String current = queue.poll();
                    for (String successor : graph.successors(current)) {
                        if (!parents.containsKey(successor)) {
                            parents.put(successor, current);
                            queue.add(successor);
                        }
                    }
                }
                if (!parents.containsKey(to)) {
                    throw CompilationException.noPath(from, to);
                }
                List<IrNode> path = new ArrayList<>();
                for (String step = to; step != null; step = parents.get(step)) {
                    path.add(graph.findNode(step).orElseThrow());
                }
                Collections.reverse(path);
                return new Traversal(graph, path);
            }
        };
    }

    /**
     * Runs {@code base} and keeps only nodes whose tags satisfy {@code predicate},
     * without changing their relative order.
     */
    public static TraversalStrategy tagFiltered(TraversalStrategy base, TagPredicate predicate) {
        Objects.requireNonNull(base, "Base strategy cannot be null");
        Objects.requireNonNull(predicate, "Tag predicate cannot be null");
        return new Named("tag-filtered:" + base.getName()) {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CycleException, CompilationException {
                return base.traverse(graph).retainOnly(node -> predicate.test(node.getTags()));
            }
        };
    }

    /**
     * Restricts the graph to the subgraph induced by {@code nodeNames}, then runs {@code base}.
     */
    public static TraversalStrategy subgraph(Collection<String> nodeNames, TraversalStrategy base) {
        Objects.requireNonNull(base, "Base strategy cannot be null");
        Set<String> names = new LinkedHashSet<>(Objects.requireNonNull(nodeNames, "Node names cannot be null"));
        return new Named("subgraph:" + base.getName()) {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CycleException, CompilationException {
                return base.traverse(graph.subgraph(names));
            }
        };
    }

    /**
     * Resolves {@code topological}, {@code dfs} or {@code bfs} by name. The root is
     * only used by the rooted strategies. Without one they start from the graph's
     * first root, or from its first declared node when every node has a
     * predecessor; an empty graph yields an empty traversal.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static TraversalStrategy byName(String name, String root) {
        Objects.requireNonNull(name, "Strategy name cannot be null");
        boolean rooted = root != null && !root.isBlank();
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "topological":
                return topological();
            case "dfs":
                return rooted ? depthFirst(root) : fromDefaultRoot("dfs", Traversals::depthFirst);
            case "bfs":
                return rooted ? breadthFirst(root) : fromDefaultRoot("bfs", Traversals::breadthFirst);
            default:
                throw new IllegalArgumentException("Unknown traversal strategy '" + name + "'");
        }
    }

    private static TraversalStrategy fromDefaultRoot(String name, Function<String, TraversalStrategy> rootedStrategy) {
        return new Named(name) {
            @Override
            public Traversal traverse(DependencyGraph graph) throws CycleException, CompilationException {
                if (graph.nodeCount() == 0) {
                    return new Traversal(graph, List.of());
                }
                List<String> roots = graph.roots();
                String start = roots.isEmpty() ? graph.getNodes().get(0).getName() : roots.get(0);
                return rootedStrategy.apply(start).traverse(graph);
            }
        };
    }

    private static void requireNode(DependencyGraph graph, String nodeName) throws CompilationException {
        if (!graph.contains(nodeName)) {
            throw CompilationException.unknownNode(graph.getName(), nodeName);
        }
    }

    private abstract static class Named implements TraversalStrategy {
        private final String name;

        Named(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
