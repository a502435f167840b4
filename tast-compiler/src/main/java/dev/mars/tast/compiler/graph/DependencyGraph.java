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


package dev.mars.tast.compiler.graph;

import dev.mars.tast.compiler.ir.IrEdge;
import dev.mars.tast.compiler.ir.IrGraph;
import dev.mars.tast.compiler.ir.IrNode;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed graph view over one {@link IrGraph}: vertices are nodes in declaration
 * order, arcs are edges in declaration order.
 * Provides topological sorting, cycle detection, reachability and induced subgraphs.
 *
 * <p>Instances are immutable; every query walks the same read-only adjacency, so
 * one graph may be traversed from several threads at once.
 */
public final class DependencyGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final String name;
    private final List<IrNode> nodes;
    private final List<IrEdge> edges;
    private final Map<String, LiteralValue> config;
    private final Map<String, IrNode> nodesByName;
    private final Map<String, Integer> positions;
    private final Map<String, List<IrEdge>> outgoing;
    private final Map<String, List<IrEdge>> incoming;

    private DependencyGraph(String name, List<IrNode> nodes, List<IrEdge> edges, Map<String, LiteralValue> config) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.config = config;

        Map<String, IrNode> byName = new LinkedHashMap<>();
        Map<String, Integer> index = new HashMap<>();
        Map<String, List<IrEdge>> out = new HashMap<>();
        Map<String, List<IrEdge>> in = new HashMap<>();
        for (IrNode node : this.nodes) {
            index.put(node.getName(), byName.size());
            byName.put(node.getName(), node);
            out.put(node.getName(), new ArrayList<>());
            in.put(node.getName(), new ArrayList<>());
        }
        for (IrEdge edge : this.edges) {
            if (!byName.containsKey(edge.getSource()) || !byName.containsKey(edge.getTarget())) {
                throw new IllegalArgumentException("Edge " + edge + " references a node outside graph '" + name + "'");
            }
            out.get(edge.getSource()).add(edge);
            in.get(edge.getTarget()).add(edge);
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));

        this.nodesByName = Collections.unmodifiableMap(byName);
        this.positions = index;
        this.outgoing = out;
        this.incoming = in;
    }

    /**
     * Builds the graph view of a validated IR graph.
     */
    public static DependencyGraph of(IrGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        return new DependencyGraph(graph.getName(), graph.getNodes(), graph.getEdges(), graph.getConfig());
    }

    public String getName() {
        return name;
    }

    /**
     * Nodes in declaration order.
     */
    public List<IrNode> getNodes() {
        return nodes;
    }

    public List<IrEdge> getEdges() {
        return edges;
    }

    public Map<String, LiteralValue> getConfig() {
        return config;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(String nodeName) {
        return nodesByName.containsKey(nodeName);
    }

    public Optional<IrNode> findNode(String nodeName) {
        return Optional.ofNullable(nodesByName.get(nodeName));
    }

    /**
     * Position of the node in declaration order, used for deterministic tie-breaking.
     */
    public int positionOf(String nodeName) {
        Integer position = positions.get(nodeName);
        if (position == null) {
            throw new IllegalArgumentException("Unknown node '" + nodeName + "'");
        }
        return position;
    }

    public List<IrEdge> outgoingEdges(String nodeName) {
        return outgoing.getOrDefault(nodeName, List.of());
    }

    public List<IrEdge> incomingEdges(String nodeName) {
        return incoming.getOrDefault(nodeName, List.of());
    }

    /**
     * Distinct direct successors, in edge declaration order.
     */
    public List<String> successors(String nodeName) {
        Set<String> result = new LinkedHashSet<>();
        for (IrEdge edge : outgoingEdges(nodeName)) {
            result.add(edge.getTarget());
        }
        return new ArrayList<>(result);
    }

    /**
     * Distinct direct predecessors, in edge declaration order.
     */
    public List<String> predecessors(String nodeName) {
        Set<String> result = new LinkedHashSet<>();
        for (IrEdge edge : incomingEdges(nodeName)) {
            result.add(edge.getSource());
        }
        return new ArrayList<>(result);
    }

    /**
     * Nodes without incoming edges, in declaration order.
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (IrNode node : nodes) {
            if (incomingEdges(node.getName()).isEmpty()) {
                roots.add(node.getName());
            }
        }
        return roots;
    }

    /**
     * Nodes without outgoing edges, in declaration order.
     */
    public List<String> leaves() {
        List<String> leaves = new ArrayList<>();
        for (IrNode node : nodes) {
            if (outgoingEdges(node.getName()).isEmpty()) {
                leaves.add(node.getName());
            }
        }
        return leaves;
    }

    /**
     * Finds a cycle with an iterative three-color depth-first search. Starting nodes
     * and children are taken in declaration order; the first back edge found
     * yields the cycle by unwinding the active path.
     *
     * @return the cycle with its first node repeated at the end, e.g. {@code [A, B, A]},
     *         or an empty list if the graph is acyclic
     */
    public List<String> findCycle() {
        Map<String, Color> colors = new HashMap<>();
        for (IrNode node : nodes) {
            colors.put(node.getName(), Color.WHITE);
        }

        for (IrNode start : nodes) {
            if (colors.get(start.getName()) != Color.WHITE) {
                continue;
            }
            List<String> path = new ArrayList<>();
            List<Integer> nextEdge = new ArrayList<>();
            path.add(start.getName());
            nextEdge.add(0);
            colors.put(start.getName(), Color.GRAY);

            while (!path.isEmpty()) {
                int top = path.size() - 1;
                String current = path.get(top);
                List<IrEdge> out = outgoingEdges(current);
                int next = nextEdge.get(top);
                if (next >= out.size()) {
                    colors.put(current, Color.BLACK);
                    path.remove(top);
                    nextEdge.remove(top);
                    continue;
                }
                nextEdge.set(top, next + 1);
                String target = out.get(next).getTarget();
                Color color = colors.get(target);
                if (color == Color.GRAY) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    cycle.add(target);
                    return cycle;
                }
                if (color == Color.WHITE) {
                    colors.put(target, Color.GRAY);
                    path.add(target);
                    nextEdge.add(0);
                }
            }
        }
        return List.of();
    }

    public boolean hasCycles() {
        return !findCycle().isEmpty();
    }

    /**
     * Nodes reachable from {@code root} along outgoing edges, including the root,
     * in breadth-first order.
     *
     * @throws CompilationException if the root is not in the graph
     */
    public Set<String> reachableFrom(String root) throws CompilationException {
        requireNode(root);
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(root);
        queue.add(root);
        while (!queue.isEmpty()) {
            for (String successor : successors(queue.poll())) {
                if (seen.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return Collections.unmodifiableSet(seen);
    }

    /**
     * The subgraph induced by {@code names}: those nodes, in their original order,
     * and only the edges with both endpoints among them.
     *
     * @throws CompilationException if a name is not in the graph
     */
    public DependencyGraph subgraph(Collection<String> names) throws CompilationException {
        Objects.requireNonNull(names, "Node names cannot be null");
        for (String nodeName : names) {
            requireNode(nodeName);
        }
        Set<String> keep = new LinkedHashSet<>(names);
        List<IrNode> keptNodes = new ArrayList<>();
        for (IrNode node : nodes) {
            if (keep.contains(node.getName())) {
                keptNodes.add(node);
            }
        }
        List<IrEdge> keptEdges = new ArrayList<>();
        for (IrEdge edge : edges) {
            if (keep.contains(edge.getSource()) && keep.contains(edge.getTarget())) {
                keptEdges.add(edge);
            }
        }
        return new DependencyGraph(name, keptNodes, keptEdges, config);
    }

    /**
     * Kahn's algorithm: repeatedly takes the earliest-declared node whose remaining
     * in-degree is zero.
     *
     * @throws CycleException carrying {@link #findCycle()} if no full ordering exists
     */
    public List<IrNode> topologicalOrder() throws CycleException {
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> Integer.compare(positionOf(a), positionOf(b)));
        for (IrNode node : nodes) {
            int degree = incomingEdges(node.getName()).size();
            inDegree.put(node.getName(), degree);
            if (degree == 0) {
                ready.add(node.getName());
            }
        }

        List<IrNode> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(nodesByName.get(current));
            for (IrEdge edge : outgoingEdges(current)) {
                int remaining = inDegree.merge(edge.getTarget(), -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(edge.getTarget());
                }
            }
        }

        if (order.size() != nodes.size()) {
            throw new CycleException(name, findCycle());
        }
        return order;
    }

    private void requireNode(String nodeName) throws CompilationException {
        if (!contains(nodeName)) {
            throw CompilationException.unknownNode(name, nodeName);
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "name=" + name +
                ", nodes=" + nodesByName.keySet() +
                ", edges=" + edges.size() +
                '}';
    }
}
