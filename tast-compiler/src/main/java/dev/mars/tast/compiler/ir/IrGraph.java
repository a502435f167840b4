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


package dev.mars.tast.compiler.ir;

import dev.mars.tast.core.LiteralValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One resolved graph: local nodes in declaration order followed by imported
 * copies, edges in declaration order, expanded fixtures and the graph config.
 */
public final class IrGraph {

    private final String name;
    private final String sourceName;
    private final List<IrNode> nodes;
    private final List<IrEdge> edges;
    private final Map<String, Map<String, LiteralValue>> fixtures;
    private final Map<String, LiteralValue> config;
    private final Map<String, IrNode> nodesByName;

    public IrGraph(String name, String sourceName, List<IrNode> nodes, List<IrEdge> edges,
                   Map<String, Map<String, LiteralValue>> fixtures, Map<String, LiteralValue> config) {
        this.name = Objects.requireNonNull(name, "Graph name cannot be null");
        this.sourceName = sourceName;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.fixtures = Collections.unmodifiableMap(new LinkedHashMap<>(fixtures));
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        Map<String, IrNode> byName = new LinkedHashMap<>();
        for (IrNode node : this.nodes) {
            byName.put(node.getName(), node);
        }
        this.nodesByName = Collections.unmodifiableMap(byName);
    }

    public String getName() {
        return name;
    }

    /**
     * The file the graph was declared in.
     */
    public String getSourceName() {
        return sourceName;
    }

    public List<IrNode> getNodes() {
        return nodes;
    }

    public Optional<IrNode> findNode(String nodeName) {
        return Optional.ofNullable(nodesByName.get(nodeName));
    }

    public List<IrEdge> getEdges() {
        return edges;
    }

    /**
     * Fixtures visible in the graph (file-level ones overlaid by graph-level ones), expanded.
     */
    public Map<String, Map<String, LiteralValue>> getFixtures() {
        return fixtures;
    }

    public Map<String, LiteralValue> getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "IrGraph{" + name + ", nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
