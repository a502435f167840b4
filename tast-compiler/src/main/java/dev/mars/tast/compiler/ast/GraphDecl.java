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


package dev.mars.tast.compiler.ast;

import dev.mars.tast.core.SourceSpan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code graph Name { ... }}: nodes and edges in declaration order, graph-scoped
 * fixtures and the graph's config block.
 */
public final class GraphDecl {

    private final String name;
    private final List<NodeDecl> nodes;
    private final List<EdgeDecl> edges;
    private final List<FixtureDecl> fixtures;
    private final DataBlock config;
    private final SourceSpan span;

    public GraphDecl(String name, List<NodeDecl> nodes, List<EdgeDecl> edges,
                     List<FixtureDecl> fixtures, DataBlock config, SourceSpan span) {
        this.name = Objects.requireNonNull(name, "Graph name cannot be null");
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.fixtures = List.copyOf(fixtures);
        this.config = config != null ? config : DataBlock.empty();
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public String getName() {
        return name;
    }

    public List<NodeDecl> getNodes() {
        return nodes;
    }

    public Optional<NodeDecl> findNode(String nodeName) {
        return nodes.stream().filter(n -> n.getName().equals(nodeName)).findFirst();
    }

    public List<EdgeDecl> getEdges() {
        return edges;
    }

    public List<FixtureDecl> getFixtures() {
        return fixtures;
    }

    public DataBlock getConfig() {
        return config;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "GraphDecl{" + name + ", nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
