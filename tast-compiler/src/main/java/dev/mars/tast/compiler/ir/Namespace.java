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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The merged view over every graph of a build, keyed by qualified name
 * {@code Graph.Node}. Built once per {@link IrBuilder#build} call by a single thread
 * and discarded afterwards.
 */
public final class Namespace {

    private final Map<String, IrNode> nodes = new LinkedHashMap<>();
    private final Set<String> graphs = new LinkedHashSet<>();

    public static String qualify(String graphName, String nodeName) {
        return graphName + "." + nodeName;
    }

    void declareGraph(String graphName) {
        graphs.add(Objects.requireNonNull(graphName, "Graph name cannot be null"));
    }

    void register(String graphName, IrNode node) {
        nodes.put(qualify(graphName, node.getName()), node);
    }

    public boolean containsGraph(String graphName) {
        return graphs.contains(graphName);
    }

    public Optional<IrNode> find(String graphName, String nodeName) {
        return Optional.ofNullable(nodes.get(qualify(graphName, nodeName)));
    }

    public Set<String> getQualifiedNames() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }
}
