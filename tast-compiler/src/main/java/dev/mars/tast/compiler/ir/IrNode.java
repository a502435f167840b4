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
import dev.mars.tast.core.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A validated node. Imported nodes are copies of a node from another graph,
 * named {@code Graph.Node} and appended after the graph's own nodes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class IrNode {

    private final String name;
    private final String description;
    private final List<IrStep> steps;
    private final Set<String> tags;
    private final Set<String> requires;
    private final Set<String> provides;
    private final Map<String, LiteralValue> staticData;
    private final int declarationIndex;
    private final String originGraph;
    private final boolean imported;
    private final SourceSpan span;

    private IrNode(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Node name cannot be null");
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.requires = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requires));
        this.provides = Collections.unmodifiableSet(new LinkedHashSet<>(builder.provides));
        this.staticData = Collections.unmodifiableMap(new LinkedHashMap<>(builder.staticData));
        this.declarationIndex = builder.declarationIndex;
        this.originGraph = Objects.requireNonNull(builder.originGraph, "Origin graph cannot be null");
        this.imported = builder.imported;
        this.span = builder.span != null ? builder.span : SourceSpan.unknown();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Copies this node into another graph under a qualified name.
     */
    public IrNode asImported(String qualifiedName, int declarationIndex) {
        Builder copy = new Builder(qualifiedName)
                .description(description)
                .tags(tags)
                .requires(requires)
                .provides(provides)
                .staticData(staticData)
                .declarationIndex(declarationIndex)
                .originGraph(originGraph)
                .imported(true)
                .span(span);
        steps.forEach(copy::step);
        return copy.build();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<IrStep> getSteps() {
        return steps;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getRequires() {
        return requires;
    }

    public Set<String> getProvides() {
        return provides;
    }

    /**
     * Data attached to the node itself: attached fixtures overlaid with its config block.
     */
    public Map<String, LiteralValue> getStaticData() {
        return staticData;
    }

    /**
     * Zero-based position in the owning graph's node list.
     */
    public int getDeclarationIndex() {
        return declarationIndex;
    }

    /**
     * The graph the node was declared in.
     */
    public String getOriginGraph() {
        return originGraph;
    }

    public boolean isImported() {
        return imported;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "IrNode{" + name + (imported ? " (imported)" : "") + ", index=" + declarationIndex + '}';
    }

    public static final class Builder {
        private final String name;
        private String description;
        private final List<IrStep> steps = new ArrayList<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> requires = new LinkedHashSet<>();
        private final Set<String> provides = new LinkedHashSet<>();
        private final Map<String, LiteralValue> staticData = new LinkedHashMap<>();
        private int declarationIndex;
        private String originGraph;
        private boolean imported;
        private SourceSpan span;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(IrStep step) {
            steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder tags(Set<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder requires(Set<String> values) {
            requires.addAll(values);
            return this;
        }

        public Builder provides(Set<String> values) {
            provides.addAll(values);
            return this;
        }

        public Builder staticData(Map<String, LiteralValue> values) {
            staticData.putAll(values);
            return this;
        }

        public Builder declarationIndex(int declarationIndex) {
            this.declarationIndex = declarationIndex;
            return this;
        }

        public Builder originGraph(String originGraph) {
            this.originGraph = originGraph;
            return this;
        }

        public Builder imported(boolean imported) {
            this.imported = imported;
            return this;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public IrNode build() {
            return new IrNode(this);
        }
    }
}
