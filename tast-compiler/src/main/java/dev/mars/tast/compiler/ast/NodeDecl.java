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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A {@code node Name { ... }} declaration as parsed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class NodeDecl {

    private final String name;
    private final String description;
    private final List<StepDecl> steps;
    private final Set<String> tags;
    private final Set<String> requires;
    private final Set<String> provides;
    private final DataBlock config;
    private final List<DataEntry> fixtureAttachments;
    private final SourceSpan span;

    private NodeDecl(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Node name cannot be null");
        this.description = builder.description;
        this.steps = List.copyOf(builder.steps);
        this.tags = immutableOrdered(builder.tags);
        this.requires = immutableOrdered(builder.requires);
        this.provides = immutableOrdered(builder.provides);
        this.config = builder.config != null ? builder.config : DataBlock.empty();
        this.fixtureAttachments = List.copyOf(builder.fixtureAttachments);
        this.span = builder.span != null ? builder.span : SourceSpan.unknown();
    }

    static Set<String> immutableOrdered(Set<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * The {@code describe} text, or null.
     */
    public String getDescription() {
        return description;
    }

    public List<StepDecl> getSteps() {
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

    public DataBlock getConfig() {
        return config;
    }

    /**
     * Fixtures attached with {@code fixture Name} inside the node body, as spread entries.
     */
    public List<DataEntry> getFixtureAttachments() {
        return fixtureAttachments;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "NodeDecl{" + name + ", steps=" + steps.size() + ", tags=" + tags + '}';
    }

    public static final class Builder {
        private final String name;
        private String description;
        private final List<StepDecl> steps = new ArrayList<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> requires = new LinkedHashSet<>();
        private final Set<String> provides = new LinkedHashSet<>();
        private DataBlock config;
        private final List<DataEntry> fixtureAttachments = new ArrayList<>();
        private SourceSpan span;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder step(StepDecl step) {
            steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        public Builder tags(List<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder requires(List<String> values) {
            requires.addAll(values);
            return this;
        }

        public Builder provides(List<String> values) {
            provides.addAll(values);
            return this;
        }

        /**
         * Sets the config block. A second block is merged after the first.
         */
        public Builder config(DataBlock block) {
            if (config == null || config.isEmpty()) {
                config = block;
            } else {
                List<DataEntry> merged = new ArrayList<>(config.getEntries());
                merged.addAll(block.getEntries());
                config = new DataBlock(merged, config.getSpan().merge(block.getSpan()));
            }
            return this;
        }

        public Builder attachFixture(DataEntry spread) {
            fixtureAttachments.add(spread);
            return this;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public NodeDecl build() {
            return new NodeDecl(this);
        }
    }
}
