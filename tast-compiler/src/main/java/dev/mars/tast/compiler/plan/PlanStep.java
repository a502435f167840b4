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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a compiled plan with its steps, dependencies and data provenance.
 * Holds no references back into the graph it was compiled from.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
@JsonPropertyOrder({"order", "node", "description", "tags", "preconditions", "actions", "assertions",
        "depends_on", "inputs", "outputs"})
public final class PlanStep {

    public static final String PENDING = "pending";

    private final int order;
    private final String node;
    private final String description;
    private final List<String> tags;
    private final List<PlanStepEntry> preconditions;
    private final List<PlanStepEntry> actions;
    private final List<PlanStepEntry> assertions;
    private final List<String> dependsOn;
    private final Map<String, PlanInput> inputs;
    private final Map<String, String> outputs;

    private PlanStep(Builder builder) {
        if (builder.order < 1) {
            throw new IllegalArgumentException("Order must be at least 1, got " + builder.order);
        }
        this.order = builder.order;
        this.node = Objects.requireNonNull(builder.node, "Node name cannot be null");
        this.description = builder.description;
        this.tags = List.copyOf(builder.tags);
        this.preconditions = List.copyOf(builder.preconditions);
        this.actions = List.copyOf(builder.actions);
        this.assertions = List.copyOf(builder.assertions);
        this.dependsOn = List.copyOf(builder.dependsOn);
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inputs));
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.outputs));
    }

    public static Builder builder(String node) {
        return new Builder(node);
    }

    /**
     * A copy of this step at another position.
     */
    public PlanStep withOrder(int newOrder) {
        if (newOrder == order) {
            return this;
        }
        return new Builder(node)
                .order(newOrder)
                .description(description)
                .tags(tags)
                .preconditions(preconditions)
                .actions(actions)
                .assertions(assertions)
                .dependsOn(dependsOn)
                .inputs(inputs)
                .outputs(outputs)
                .build();
    }

    /**
     * One-based position in the plan.
     */
    public int getOrder() {
        return order;
    }

    public String getNode() {
        return node;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<PlanStepEntry> getPreconditions() {
        return preconditions;
    }

    public List<PlanStepEntry> getActions() {
        return actions;
    }

    public List<PlanStepEntry> getAssertions() {
        return assertions;
    }

    /**
     * All entries in source order: preconditions, actions, then assertions.
     */
    @JsonIgnore
    public int getEntryCount() {
        return preconditions.size() + actions.size() + assertions.size();
    }

    /**
     * Direct predecessors that appear earlier in the traversal.
     */
    @JsonProperty("depends_on")
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Map<String, PlanInput> getInputs() {
        return inputs;
    }

    /**
     * Declared and passed outputs, each mapped to {@link #PENDING}.
     */
    public Map<String, String> getOutputs() {
        return outputs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanStep that = (PlanStep) o;
        return order == that.order && node.equals(that.node) && Objects.equals(description, that.description)
                && tags.equals(that.tags) && preconditions.equals(that.preconditions)
                && actions.equals(that.actions) && assertions.equals(that.assertions)
                && dependsOn.equals(that.dependsOn) && inputs.equals(that.inputs) && outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(order, node, description, tags, preconditions, actions, assertions,
                dependsOn, inputs, outputs);
    }

    @Override
    public String toString() {
        return "PlanStep{" + order + ": " + node + ", depends_on=" + dependsOn + ", inputs=" + inputs + '}';
    }

    public static final class Builder {
        private final String node;
        private int order;
        private String description;
        private List<String> tags = List.of();
        private List<PlanStepEntry> preconditions = List.of();
        private List<PlanStepEntry> actions = List.of();
        private List<PlanStepEntry> assertions = List.of();
        private List<String> dependsOn = List.of();
        private Map<String, PlanInput> inputs = Map.of();
        private Map<String, String> outputs = Map.of();

        private Builder(String node) {
            this.node = node;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder preconditions(List<PlanStepEntry> preconditions) {
            this.preconditions = preconditions;
            return this;
        }

        public Builder actions(List<PlanStepEntry> actions) {
            this.actions = actions;
            return this;
        }

        public Builder assertions(List<PlanStepEntry> assertions) {
            this.assertions = assertions;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder inputs(Map<String, PlanInput> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public PlanStep build() {
            return new PlanStep(this);
        }
    }
}
