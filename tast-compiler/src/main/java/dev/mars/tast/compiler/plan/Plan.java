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
import dev.mars.tast.core.LiteralValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The compiled, immutable result of one traversal of one graph.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
@JsonPropertyOrder({"name", "traversal", "nodes_total", "edges_total", "config", "steps"})
public final class Plan {

    private final String name;
    private final String traversal;
    private final int nodesTotal;
    private final int edgesTotal;
    private final Map<String, LiteralValue> config;
    private final List<PlanStep> steps;

    public Plan(String name, String traversal, int nodesTotal, int edgesTotal,
                Map<String, LiteralValue> config, List<PlanStep> steps) {
        this.name = Objects.requireNonNull(name, "Plan name cannot be null");
        this.traversal = Objects.requireNonNull(traversal, "Traversal cannot be null");
        this.nodesTotal = nodesTotal;
        this.edgesTotal = edgesTotal;
        this.config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        this.steps = List.copyOf(steps);
    }

    /**
     * The name of the graph the plan was compiled from.
     */
    public String getName() {
        return name;
    }

    /**
     * The strategy tag, e.g. {@code topological} or {@code tag-filtered:dfs}.
     */
    public String getTraversal() {
        return traversal;
    }

    /**
     * Node count of the traversal universe, independent of filtering.
     */
    @JsonProperty("nodes_total")
    public int getNodesTotal() {
        return nodesTotal;
    }

    @JsonProperty("edges_total")
    public int getEdgesTotal() {
        return edgesTotal;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, LiteralValue> getConfig() {
        return config;
    }

    public List<PlanStep> getSteps() {
        return steps;
    }

    @JsonIgnore
    public int size() {
        return steps.size();
    }

    public Optional<PlanStep> findStep(String nodeName) {
        return steps.stream().filter(s -> s.getNode().equals(nodeName)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Plan plan = (Plan) o;
        return nodesTotal == plan.nodesTotal && edgesTotal == plan.edgesTotal && name.equals(plan.name)
                && traversal.equals(plan.traversal) && config.equals(plan.config) && steps.equals(plan.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, traversal, nodesTotal, edgesTotal, config, steps);
    }

    @Override
    public String toString() {
        return "Plan{" + name + ", traversal=" + traversal + ", steps=" + steps.size()
                + "/" + nodesTotal + " nodes, " + edgesTotal + " edges}";
    }
}
