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
import dev.mars.tast.compiler.ir.IrEdge;
import dev.mars.tast.compiler.ir.IrNode;
import dev.mars.tast.compiler.ir.IrStep;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a traversal of a {@link DependencyGraph} into an immutable {@link Plan}.
 *
 * <p>For each node in traversal order the compiler records:
 * <ul>
 *   <li>{@code depends_on}: direct predecessors that appear earlier in the traversal;</li>
 *   <li>{@code inputs}: each required key traced back to the nearest upstream edge
 *       passing it ({@code from:<Node>}), else the node's static data
 *       ({@code static}), else {@code unresolved}; then any other keys passed on
 *       incoming edges;</li>
 *   <li>{@code outputs}: declared {@code provides} and keys passed on outgoing edges,
 *       all {@code pending};</li>
 *   <li>step parameter bindings, taken from the step's data, the inputs or the
 *       node's static data.</li>
 * </ul>
 * Nodes the traversal does not retain are skipped and the remaining steps are
 * numbered from 1.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class PlanCompiler {

    private static final Logger logger = LoggerFactory.getLogger(PlanCompiler.class);

    public Plan compile(DependencyGraph graph, TraversalStrategy strategy)
            throws CycleException, CompilationException {
        Objects.requireNonNull(graph, "Graph cannot be null");
        Objects.requireNonNull(strategy, "Strategy cannot be null");

        Traversal traversal = strategy.traverse(graph);
        DependencyGraph universe = traversal.getUniverse();

        Set<String> visited = new HashSet<>();
        List<PlanStep> steps = new ArrayList<>();
        for (IrNode node : traversal.getOrder()) {
            if (traversal.isRetained(node)) {
                steps.add(compileStep(universe, node, steps.size() + 1, visited));
            }
            visited.add(node.getName());
        }

        Plan plan = new Plan(graph.getName(), strategy.getName(), universe.nodeCount(), universe.edgeCount(),
                universe.getConfig(), steps);
        logger.debug("Compiled plan '{}' ({}) with {} of {} node(s)",
                plan.getName(), plan.getTraversal(), steps.size(), universe.nodeCount());
        return plan;
    }

    private PlanStep compileStep(DependencyGraph graph, IrNode node, int order, Set<String> earlier) {
        List<String> dependsOn = new ArrayList<>();
        for (String predecessor : graph.predecessors(node.getName())) {
            if (earlier.contains(predecessor)) {
                dependsOn.add(predecessor);
            }
        }

        Map<String, PlanInput> inputs = resolveInputs(graph, node);

        Map<String, String> outputs = new LinkedHashMap<>();
        for (String key : node.getProvides()) {
            outputs.put(key, PlanStep.PENDING);
        }
        for (IrEdge edge : graph.outgoingEdges(node.getName())) {
            for (String key : edge.getPasses()) {
                outputs.putIfAbsent(key, PlanStep.PENDING);
            }
        }

        List<PlanStepEntry> preconditions = new ArrayList<>();
        List<PlanStepEntry> actions = new ArrayList<>();
        List<PlanStepEntry> assertions = new ArrayList<>();
        for (IrStep step : node.getSteps()) {
            PlanStepEntry entry = new PlanStepEntry(step.getKind(), step.getKeyword().getText(), step.getText(),
                    step.getData(), bindParameters(step, inputs, node.getStaticData()));
            switch (step.getKind()) {
                case PRECONDITION:
                    preconditions.add(entry);
                    break;
                case ACTION:
                    actions.add(entry);
                    break;
                default:
                    assertions.add(entry);
                    break;
            }
        }

        return PlanStep.builder(node.getName())
                .order(order)
                .description(node.getDescription())
                .tags(new ArrayList<>(node.getTags()))
                .preconditions(preconditions)
                .actions(actions)
                .assertions(assertions)
                .dependsOn(dependsOn)
                .inputs(inputs)
                .outputs(outputs)
                .build();
    }

    private Map<String, PlanInput> resolveInputs(DependencyGraph graph, IrNode node) {
        Map<String, PlanInput> inputs = new LinkedHashMap<>();
        for (String key : node.getRequires()) {
            IrEdge edge = findNearestProvider(graph, node.getName(), key);
            if (edge != null) {
                inputs.put(key, PlanInput.from(edge.getSource(), edge.getData().get(key)));
            } else if (node.getStaticData().containsKey(key)) {
                inputs.put(key, PlanInput.staticValue(node.getStaticData().get(key)));
            } else {
                inputs.put(key, PlanInput.unresolved());
            }
        }
        for (IrEdge edge : graph.incomingEdges(node.getName())) {
            for (String key : edge.getPasses()) {
                inputs.putIfAbsent(key, PlanInput.from(edge.getSource(), edge.getData().get(key)));
            }
        }
        return inputs;
    }

    /**
     * Breadth-first search against edge direction for the closest edge passing {@code key}.
     * Edges into the same node are examined in declaration order.
     */
    private IrEdge findNearestProvider(DependencyGraph graph, String nodeName, String key) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(nodeName);
        queue.add(nodeName);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (IrEdge edge : graph.incomingEdges(current)) {
                if (edge.getPasses().contains(key)) {
                    return edge;
                }
            }
            for (IrEdge edge : graph.incomingEdges(current)) {
                if (seen.add(edge.getSource())) {
                    queue.add(edge.getSource());
                }
            }
        }
        return null;
    }

    private Map<String, ParameterBinding> bindParameters(IrStep step, Map<String, PlanInput> inputs,
                                                         Map<String, LiteralValue> staticData) {
        Map<String, ParameterBinding> bindings = new LinkedHashMap<>();
        for (String parameter : step.getParameters()) {
            if (step.getData().containsKey(parameter)) {
                bindings.put(parameter, new ParameterBinding(ParameterBinding.STEP, step.getData().get(parameter)));
            } else if (inputs.containsKey(parameter)) {
                PlanInput input = inputs.get(parameter);
                bindings.put(parameter, new ParameterBinding(input.getSource(), input.getValue()));
            } else if (staticData.containsKey(parameter)) {
                bindings.put(parameter, new ParameterBinding(PlanInput.STATIC, staticData.get(parameter)));
            } else {
                bindings.put(parameter, new ParameterBinding(PlanInput.UNRESOLVED, null));
            }
        }
        return bindings;
    }
}
