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

import dev.mars.tast.compiler.ast.DataBlock;
import dev.mars.tast.compiler.ast.DataEntry;
import dev.mars.tast.compiler.ast.EdgeDecl;
import dev.mars.tast.compiler.ast.FixtureDecl;
import dev.mars.tast.compiler.ast.GraphDecl;
import dev.mars.tast.compiler.ast.NodeDecl;
import dev.mars.tast.compiler.ast.QualifiedName;
import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.ast.StepDecl;
import dev.mars.tast.config.ExcessPassesPolicy;
import dev.mars.tast.config.TastConfiguration;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;
import dev.mars.tast.core.ValidationResult;
import dev.mars.tast.core.exceptions.ImportException;
import dev.mars.tast.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a validated {@link IrProgram} from parsed source files.
 *
 * <p>Imports are resolved first and their failures are fatal. Every other problem
 * (duplicate names, unknown fixtures, unknown edge endpoints, unmet
 * {@code requires}, unproducible passed data and, depending on
 * {@link ExcessPassesPolicy}, excess passed data) is collected across all graphs
 * and reported together in one {@link ValidationException}.
 *
 * <p>Not thread-safe; each build uses its own {@link Namespace}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class IrBuilder {

    private static final Logger logger = LoggerFactory.getLogger(IrBuilder.class);

    private final ExcessPassesPolicy excessPassesPolicy;
    private final ImportResolver importResolver;

    public IrBuilder() {
        this(ExcessPassesPolicy.IGNORE);
    }

    public IrBuilder(TastConfiguration configuration) {
        this(Objects.requireNonNull(configuration, "Configuration cannot be null").getExcessPassesPolicy());
    }

    public IrBuilder(ExcessPassesPolicy excessPassesPolicy) {
        this.excessPassesPolicy = Objects.requireNonNull(excessPassesPolicy, "Excess passes policy cannot be null");
        this.importResolver = new ImportResolver();
    }

    public ExcessPassesPolicy getExcessPassesPolicy() {
        return excessPassesPolicy;
    }

    /**
     * Builds and validates the given files.
     *
     * @throws ImportException if an import cannot be resolved
     * @throws ValidationException if any semantic error is found
     */
    public IrProgram build(List<SourceFile> files) throws ImportException, ValidationException {
        Objects.requireNonNull(files, "Files cannot be null");
        Map<String, Set<String>> imports = importResolver.resolve(files);

        ValidationResult result = new ValidationResult();
        Namespace namespace = new Namespace();
        List<PendingGraph> pending = new ArrayList<>();

        for (SourceFile file : files) {
            String fileKey = ImportResolver.normalize(file.getName());
            FixtureScope fileScope = new FixtureScope(null, file.getFixtures(), result);
            Set<String> visible = new LinkedHashSet<>(imports.getOrDefault(fileKey, Set.of()));
            for (GraphDecl decl : file.getGraphs()) {
                visible.add(decl.getName());
            }
            for (GraphDecl decl : file.getGraphs()) {
                if (namespace.containsGraph(decl.getName())) {
                    result.addError(ValidationResult.Code.DUPLICATE_GRAPH, decl.getSpan(),
                            "Duplicate graph '" + decl.getName() + "'");
                    continue;
                }
                namespace.declareGraph(decl.getName());
                FixtureScope graphScope = new FixtureScope(fileScope, decl.getFixtures(), result);
                PendingGraph graph = new PendingGraph(file.getName(), decl, graphScope, visible);
                buildNodes(graph, namespace, result);
                pending.add(graph);
            }
        }

        List<IrGraph> graphs = new ArrayList<>();
        for (PendingGraph graph : pending) {
            graphs.add(buildGraph(graph, namespace, result));
        }

        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warn("{}", warning);
        }
        if (!result.isValid()) {
            logger.debug("IR validation failed with {} error(s)", result.getErrorCount());
            throw new ValidationException(result);
        }
        logger.debug("Built IR with {} graph(s) over {} node(s)", graphs.size(), namespace.size());
        return new IrProgram(graphs, result.getWarnings());
    }

    private void buildNodes(PendingGraph graph, Namespace namespace, ValidationResult result) {
        String graphName = graph.decl.getName();
        for (NodeDecl decl : graph.decl.getNodes()) {
            if (graph.nodesByName.containsKey(decl.getName())) {
                result.addError(ValidationResult.Code.DUPLICATE_NODE, decl.getSpan(), decl.getName(), null,
                        "Duplicate node '" + decl.getName() + "' in graph '" + graphName + "'");
                continue;
            }
            IrNode node = buildNode(decl, graphName, graph.nodes.size(), graph.fixtures, result);
            graph.add(node);
            namespace.register(graphName, node);
        }
    }

    private IrNode buildNode(NodeDecl decl, String graphName, int index, FixtureScope fixtures,
                             ValidationResult result) {
        Map<String, LiteralValue> staticData = new LinkedHashMap<>();
        for (DataEntry attachment : decl.getFixtureAttachments()) {
            staticData.putAll(fixtures.resolve(attachment.getKey(), attachment.getSpan(), decl.getName()));
        }
        staticData.putAll(fixtures.expand(decl.getConfig(), decl.getName()));

        IrNode.Builder node = IrNode.builder(decl.getName())
                .description(decl.getDescription())
                .tags(decl.getTags())
                .requires(decl.getRequires())
                .provides(decl.getProvides())
                .staticData(staticData)
                .declarationIndex(index)
                .originGraph(graphName)
                .span(decl.getSpan());

        for (StepDecl step : decl.getSteps()) {
            Map<String, LiteralValue> data = new LinkedHashMap<>();
            if (step.getFixtureReference() != null) {
                data.putAll(fixtures.resolve(step.getFixtureReference(), step.getSpan(), decl.getName()));
            }
            data.putAll(step.getProseData());
            data.putAll(fixtures.expand(step.getInlineData(), decl.getName()));
            node.step(new IrStep(step.getKind(), step.getKeyword(), step.getText(), step.getNormalizedText(),
                    data, step.getParameters(), step.getSpan()));
        }
        return node.build();
    }

    private IrGraph buildGraph(PendingGraph graph, Namespace namespace, ValidationResult result) {
        String graphName = graph.decl.getName();
        List<IrEdge> edges = new ArrayList<>();

        for (EdgeDecl decl : graph.decl.getEdges()) {
            String source = resolveEndpoint(decl.getSource(), graph, namespace, result);
            String target = resolveEndpoint(decl.getTarget(), graph, namespace, result);
            if (source == null || target == null) {
                continue;
            }
            Map<String, LiteralValue> data = graph.fixtures.expand(decl.getConfig(), null);
            edges.add(new IrEdge(source, target, decl.getPasses(), decl.getDescription(), data, decl.getSpan()));
        }

        validateDataFlow(graph, edges, result);

        Map<String, Map<String, LiteralValue>> fixtures = new LinkedHashMap<>();
        for (String name : graph.fixtures.visibleNames()) {
            fixtures.put(name, graph.fixtures.resolve(name, SourceSpan.unknown(), null));
        }
        Map<String, LiteralValue> config = graph.fixtures.expand(graph.decl.getConfig(), null);
        logger.debug("Graph '{}': {} node(s), {} edge(s)", graphName, graph.nodes.size(), edges.size());
        return new IrGraph(graphName, graph.sourceName, graph.nodes, edges, fixtures, config);
    }

    /**
     * Returns the name the endpoint has inside the graph, copying imported nodes in
     * on first reference, or null after recording an UNKNOWN_NODE error.
     */
    private String resolveEndpoint(QualifiedName ref, PendingGraph graph, Namespace namespace,
                                   ValidationResult result) {
        String graphName = graph.decl.getName();
        if (!ref.isQualified() || ref.getGraph().equals(graphName)) {
            if (graph.nodesByName.containsKey(ref.getName()) && !graph.nodesByName.get(ref.getName()).isImported()) {
                return ref.getName();
            }
            result.addError(ValidationResult.Code.UNKNOWN_NODE, ref.getSpan(), ref.toString(), null,
                    "Unknown node '" + ref + "' in graph '" + graphName + "'");
            return null;
        }

        if (!graph.visibleGraphs.contains(ref.getGraph()) || !namespace.containsGraph(ref.getGraph())) {
            result.addError(ValidationResult.Code.UNKNOWN_NODE, ref.getSpan(), ref.toString(), null,
                    "Unknown node '" + ref + "': graph '" + ref.getGraph()
                            + "' is neither declared in this file nor imported");
            return null;
        }

        String qualified = ref.toString();
        if (graph.nodesByName.containsKey(qualified)) {
            return qualified;
        }
        IrNode original = namespace.find(ref.getGraph(), ref.getName()).orElse(null);
        if (original == null) {
            result.addError(ValidationResult.Code.UNKNOWN_NODE, ref.getSpan(), qualified, null,
                    "Unknown node '" + qualified + "': graph '" + ref.getGraph() + "' has no node '"
                            + ref.getName() + "'");
            return null;
        }
        graph.add(original.asImported(qualified, graph.nodes.size()));
        return qualified;
    }

    private void validateDataFlow(PendingGraph graph, List<IrEdge> edges, ValidationResult result) {
        Map<String, Set<String>> incoming = new LinkedHashMap<>();
        for (IrEdge edge : edges) {
            incoming.computeIfAbsent(edge.getTarget(), k -> new LinkedHashSet<>()).addAll(edge.getPasses());
        }

        for (IrNode node : graph.nodes) {
            if (node.isImported()) {
                continue;
            }
            Set<String> available = incoming.getOrDefault(node.getName(), Set.of());
            for (String key : node.getRequires()) {
                if (!available.contains(key) && !node.getStaticData().containsKey(key)) {
                    result.addError(ValidationResult.Code.MISSING_DEPENDENCY, node.getSpan(), node.getName(), key,
                            "Node '" + node.getName() + "' requires '" + key
                                    + "' but no incoming edge passes it and no fixture or config provides it");
                }
            }
        }

        for (IrEdge edge : edges) {
            IrNode source = graph.nodesByName.get(edge.getSource());
            IrNode target = graph.nodesByName.get(edge.getTarget());
            for (String key : edge.getPasses()) {
                if (!source.getProvides().isEmpty()
                        && !source.getProvides().contains(key) && !source.getRequires().contains(key)) {
                    result.addError(ValidationResult.Code.UNPRODUCIBLE_DATA, edge.getSpan(), source.getName(), key,
                            "Edge " + edge.getSource() + " -> " + edge.getTarget() + " passes '" + key
                                    + "' which '" + source.getName() + "' neither provides nor requires");
                }
                if (!target.getRequires().isEmpty() && !target.getRequires().contains(key)) {
                    String message = "Edge " + edge.getSource() + " -> " + edge.getTarget() + " passes '" + key
                            + "' which '" + target.getName() + "' does not require";
                    if (excessPassesPolicy == ExcessPassesPolicy.ERROR) {
                        result.addError(ValidationResult.Code.EXCESS_DATA, edge.getSpan(), target.getName(), key,
                                message);
                    } else if (excessPassesPolicy == ExcessPassesPolicy.WARN) {
                        result.addWarning(ValidationResult.Code.EXCESS_DATA, edge.getSpan(), target.getName(), key,
                                message);
                    }
                }
            }
        }
    }

    /**
     * A graph whose local nodes are built and whose edges are not yet resolved.
     */
    private static final class PendingGraph {
        final String sourceName;
        final GraphDecl decl;
        final FixtureScope fixtures;
        final Set<String> visibleGraphs;
        final List<IrNode> nodes = new ArrayList<>();
        final Map<String, IrNode> nodesByName = new LinkedHashMap<>();

        PendingGraph(String sourceName, GraphDecl decl, FixtureScope fixtures, Set<String> visibleGraphs) {
            this.sourceName = sourceName;
            this.decl = decl;
            this.fixtures = fixtures;
            this.visibleGraphs = visibleGraphs;
        }

        void add(IrNode node) {
            nodes.add(node);
            nodesByName.put(node.getName(), node);
        }
    }

    /**
     * Fixtures declared at one level, falling back to the enclosing level. A name
     * declared at graph level shadows the file-level fixture of the same name.
     */
    private static final class FixtureScope {
        private final FixtureScope parent;
        private final Map<String, FixtureDecl> fixtures = new LinkedHashMap<>();
        private final Map<String, Map<String, LiteralValue>> expanded = new LinkedHashMap<>();
        private final ValidationResult result;

        FixtureScope(FixtureScope parent, List<FixtureDecl> declared, ValidationResult result) {
            this.parent = parent;
            this.result = result;
            for (FixtureDecl decl : declared) {
                if (fixtures.containsKey(decl.getName())) {
                    result.addError(ValidationResult.Code.DUPLICATE_FIXTURE, decl.getSpan(),
                            "Duplicate fixture '" + decl.getName() + "'");
                } else {
                    fixtures.put(decl.getName(), decl);
                }
            }
        }

        Set<String> visibleNames() {
            Set<String> names = parent != null ? new LinkedHashSet<>(parent.visibleNames()) : new LinkedHashSet<>();
            names.addAll(fixtures.keySet());
            return names;
        }

        Map<String, LiteralValue> expand(DataBlock block, String nodeName) {
            return expand(block, nodeName, new ArrayDeque<>());
        }

        Map<String, LiteralValue> resolve(String name, SourceSpan span, String nodeName) {
            return resolve(name, span, nodeName, new ArrayDeque<>());
        }

        private Map<String, LiteralValue> expand(DataBlock block, String nodeName, Deque<String> active) {
            Map<String, LiteralValue> data = new LinkedHashMap<>();
            for (DataEntry entry : block.getEntries()) {
                if (entry.isSpread()) {
                    data.putAll(resolve(entry.getKey(), entry.getSpan(), nodeName, active));
                } else {
                    data.put(entry.getKey(), entry.getValue());
                }
            }
            return data;
        }

        private Map<String, LiteralValue> resolve(String name, SourceSpan span, String nodeName,
                                                  Deque<String> active) {
            FixtureScope owner = this;
            while (owner != null && !owner.fixtures.containsKey(name)) {
                owner = owner.parent;
            }
            if (owner == null) {
                result.addError(ValidationResult.Code.UNKNOWN_FIXTURE, span, nodeName, name,
                        "Unknown fixture '" + name + "'");
                return Map.of();
            }
            Map<String, LiteralValue> cached = owner.expanded.get(name);
            if (cached != null) {
                return cached;
            }
            if (active.contains(name)) {
                result.addError(ValidationResult.Code.UNKNOWN_FIXTURE, span, nodeName, name,
                        "Fixture '" + name + "' includes itself");
                return Map.of();
            }
            active.push(name);
            Map<String, LiteralValue> data = owner.expand(owner.fixtures.get(name).getData(), nodeName, active);
            active.pop();
            owner.expanded.put(name, data);
            return data;
        }
    }
}
