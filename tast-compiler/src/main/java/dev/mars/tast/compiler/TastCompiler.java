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


package dev.mars.tast.compiler;

import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.graph.DependencyGraph;
import dev.mars.tast.compiler.ir.IrBuilder;
import dev.mars.tast.compiler.ir.IrGraph;
import dev.mars.tast.compiler.ir.IrProgram;
import dev.mars.tast.compiler.observability.CompilerMetrics;
import dev.mars.tast.compiler.parser.SourceParser;
import dev.mars.tast.compiler.parser.TastSourceParser;
import dev.mars.tast.compiler.plan.Plan;
import dev.mars.tast.compiler.plan.PlanCompiler;
import dev.mars.tast.compiler.plan.TraversalStrategy;
import dev.mars.tast.compiler.plan.Traversals;
import dev.mars.tast.config.TastConfiguration;
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.SourceSetException;
import dev.mars.tast.core.exceptions.TastException;
import dev.mars.tast.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Entry point that runs the whole pipeline: load and parse sources, build and
 * validate the IR, then compile execution plans for individual graphs.
 *
 * <pre>{@code
 * TastCompiler compiler = new TastCompiler();
 * IrProgram program = compiler.compile(Path.of("tests/auth.tast"));
 * Plan plan = compiler.plan(program, "Auth", Traversals.topological());
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class TastCompiler {

    private static final Logger logger = LoggerFactory.getLogger(TastCompiler.class);

    private final TastConfiguration configuration;
    private final SourceParser parser;
    private final IrBuilder irBuilder;
    private final PlanCompiler planCompiler;
    private final CompilerMetrics metrics;

    public TastCompiler() {
        this(new TastConfiguration());
    }

    public TastCompiler(TastConfiguration configuration) {
        this(configuration, new TastSourceParser(), new IrBuilder(configuration), new PlanCompiler());
    }

    TastCompiler(TastConfiguration configuration, SourceParser parser, IrBuilder irBuilder,
                 PlanCompiler planCompiler) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.irBuilder = Objects.requireNonNull(irBuilder, "IR builder cannot be null");
        this.planCompiler = Objects.requireNonNull(planCompiler, "Plan compiler cannot be null");
        this.metrics = configuration.isMetricsEnabled() ? CompilerMetrics.getInstance() : null;
    }

    public TastConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Compiles a root file and everything it imports. Import paths resolve
     * relative to the importing file.
     */
    public IrProgram compile(Path rootFile) throws TastException {
        Objects.requireNonNull(rootFile, "Root file cannot be null");
        Path absolute = rootFile.toAbsolutePath().normalize();
        Path directory = absolute.getParent();
        SourceLoader loader = new FileSystemSourceLoader(directory);
        return compile(loader, List.of(absolute.getFileName().toString()));
    }

    /**
     * Compiles every file under {@code directory} whose name ends with the configured
     * source extension, in path order.
     */
    public IrProgram compileDirectory(Path directory) throws TastException {
        Objects.requireNonNull(directory, "Directory cannot be null");
        String extension = configuration.getSourceExtension();
        List<String> roots;
        try (Stream<Path> paths = Files.walk(directory)) {
            roots = paths.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(extension))
                    .map(path -> directory.relativize(path).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TastException("Failed to list source directory: " + directory, e);
        }
        if (roots.isEmpty()) {
            throw new TastException("No " + extension + " files found in " + directory);
        }
        logger.debug("Found {} source file(s) in {}", roots.size(), directory);
        return compile(new FileSystemSourceLoader(directory), roots);
    }

    public IrProgram compileSource(String sourceName, String text) throws TastException {
        return compileSources(Map.of(sourceName, text));
    }

    /**
     * Compiles a set of in-memory sources. Every entry is a root; imports must
     * name other entries of the map.
     */
    public IrProgram compileSources(Map<String, String> sources) throws TastException {
        Objects.requireNonNull(sources, "Sources cannot be null");
        return compile(new MapSourceLoader(sources), new ArrayList<>(sources.keySet()));
    }

    public IrProgram compile(SourceLoader loader, List<String> roots) throws TastException {
        if (metrics != null) {
            metrics.recordBuildStarted();
        }
        try {
            ProjectLoader projectLoader = new ProjectLoader(loader, parser, configuration.getParseParallelism());
            List<SourceFile> files;
            try {
                files = projectLoader.load(roots);
            } catch (SourceSetException e) {
                if (metrics != null) {
                    metrics.recordFilesFailed(e.getFailures().size(), "parse");
                }
                throw e;
            }
            if (metrics != null) {
                metrics.recordFilesParsed(files.size());
            }
            logger.info("Parsed {} source file(s) from roots {}", files.size(), roots);

            IrProgram program;
            try {
                program = irBuilder.build(files);
            } catch (ValidationException e) {
                if (metrics != null) {
                    metrics.recordValidationIssues(e.getResult().getErrorCount(), e.getResult().getWarningCount());
                }
                throw e;
            }
            if (metrics != null) {
                metrics.recordValidationIssues(0, program.getWarnings().size());
            }
            logger.info("Built IR with graphs {}", program.getGraphNames());
            return program;
        } finally {
            if (metrics != null) {
                metrics.recordBuildFinished();
            }
        }
    }

    /**
     * Compiles a plan for the named graph using the configured default strategy.
     * Rooted defaults start from the graph's first root, or from its first node
     * when the graph has no root.
     */
    public Plan plan(IrProgram program, String graphName) throws TastException {
        IrGraph graph = requireGraph(program, graphName);
        return plan(DependencyGraph.of(graph), Traversals.byName(configuration.getDefaultStrategy(), null));
    }

    public Plan plan(IrProgram program, String graphName, TraversalStrategy strategy) throws TastException {
        return plan(requireGraph(program, graphName), strategy);
    }

    public Plan plan(IrGraph graph, TraversalStrategy strategy) throws TastException {
        return plan(DependencyGraph.of(Objects.requireNonNull(graph, "Graph cannot be null")), strategy);
    }

    private Plan plan(DependencyGraph graph, TraversalStrategy strategy) throws TastException {
        Objects.requireNonNull(strategy, "Strategy cannot be null");
        long started = System.nanoTime();
        try {
            Plan plan = planCompiler.compile(graph, strategy);
            double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
            if (metrics != null) {
                metrics.recordPlanCompiled(graph.getName(), strategy.getName(), seconds, plan.size());
            }
            logger.info("Compiled plan for graph '{}' using {} with {} step(s)",
                    graph.getName(), strategy.getName(), plan.size());
            return plan;
        } catch (TastException e) {
            if (metrics != null) {
                metrics.recordPlanFailed(graph.getName(), strategy.getName(), e.getClass().getSimpleName());
            }
            logger.warn("Plan compilation failed for graph '{}': {}", graph.getName(), e.getMessage());
            throw e;
        }
    }

    private static IrGraph requireGraph(IrProgram program, String graphName) throws CompilationException {
        Objects.requireNonNull(program, "Program cannot be null");
        Objects.requireNonNull(graphName, "Graph name cannot be null");
        return program.findGraph(graphName)
                .orElseThrow(() -> CompilationException.unknownGraph(graphName));
    }
}
