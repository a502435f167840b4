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

import dev.mars.tast.core.ValidationResult;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The validated result of building one or more source files: every declared
 * graph, in file order then declaration order, and any validation warnings.
 */
public final class IrProgram {

    private final List<IrGraph> graphs;
    private final List<ValidationResult.ValidationIssue> warnings;

    public IrProgram(List<IrGraph> graphs, List<ValidationResult.ValidationIssue> warnings) {
        this.graphs = List.copyOf(graphs);
        this.warnings = List.copyOf(warnings);
    }

    public List<IrGraph> getGraphs() {
        return graphs;
    }

    public Optional<IrGraph> findGraph(String name) {
        return graphs.stream().filter(g -> g.getName().equals(name)).findFirst();
    }

    public List<String> getGraphNames() {
        return graphs.stream().map(IrGraph::getName).collect(Collectors.toList());
    }

    public List<ValidationResult.ValidationIssue> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "IrProgram{graphs=" + getGraphNames() + ", warnings=" + warnings.size() + '}';
    }
}
