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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The syntax tree of one source file.
 */
public final class SourceFile {

    private final String name;
    private final List<ImportDecl> imports;
    private final List<FixtureDecl> fixtures;
    private final List<GraphDecl> graphs;

    public SourceFile(String name, List<ImportDecl> imports, List<FixtureDecl> fixtures, List<GraphDecl> graphs) {
        this.name = Objects.requireNonNull(name, "Source name cannot be null");
        this.imports = List.copyOf(imports);
        this.fixtures = List.copyOf(fixtures);
        this.graphs = List.copyOf(graphs);
    }

    /**
     * The name the file was loaded under, normally its path.
     */
    public String getName() {
        return name;
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    public List<FixtureDecl> getFixtures() {
        return fixtures;
    }

    public List<GraphDecl> getGraphs() {
        return graphs;
    }

    public Optional<GraphDecl> findGraph(String graphName) {
        return graphs.stream().filter(g -> g.getName().equals(graphName)).findFirst();
    }

    @Override
    public String toString() {
        return "SourceFile{" + name + ", imports=" + imports.size() + ", graphs=" + graphs.size() + '}';
    }
}
