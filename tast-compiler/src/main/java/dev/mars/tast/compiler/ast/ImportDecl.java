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

import java.util.Objects;

/**
 * {@code import Graph from "path"}.
 */
public final class ImportDecl {

    private final String graphName;
    private final String path;
    private final SourceSpan span;

    public ImportDecl(String graphName, String path, SourceSpan span) {
        this.graphName = Objects.requireNonNull(graphName, "Graph name cannot be null");
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * The path as written, relative to the importing file.
     */
    public String getPath() {
        return path;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "import " + graphName + " from \"" + path + "\"";
    }
}
