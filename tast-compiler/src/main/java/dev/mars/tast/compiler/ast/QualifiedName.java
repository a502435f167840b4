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
 * A node reference in an edge: {@code Name} or {@code Graph.Name}.
 */
public final class QualifiedName {

    private final String graph;
    private final String name;
    private final SourceSpan span;

    public QualifiedName(String graph, String name, SourceSpan span) {
        this.graph = graph;
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public static QualifiedName local(String name) {
        return new QualifiedName(null, name, null);
    }

    /**
     * The graph qualifier, or null for a bare name.
     */
    public String getGraph() {
        return graph;
    }

    public String getName() {
        return name;
    }

    public boolean isQualified() {
        return graph != null;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QualifiedName that = (QualifiedName) o;
        return Objects.equals(graph, that.graph) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(graph, name);
    }

    @Override
    public String toString() {
        return graph != null ? graph + "." + name : name;
    }
}
