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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@code Source -> Target { passes {...} describe "..." config {...} }}.
 */
public final class EdgeDecl {

    private final QualifiedName source;
    private final QualifiedName target;
    private final Set<String> passes;
    private final String description;
    private final DataBlock config;
    private final SourceSpan span;

    public EdgeDecl(QualifiedName source, QualifiedName target, List<String> passes,
                    String description, DataBlock config, SourceSpan span) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.passes = NodeDecl.immutableOrdered(new LinkedHashSet<>(
                Objects.requireNonNull(passes, "Passes cannot be null")));
        this.description = description;
        this.config = config != null ? config : DataBlock.empty();
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public QualifiedName getSource() {
        return source;
    }

    public QualifiedName getTarget() {
        return target;
    }

    public Set<String> getPasses() {
        return passes;
    }

    public String getDescription() {
        return description;
    }

    public DataBlock getConfig() {
        return config;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return source + " -> " + target + (passes.isEmpty() ? "" : " passes " + passes);
    }
}
