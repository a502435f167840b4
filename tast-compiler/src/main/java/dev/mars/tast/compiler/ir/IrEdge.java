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

import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A resolved edge between two nodes of the same {@link IrGraph}. Endpoint names
 * are either local names or {@code Graph.Node} names of imported copies.
 */
public final class IrEdge {

    private final String source;
    private final String target;
    private final Set<String> passes;
    private final String description;
    private final Map<String, LiteralValue> data;
    private final SourceSpan span;

    public IrEdge(String source, String target, Set<String> passes, String description,
                  Map<String, LiteralValue> data, SourceSpan span) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.target = Objects.requireNonNull(target, "Target cannot be null");
        this.passes = Collections.unmodifiableSet(new LinkedHashSet<>(passes));
        this.description = description;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public Set<String> getPasses() {
        return passes;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Static values for passed keys, from the edge's config block.
     */
    public Map<String, LiteralValue> getData() {
        return data;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return source + " -> " + target + (passes.isEmpty() ? "" : " " + passes);
    }
}
