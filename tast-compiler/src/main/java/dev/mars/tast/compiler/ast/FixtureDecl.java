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
 * {@code fixture Name { ... }}, declared at file or graph level.
 */
public final class FixtureDecl {

    private final String name;
    private final DataBlock data;
    private final SourceSpan span;

    public FixtureDecl(String name, DataBlock data, SourceSpan span) {
        this.name = Objects.requireNonNull(name, "Fixture name cannot be null");
        this.data = Objects.requireNonNull(data, "Fixture data cannot be null");
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public String getName() {
        return name;
    }

    public DataBlock getData() {
        return data;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return "fixture " + name + " " + data;
    }
}
