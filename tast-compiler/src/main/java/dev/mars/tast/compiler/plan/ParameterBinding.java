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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.tast.core.LiteralValue;

import java.util.Objects;

/**
 * How a {@code <placeholder>} parameter in a step's text is bound: from the
 * step's own data ({@code step}), from an input ({@code from:<Node>}), from
 * the node's static data ({@code static}), or not at all ({@code unresolved}).
 */
@JsonPropertyOrder({"source", "value"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParameterBinding {

    public static final String STEP = "step";

    private final String source;
    private final LiteralValue value;

    public ParameterBinding(String source, LiteralValue value) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.value = value;
    }

    public String getSource() {
        return source;
    }

    public LiteralValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterBinding that = (ParameterBinding) o;
        return source.equals(that.source) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, value);
    }

    @Override
    public String toString() {
        return value == null ? source : source + "=" + value;
    }
}
