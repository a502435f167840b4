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
 * Where a step's data key comes from: {@code from:<Node>}, {@code static} or
 * {@code unresolved}, with the value when it is known at compile time.
 */
@JsonPropertyOrder({"source", "value"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PlanInput {

    public static final String STATIC = "static";
    public static final String UNRESOLVED = "unresolved";
    public static final String FROM_PREFIX = "from:";

    private final String source;
    private final LiteralValue value;

    public PlanInput(String source, LiteralValue value) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.value = value;
    }

    public static PlanInput from(String nodeName, LiteralValue value) {
        return new PlanInput(FROM_PREFIX + nodeName, value);
    }

    public static PlanInput staticValue(LiteralValue value) {
        return new PlanInput(STATIC, value);
    }

    public static PlanInput unresolved() {
        return new PlanInput(UNRESOLVED, null);
    }

    /**
     * {@code from:<Node>}, {@code static} or {@code unresolved}.
     */
    public String getSource() {
        return source;
    }

    /**
     * The compile-time value, or null when it is only known at execution time.
     */
    public LiteralValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanInput that = (PlanInput) o;
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
