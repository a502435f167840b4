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
import dev.mars.tast.compiler.ast.StepKind;
import dev.mars.tast.core.LiteralValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One precondition, action or assertion of a plan step.
 */
@JsonPropertyOrder({"kind", "keyword", "text", "data", "parameters"})
public final class PlanStepEntry {

    private final StepKind kind;
    private final String keyword;
    private final String text;
    private final Map<String, LiteralValue> data;
    private final Map<String, ParameterBinding> parameters;

    public PlanStepEntry(StepKind kind, String keyword, String text, Map<String, LiteralValue> data,
                         Map<String, ParameterBinding> parameters) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.keyword = Objects.requireNonNull(keyword, "Keyword cannot be null");
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public StepKind getKind() {
        return kind;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public Map<String, LiteralValue> getData() {
        return data;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, ParameterBinding> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlanStepEntry that = (PlanStepEntry) o;
        return kind == that.kind && keyword.equals(that.keyword) && text.equals(that.text)
                && data.equals(that.data) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, keyword, text, data, parameters);
    }

    @Override
    public String toString() {
        return keyword + " " + text;
    }
}
