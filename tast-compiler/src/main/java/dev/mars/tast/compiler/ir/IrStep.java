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

import dev.mars.tast.compiler.ast.StepKeyword;
import dev.mars.tast.compiler.ast.StepKind;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved step: fixture references and spreads are expanded into {@link #getData()}.
 */
public final class IrStep {

    private final StepKind kind;
    private final StepKeyword keyword;
    private final String text;
    private final String normalizedText;
    private final Map<String, LiteralValue> data;
    private final List<String> parameters;
    private final SourceSpan span;

    public IrStep(StepKind kind, StepKeyword keyword, String text, String normalizedText,
                  Map<String, LiteralValue> data, List<String> parameters, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.keyword = Objects.requireNonNull(keyword, "Keyword cannot be null");
        this.text = Objects.requireNonNull(text, "Text cannot be null");
        this.normalizedText = normalizedText != null ? normalizedText : "";
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.parameters = List.copyOf(parameters);
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public StepKind getKind() {
        return kind;
    }

    public StepKeyword getKeyword() {
        return keyword;
    }

    public String getText() {
        return text;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public Map<String, LiteralValue> getData() {
        return data;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return keyword.getText() + " " + text;
    }
}
