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

import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step line of a node: its keyword, resolved kind, verbatim text and the data
 * extracted from its prose and from an optional inline data block.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class StepDecl {

    private final StepKeyword keyword;
    private final StepKind kind;
    private final String text;
    private final String normalizedText;
    private final Map<String, LiteralValue> proseData;
    private final DataBlock inlineData;
    private final List<String> parameters;
    private final String fixtureReference;
    private final SourceSpan span;

    private StepDecl(Builder builder) {
        this.keyword = Objects.requireNonNull(builder.keyword, "Keyword cannot be null");
        this.kind = Objects.requireNonNull(builder.kind, "Kind cannot be null");
        this.text = builder.text != null ? builder.text : "";
        this.normalizedText = builder.normalizedText != null ? builder.normalizedText : "";
        this.proseData = Collections.unmodifiableMap(new LinkedHashMap<>(builder.proseData));
        this.inlineData = builder.inlineData != null ? builder.inlineData : DataBlock.empty();
        this.parameters = List.copyOf(builder.parameters);
        this.fixtureReference = builder.fixtureReference;
        this.span = builder.span != null ? builder.span : SourceSpan.unknown();
    }

    public static Builder builder() {
        return new Builder();
    }

    public StepKeyword getKeyword() {
        return keyword;
    }

    public StepKind getKind() {
        return kind;
    }

    /**
     * The free text exactly as written after the keyword, trimmed.
     */
    public String getText() {
        return text;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    /**
     * Bindings found in the prose, anonymous literals under {@code $0}, {@code $1}, ...
     */
    public Map<String, LiteralValue> getProseData() {
        return proseData;
    }

    public DataBlock getInlineData() {
        return inlineData;
    }

    /**
     * Prose bindings overlaid with the inline block's literal entries.
     * Fixture spreads and references are expanded later, during IR building.
     */
    public Map<String, LiteralValue> getData() {
        Map<String, LiteralValue> data = new LinkedHashMap<>(proseData);
        data.putAll(inlineData.literals());
        return data;
    }

    /**
     * Names of {@code <placeholder>} parameters in order of first appearance.
     */
    public List<String> getParameters() {
        return parameters;
    }

    /**
     * The fixture named by a {@code from fixture Name} phrase, or null.
     */
    public String getFixtureReference() {
        return fixtureReference;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return keyword.getText() + " " + text;
    }

    public static final class Builder {
        private StepKeyword keyword;
        private StepKind kind;
        private String text;
        private String normalizedText;
        private Map<String, LiteralValue> proseData = Map.of();
        private DataBlock inlineData;
        private List<String> parameters = List.of();
        private String fixtureReference;
        private SourceSpan span;

        private Builder() {
        }

        public Builder keyword(StepKeyword keyword) {
            this.keyword = keyword;
            return this;
        }

        public Builder kind(StepKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder normalizedText(String normalizedText) {
            this.normalizedText = normalizedText;
            return this;
        }

        public Builder proseData(Map<String, LiteralValue> proseData) {
            this.proseData = Objects.requireNonNull(proseData, "Prose data cannot be null");
            return this;
        }

        public Builder inlineData(DataBlock inlineData) {
            this.inlineData = inlineData;
            return this;
        }

        public Builder parameters(List<String> parameters) {
            this.parameters = Objects.requireNonNull(parameters, "Parameters cannot be null");
            return this;
        }

        public Builder fixtureReference(String fixtureReference) {
            this.fixtureReference = fixtureReference;
            return this;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public StepDecl build() {
            return new StepDecl(this);
        }
    }
}
