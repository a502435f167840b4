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


package dev.mars.tast.compiler.lexer;

import dev.mars.tast.core.SourceSpan;

import java.util.Objects;

/**
 * A single token with its location. For {@link TokenType#STRING} the text is the
 * unescaped string content; for every other type it is the source lexeme.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final SourceSpan span;

    public Token(TokenType type, String text, SourceSpan span) {
        this.type = Objects.requireNonNull(type, "Token type cannot be null");
        this.text = Objects.requireNonNull(text, "Token text cannot be null");
        this.span = Objects.requireNonNull(span, "Span cannot be null");
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * True for identifiers and structural keywords, which may both be used as names.
     */
    public boolean isWord() {
        return type == TokenType.IDENTIFIER || (type.isKeyword() && !type.isStepKeyword());
    }

    /**
     * Renders the token for error messages.
     */
    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case STRING:
                return "string \"" + text + "\"";
            case FREE_TEXT:
                return "step text '" + text + "'";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token token = (Token) o;
        return type == token.type && text.equals(token.text) && span.equals(token.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, span);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + span;
    }
}
