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

import dev.mars.tast.core.exceptions.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A restartable token source over one piece of source text. Every call to
 * {@link #open()} starts a new, independent pass from the beginning, so the same
 * stream may be consumed any number of times.
 */
public final class TokenStream {

    private final String sourceName;
    private final String text;

    public TokenStream(String sourceName, String text) {
        this.sourceName = sourceName;
        this.text = Objects.requireNonNull(text, "Source text cannot be null");
    }

    public String getSourceName() {
        return sourceName;
    }

    public Lexer open() {
        return new Lexer(sourceName, text);
    }

    /**
     * Drains a fresh pass into a list ending with the EOF token.
     */
    public List<Token> readAll() throws LexException {
        Lexer lexer = open();
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }
}
