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

import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds produced by the {@link Lexer}.
 */
public enum TokenType {
    // Structural keywords
    GRAPH("graph"),
    NODE("node"),
    DESCRIBE("describe"),
    IMPORT("import"),
    FROM("from"),
    FIXTURE("fixture"),
    TAGS("tags"),
    CONFIG("config"),
    PASSES("passes"),
    REQUIRES("requires"),
    PROVIDES("provides"),

    // Step keywords
    GIVEN("given"),
    WHEN("when"),
    THEN("then"),
    AND("and"),
    BUT("but"),

    // Punctuation
    ARROW("->"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    COLON(":"),
    COMMA(","),
    DOT("."),

    // Literals and text
    STRING(null),
    NUMBER(null),
    DURATION(null),
    IDENTIFIER(null),
    FREE_TEXT(null),

    EOF(null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                KEYWORDS.put(type.lexeme, type);
            }
        }
    }

    private final String lexeme;

    TokenType(String lexeme) {
        this.lexeme = lexeme;
    }

    /**
     * The fixed spelling of this token, or null for literal, text and end tokens.
     */
    public String getLexeme() {
        return lexeme;
    }

    public boolean isKeyword() {
        return ordinal() <= BUT.ordinal();
    }

    /**
     * True for {@code given when then and but}, after which the rest of the line is free text.
     */
    public boolean isStepKeyword() {
        return this == GIVEN || this == WHEN || this == THEN || this == AND || this == BUT;
    }

    /**
     * Looks up the keyword spelled by {@code word}, or returns null if it is an ordinary identifier.
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    /**
     * Human readable form used in parse error messages.
     */
    public String describe() {
        if (lexeme != null) {
            return "'" + lexeme + "'";
        }
        switch (this) {
            case STRING:
                return "string";
            case NUMBER:
                return "number";
            case DURATION:
                return "duration";
            case IDENTIFIER:
                return "identifier";
            case FREE_TEXT:
                return "step text";
            default:
                return "end of input";
        }
    }
}
