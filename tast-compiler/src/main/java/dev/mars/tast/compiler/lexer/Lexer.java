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

import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;
import dev.mars.tast.core.exceptions.LexException;

import java.util.Objects;

/**
 * Splits one source file into tokens, one token per call to {@link #nextToken()}.
 *
 * <p>After a step keyword the lexer switches to free-text mode: the rest of the
 * line, up to an unquoted {@code {}, {@code }} or {@code #}, becomes a single
 * trimmed {@link TokenType#FREE_TEXT} token. Quoted strings inside free text are
 * kept as written. Newlines are whitespace and produce no tokens.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class Lexer {

    private final String sourceName;
    private final String text;

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean freeTextPending;
    private boolean finished;

    public Lexer(String sourceName, String text) {
        this.sourceName = sourceName;
        this.text = Objects.requireNonNull(text, "Source text cannot be null");
    }

    /**
     * Returns the next token. Once {@link TokenType#EOF} has been returned every
     * further call returns another EOF token.
     *
     * @throws LexException on an unterminated string, a malformed number or an
     *         invalid character outside free text
     */
    public Token nextToken() throws LexException {
        if (freeTextPending) {
            freeTextPending = false;
            skipInlineWhitespace();
            if (!atEnd() && !isFreeTextTerminator(peek())) {
                return readFreeText();
            }
        }

        skipTrivia();
        if (atEnd()) {
            finished = true;
            return new Token(TokenType.EOF, "", new SourceSpan(sourceName, pos, pos, line, column, line, column));
        }

        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        char c = peek();

        switch (c) {
            case '{':
                return single(TokenType.LBRACE);
            case '}':
                return single(TokenType.RBRACE);
            case '[':
                return single(TokenType.LBRACKET);
            case ']':
                return single(TokenType.RBRACKET);
            case ':':
                return single(TokenType.COLON);
            case ',':
                return single(TokenType.COMMA);
            case '.':
                return single(TokenType.DOT);
            case '"':
                return readString();
            case '-':
                if (peekAt(1) == '>') {
                    advance();
                    advance();
                    return new Token(TokenType.ARROW, "->", span(startPos, startLine, startColumn));
                }
                if (isDigit(peekAt(1))) {
                    return readNumber();
                }
                break;
            default:
                if (isDigit(c)) {
                    return readNumber();
                }
                if (isIdentifierStart(c)) {
                    return readWord();
                }
                break;
        }

        advance();
        throw new LexException("invalid character '" + c + "'", span(startPos, startLine, startColumn));
    }

    /**
     * True once EOF has been produced.
     */
    public boolean isFinished() {
        return finished;
    }

    private Token single(TokenType type) {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        advance();
        return new Token(type, type.getLexeme(), span(startPos, startLine, startColumn));
    }

    private Token readWord() {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        while (!atEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String word = text.substring(startPos, pos);
        TokenType keyword = TokenType.keyword(word);
        TokenType type = keyword != null ? keyword : TokenType.IDENTIFIER;
        if (type.isStepKeyword()) {
            freeTextPending = true;
        }
        return new Token(type, word, span(startPos, startLine, startColumn));
    }

    private Token readNumber() throws LexException {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        boolean negative = false;
        if (peek() == '-') {
            negative = true;
            advance();
        }
        while (!atEnd() && isDigit(peek())) {
            advance();
        }
        if (!atEnd() && peek() == '.' && isDigit(peekAt(1))) {
            advance();
            while (!atEnd() && isDigit(peek())) {
                advance();
            }
        }
        int suffixStart = pos;
        while (!atEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String lexeme = text.substring(startPos, pos);
        if (suffixStart == pos) {
            return new Token(TokenType.NUMBER, lexeme, span(startPos, startLine, startColumn));
        }

        String suffix = text.substring(suffixStart, pos);
        if (!LiteralValue.isDurationUnit(suffix)) {
            throw new LexException("unknown number suffix '" + suffix + "' in '" + lexeme + "'",
                    span(startPos, startLine, startColumn));
        }
        if (negative) {
            throw new LexException("duration cannot be negative: '" + lexeme + "'",
                    span(startPos, startLine, startColumn));
        }
        return new Token(TokenType.DURATION, lexeme, span(startPos, startLine, startColumn));
    }

    private Token readString() throws LexException {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        advance(); // opening quote
        StringBuilder value = new StringBuilder();
        while (true) {
            if (atEnd() || peek() == '\n') {
                throw new LexException("unterminated string literal", span(startPos, startLine, startColumn));
            }
            char c = advance();
            if (c == '"') {
                break;
            }
            if (c == '\\') {
                if (atEnd() || peek() == '\n') {
                    throw new LexException("unterminated string literal", span(startPos, startLine, startColumn));
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n':
                        value.append('\n');
                        break;
                    case 't':
                        value.append('\t');
                        break;
                    case '"':
                        value.append('"');
                        break;
                    case '\\':
                        value.append('\\');
                        break;
                    default:
                        value.append('\\').append(escaped);
                        break;
                }
            } else {
                value.append(c);
            }
        }
        return new Token(TokenType.STRING, value.toString(), span(startPos, startLine, startColumn));
    }

    private Token readFreeText() throws LexException {
        int startPos = pos;
        int startLine = line;
        int startColumn = column;
        int lastContentPos = pos;
        int lastContentLine = line;
        int lastContentColumn = column;
        boolean inQuote = false;
        int quotePos = -1;
        int quoteLine = 0;
        int quoteColumn = 0;

        while (!atEnd()) {
            char c = peek();
            if (c == '\n') {
                break;
            }
            if (!inQuote && isFreeTextTerminator(c)) {
                break;
            }
            if (c == '"') {
                if (!inQuote) {
                    quotePos = pos;
                    quoteLine = line;
                    quoteColumn = column;
                }
                inQuote = !inQuote;
            } else if (c == '\\' && inQuote && peekAt(1) != '\n' && pos + 1 < text.length()) {
                advance();
            }
            advance();
            if (!Character.isWhitespace(c)) {
                lastContentPos = pos;
                lastContentLine = line;
                lastContentColumn = column;
            }
        }

        if (inQuote) {
            throw new LexException("unterminated string literal in step text",
                    new SourceSpan(sourceName, quotePos, pos, quoteLine, quoteColumn, line, column));
        }

        String freeText = text.substring(startPos, lastContentPos);
        return new Token(TokenType.FREE_TEXT, freeText,
                new SourceSpan(sourceName, startPos, lastContentPos, startLine, startColumn,
                        lastContentLine, lastContentColumn));
    }

    private void skipInlineWhitespace() {
        while (!atEnd() && peek() != '\n' && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private void skipTrivia() {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (!atEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private static boolean isFreeTextTerminator(char c) {
        return c == '\n' || c == '{' || c == '}';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return text.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private char advance() {
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceSpan span(int startPos, int startLine, int startColumn) {
        return new SourceSpan(sourceName, startPos, pos, startLine, startColumn, line, column);
    }
}
