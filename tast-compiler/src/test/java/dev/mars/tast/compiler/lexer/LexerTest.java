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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenType> types(String text) throws LexException {
        List<TokenType> types = new ArrayList<>();
        for (Token token : new TokenStream("test.tast", text).readAll()) {
            types.add(token.getType());
        }
        return types;
    }

    @Test
    void testGraphHeader() throws LexException {
        assertEquals(List.of(TokenType.GRAPH, TokenType.IDENTIFIER, TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF),
                types("graph Auth { }"));
    }

    @Test
    void testEmptyInputProducesOnlyEof() throws LexException {
        List<Token> tokens = new TokenStream("empty.tast", "  \n # just a comment\n").readAll();

        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).getType());
    }

    @Test
    void testStepTextBecomesSingleFreeTextToken() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "given a user with email \"x@y.z\" { role: admin }").readAll();

        assertEquals(TokenType.GIVEN, tokens.get(0).getType());
        assertEquals(TokenType.FREE_TEXT, tokens.get(1).getType());
        assertEquals("a user with email \"x@y.z\"", tokens.get(1).getText());
        assertEquals(TokenType.LBRACE, tokens.get(2).getType());
        assertEquals(TokenType.IDENTIFIER, tokens.get(3).getType());
        assertEquals("role", tokens.get(3).getText());
    }

    @Test
    void testFreeTextStopsAtNewline() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "when the user logs in\nthen ok").readAll();

        assertEquals("the user logs in", tokens.get(1).getText());
        assertEquals(TokenType.THEN, tokens.get(2).getType());
        assertEquals("ok", tokens.get(3).getText());
    }

    @Test
    void testHashInsideStepTextIsKept() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "then order #42 is shown\n# trailing comment\n").readAll();

        assertEquals(TokenType.FREE_TEXT, tokens.get(1).getType());
        assertEquals("order #42 is shown", tokens.get(1).getText());
        assertEquals(TokenType.EOF, tokens.get(2).getType());
    }

    @Test
    void testBraceInsideQuotedStepTextIsKept() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "then the body is \"{}\"").readAll();

        assertEquals("the body is \"{}\"", tokens.get(1).getText());
        assertEquals(TokenType.EOF, tokens.get(2).getType());
    }

    @Test
    void testStepKeywordWithoutText() throws LexException {
        assertEquals(List.of(TokenType.WHEN, TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF), types("when { }"));
    }

    @Test
    void testNumbersAndDurations() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "30s 3 -1.5 250ms 2h").readAll();

        assertEquals(TokenType.DURATION, tokens.get(0).getType());
        assertEquals("30s", tokens.get(0).getText());
        assertEquals(TokenType.NUMBER, tokens.get(1).getType());
        assertEquals(TokenType.NUMBER, tokens.get(2).getType());
        assertEquals("-1.5", tokens.get(2).getText());
        assertEquals(TokenType.DURATION, tokens.get(3).getType());
        assertEquals(TokenType.DURATION, tokens.get(4).getType());
    }

    @Test
    void testArrowAndQualifiedNames() throws LexException {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.DOT,
                TokenType.IDENTIFIER, TokenType.EOF), types("Register -> Users.Lookup"));
    }

    @Test
    void testStringEscapes() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "\"a\\\"b\\n\\\\c\\q\"").readAll();

        assertEquals("a\"b\n\\c\\q", tokens.get(0).getText());
    }

    @Test
    void testKeywordsAreCaseSensitive() throws LexException {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.GRAPH, TokenType.EOF), types("Graph graph"));
    }

    @Test
    void testPositionsAreOneBased() throws LexException {
        List<Token> tokens = new TokenStream("test.tast", "graph G {\n  node A {}\n}").readAll();

        Token node = tokens.get(3);
        assertEquals(TokenType.NODE, node.getType());
        assertEquals(2, node.getSpan().getLine());
        assertEquals(3, node.getSpan().getColumn());
        assertEquals("test.tast", node.getSpan().getSourceName());
    }

    @Test
    void testUnknownNumberSuffix() {
        LexException e = assertThrows(LexException.class, () -> types("timeout: 10px"));

        assertEquals("unknown number suffix 'px' in '10px'", e.getReason());
        assertEquals(1, e.getSpan().getLine());
        assertEquals(10, e.getSpan().getColumn());
    }

    @Test
    void testNegativeDurationRejected() {
        LexException e = assertThrows(LexException.class, () -> types("-5s"));
        assertTrue(e.getReason().contains("negative"));
    }

    @Test
    void testUnterminatedString() {
        LexException e = assertThrows(LexException.class, () -> types("describe \"oops\nnode"));
        assertEquals("unterminated string literal", e.getReason());
    }

    @Test
    void testUnterminatedQuoteInStepText() {
        LexException e = assertThrows(LexException.class, () -> types("given a user named \"bob\n"));
        assertEquals("unterminated string literal in step text", e.getReason());
    }

    @Test
    void testInvalidCharacter() {
        LexException e = assertThrows(LexException.class, () -> types("node @A"));

        assertEquals("invalid character '@'", e.getReason());
        assertTrue(e.getMessage().startsWith("test.tast:1:6"));
    }

    @Test
    void testEofIsRepeated() throws LexException {
        Lexer lexer = new TokenStream("test.tast", "node").open();

        assertEquals(TokenType.NODE, lexer.nextToken().getType());
        assertFalse(lexer.isFinished());
        assertEquals(TokenType.EOF, lexer.nextToken().getType());
        assertEquals(TokenType.EOF, lexer.nextToken().getType());
        assertTrue(lexer.isFinished());
    }
}
