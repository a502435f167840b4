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


package dev.mars.tast.compiler.parser;

import dev.mars.tast.compiler.ast.DataEntry;
import dev.mars.tast.compiler.ast.EdgeDecl;
import dev.mars.tast.compiler.ast.GraphDecl;
import dev.mars.tast.compiler.ast.NodeDecl;
import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.ast.StepDecl;
import dev.mars.tast.compiler.ast.StepKeyword;
import dev.mars.tast.compiler.ast.StepKind;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.exceptions.LexException;
import dev.mars.tast.core.exceptions.ParseException;
import dev.mars.tast.core.exceptions.TastException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TastSourceParserTest {

    private static final String AUTH_SOURCE = String.join("\n",
            "# Authentication flows",
            "import Users from \"users.tast\"",
            "",
            "fixture Admin { email: \"admin@example.com\", role: admin }",
            "",
            "graph Auth {",
            "  config { base_url: \"http://localhost\", timeout: 5s }",
            "",
            "  node Register {",
            "    describe \"Create a new account\"",
            "    tags [smoke, \"fast\"]",
            "    provides { user_id }",
            "    given a user with email \"a@b.c\"",
            "    and password \"secret\" { attempts: 3 }",
            "    when the user registers",
            "    then the response status is 201",
            "    but no email is sent",
            "  }",
            "",
            "  node Login {",
            "    requires: [user_id]",
            "    fixture Admin",
            "    config { retries: 2, verbose: true, proxy: null }",
            "    when the user logs in with <email>",
            "  }",
            "",
            "  Register -> Login { passes [user_id] describe \"hand over the account\" config { user_id: 7 } }",
            "  Login -> Users.Lookup",
            "}",
            "");

    private TastSourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new TastSourceParser();
    }

    @Test
    void testParseTopLevelDeclarations() throws TastException {
        SourceFile file = parser.parseFromString("auth.tast", AUTH_SOURCE);

        assertEquals("auth.tast", file.getName());
        assertEquals(1, file.getImports().size());
        assertEquals("Users", file.getImports().get(0).getGraphName());
        assertEquals("users.tast", file.getImports().get(0).getPath());
        assertEquals(1, file.getFixtures().size());
        assertEquals("Admin", file.getFixtures().get(0).getName());
        assertEquals(1, file.getGraphs().size());
        assertTrue(file.findGraph("Auth").isPresent());
    }

    @Test
    void testParseNodeDeclarations() throws TastException {
        GraphDecl graph = parser.parseFromString("auth.tast", AUTH_SOURCE).findGraph("Auth").orElseThrow();

        assertEquals(2, graph.getNodes().size());
        NodeDecl register = graph.findNode("Register").orElseThrow();
        assertEquals("Create a new account", register.getDescription());
        assertEquals(Set.of("smoke", "fast"), register.getTags());
        assertEquals(Set.of("user_id"), register.getProvides());
        assertEquals(5, register.getSteps().size());

        NodeDecl login = graph.findNode("Login").orElseThrow();
        assertEquals(Set.of("user_id"), login.getRequires());
        assertEquals(1, login.getFixtureAttachments().size());
        assertEquals("Admin", login.getFixtureAttachments().get(0).getKey());
        assertEquals(3, login.getConfig().getEntries().size());
        assertEquals(LiteralValue.ofBoolean(true), login.getConfig().literals().get("verbose"));
        assertEquals(LiteralValue.nullValue(), login.getConfig().literals().get("proxy"));
    }

    @Test
    void testContinuationStepsInheritKind() throws TastException {
        NodeDecl register = parser.parseFromString("auth.tast", AUTH_SOURCE)
                .findGraph("Auth").orElseThrow().findNode("Register").orElseThrow();
        List<StepDecl> steps = register.getSteps();

        assertEquals(StepKeyword.AND, steps.get(1).getKeyword());
        assertEquals(StepKind.PRECONDITION, steps.get(1).getKind());
        assertEquals(StepKind.ACTION, steps.get(2).getKind());
        assertEquals(StepKind.ASSERTION, steps.get(3).getKind());
        assertEquals(StepKeyword.BUT, steps.get(4).getKeyword());
        assertEquals(StepKind.ASSERTION, steps.get(4).getKind());
    }

    @Test
    void testStepProseAndInlineData() throws TastException {
        NodeDecl register = parser.parseFromString("auth.tast", AUTH_SOURCE)
                .findGraph("Auth").orElseThrow().findNode("Register").orElseThrow();

        StepDecl given = register.getSteps().get(0);
        assertEquals("a user with email \"a@b.c\"", given.getText());
        assertEquals("user email \"a@b.c\"", given.getNormalizedText());
        assertEquals(LiteralValue.ofString("a@b.c"), given.getData().get("email"));

        StepDecl and = register.getSteps().get(1);
        assertEquals(LiteralValue.ofString("secret"), and.getData().get("password"));
        assertEquals(LiteralValue.ofNumber("3"), and.getData().get("attempts"));
    }

    @Test
    void testStepParameters() throws TastException {
        NodeDecl login = parser.parseFromString("auth.tast", AUTH_SOURCE)
                .findGraph("Auth").orElseThrow().findNode("Login").orElseThrow();

        assertEquals(List.of("email"), login.getSteps().get(0).getParameters());
    }

    @Test
    void testHashInStepTextIsNotAComment() throws TastException {
        NodeDecl node = parser.parseFromString("orders.tast",
                        "graph G {\n  node A {\n    then order #42 is shown\n  }\n}")
                .findGraph("G").orElseThrow().findNode("A").orElseThrow();

        StepDecl then = node.getSteps().get(0);
        assertEquals("order #42 is shown", then.getText());
        assertEquals(LiteralValue.ofNumber("42"), then.getData().get("order"));
    }

    @Test
    void testParseEdges() throws TastException {
        GraphDecl graph = parser.parseFromString("auth.tast", AUTH_SOURCE).findGraph("Auth").orElseThrow();

        assertEquals(2, graph.getEdges().size());
        EdgeDecl first = graph.getEdges().get(0);
        assertEquals("Register", first.getSource().getName());
        assertFalse(first.getSource().isQualified());
        assertEquals(Set.of("user_id"), first.getPasses());
        assertEquals("hand over the account", first.getDescription());
        assertEquals(LiteralValue.ofNumber("7"), first.getConfig().literals().get("user_id"));

        EdgeDecl second = graph.getEdges().get(1);
        assertTrue(second.getTarget().isQualified());
        assertEquals("Users", second.getTarget().getGraph());
        assertEquals("Lookup", second.getTarget().getName());
        assertEquals("Users.Lookup", second.getTarget().toString());
    }

    @Test
    void testGraphConfig() throws TastException {
        GraphDecl graph = parser.parseFromString("auth.tast", AUTH_SOURCE).findGraph("Auth").orElseThrow();

        assertEquals(LiteralValue.ofString("http://localhost"), graph.getConfig().literals().get("base_url"));
        assertEquals(LiteralValue.ofDuration("5s"), graph.getConfig().literals().get("timeout"));
    }

    @Test
    void testRepeatedConfigBlocksMerge() throws TastException {
        GraphDecl graph = parser.parseFromString("g.tast",
                "graph G { config { a: 1 } config: { b: 2 } }").findGraph("G").orElseThrow();

        assertEquals(2, graph.getConfig().getEntries().size());
    }

    @Test
    void testSpreadEntriesInDataBlocks() throws TastException {
        GraphDecl graph = parser.parseFromString("g.tast",
                "graph G { fixture Base { a: 1 } node N { config { Base, b: 2 } } }").findGraph("G").orElseThrow();

        List<DataEntry> entries = graph.findNode("N").orElseThrow().getConfig().getEntries();
        assertTrue(entries.get(0).isSpread());
        assertEquals("Base", entries.get(0).getKey());
        assertFalse(entries.get(1).isSpread());
        assertEquals(1, graph.getFixtures().size());
    }

    @Test
    void testStepsCannotStartWithAnd() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseFromString("bad.tast", "graph G {\n  node N {\n    and something\n  }\n}"));

        assertTrue(e.getMessage().contains("cannot start with 'and'"));
        assertEquals(3, e.getSpan().getLine());
        assertEquals(5, e.getSpan().getColumn());
    }

    @Test
    void testStepsCannotStartWithBut() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseFromString("bad.tast", "graph G { node N { but nothing\n } }"));

        assertTrue(e.getMessage().contains("cannot start with 'but'"));
    }

    @Test
    void testUnexpectedTopLevelToken() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseFromString("bad.tast", "node N {}"));

        assertEquals("'graph', 'import' or 'fixture'", e.getExpected());
        assertNotNull(e.getFound());
    }

    @Test
    void testMissingArrow() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseFromString("bad.tast", "graph G { A B }"));

        assertEquals("'->' after edge source 'A'", e.getExpected());
    }

    @Test
    void testUnclosedNode() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseFromString("bad.tast", "graph G { node N { describe \"x\""));

        assertEquals("'}' closing node 'N'", e.getExpected());
        assertEquals("end of input", e.getFound());
    }

    @Test
    void testLexErrorsPropagate() {
        assertThrows(LexException.class, () -> parser.parseFromString("bad.tast", "graph G { config { t: 3px } }"));
    }

    @Test
    void testParseFromFile(@TempDir Path dir) throws IOException, TastException {
        Path file = dir.resolve("simple.tast");
        Files.writeString(file, "graph Simple { node Only { when it runs } }", StandardCharsets.UTF_8);

        SourceFile parsed = parser.parse(file);

        assertEquals(1, parsed.getGraphs().size());
        assertEquals(1, parsed.getGraphs().get(0).getNodes().size());
    }

    @Test
    void testParseMissingFile(@TempDir Path dir) {
        TastException e = assertThrows(TastException.class, () -> parser.parse(dir.resolve("missing.tast")));
        assertTrue(e.getMessage().startsWith("Failed to read source file"));
    }
}
