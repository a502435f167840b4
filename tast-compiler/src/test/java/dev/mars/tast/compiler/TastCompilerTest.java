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


package dev.mars.tast.compiler;

import dev.mars.tast.compiler.ir.IrGraph;
import dev.mars.tast.compiler.ir.IrProgram;
import dev.mars.tast.compiler.plan.Plan;
import dev.mars.tast.compiler.plan.PlanInput;
import dev.mars.tast.compiler.plan.PlanStep;
import dev.mars.tast.compiler.plan.TagPredicate;
import dev.mars.tast.compiler.plan.Traversals;
import dev.mars.tast.config.TastConfiguration;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.ValidationResult;
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;
import dev.mars.tast.core.exceptions.ImportException;
import dev.mars.tast.core.exceptions.SourceSetException;
import dev.mars.tast.core.exceptions.TastException;
import dev.mars.tast.core.exceptions.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end compilation through the facade.
 */
class TastCompilerTest {

    private TastCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new TastCompiler(new TastConfiguration(new Properties()));
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(TastCompilerTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void testCompileFileWithImports() throws Exception {
        IrProgram program = compiler.compile(fixture("auth.tast"));

        assertEquals(List.of("Auth", "Users"), program.getGraphNames());
        IrGraph auth = program.findGraph("Auth").orElseThrow();
        assertEquals(4, auth.getNodes().size());
        assertTrue(auth.findNode("Users.Audit").orElseThrow().isImported());
    }

    @Test
    void testPlanFromFile() throws Exception {
        IrProgram program = compiler.compile(fixture("auth.tast"));

        Plan plan = compiler.plan(program, "Auth", Traversals.topological());

        assertEquals(4, plan.size());
        assertEquals("Register", plan.getSteps().get(0).getNode());
        PlanStep login = plan.findStep("Login").orElseThrow();
        assertEquals(List.of("Register"), login.getDependsOn());
        assertEquals("from:Register", login.getInputs().get("user_id").getSource());
        assertEquals(PlanInput.STATIC,
                login.getActions().get(0).getParameters().get("email").getSource());
        assertEquals(LiteralValue.ofString("new@example.com"),
                login.getActions().get(0).getParameters().get("email").getValue());
        PlanStep profile = plan.findStep("Profile").orElseThrow();
        assertEquals("from:Login", profile.getAssertions().get(0).getParameters().get("auth_token").getSource());
        assertEquals(LiteralValue.ofDuration("30s"), plan.getConfig().get("timeout"));
    }

    @Test
    void testDefaultStrategy() throws Exception {
        IrProgram program = compiler.compile(fixture("auth.tast"));

        assertEquals("topological", compiler.plan(program, "Auth").getTraversal());
    }

    @Test
    void testConfiguredRootedDefaultStrategyStartsAtFirstRoot() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(TastConfiguration.DEFAULT_STRATEGY_KEY, "bfs");
        TastCompiler bfsCompiler = new TastCompiler(new TastConfiguration(properties));
        IrProgram program = bfsCompiler.compile(fixture("auth.tast"));

        Plan plan = bfsCompiler.plan(program, "Auth");

        assertEquals("bfs", plan.getTraversal());
        assertEquals("Register", plan.getSteps().get(0).getNode());
    }

    @Test
    void testConfiguredRootedDefaultStrategyOnGraphsWithoutRoots() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(TastConfiguration.DEFAULT_STRATEGY_KEY, "dfs");
        TastCompiler dfsCompiler = new TastCompiler(new TastConfiguration(properties));

        Plan ring = dfsCompiler.plan(dfsCompiler.compile(fixture("cyclic.tast")), "Ring");
        assertEquals("dfs", ring.getTraversal());
        assertEquals("A", ring.getSteps().get(0).getNode());
        assertEquals(2, ring.size());

        Plan empty = dfsCompiler.plan(dfsCompiler.compileSource("empty.tast", "graph Empty {\n}"), "Empty");
        assertEquals("dfs", empty.getTraversal());
        assertEquals(0, empty.size());
    }

    @Test
    void testUnknownConfiguredStrategyFallsBackToTopological() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(TastConfiguration.DEFAULT_STRATEGY_KEY, "zigzag");
        TastCompiler fallback = new TastCompiler(new TastConfiguration(properties));

        assertEquals("topological", fallback.plan(fallback.compile(fixture("auth.tast")), "Auth").getTraversal());
    }

    @Test
    void testTagFilteredPlan() throws Exception {
        IrProgram program = compiler.compile(fixture("auth.tast"));

        Plan plan = compiler.plan(program, "Auth",
                Traversals.tagFiltered(Traversals.topological(), TagPredicate.parse("auth AND NOT slow")));

        assertEquals(2, plan.size());
        assertEquals(4, plan.getNodesTotal());
    }

    @Test
    void testUnknownGraph() throws Exception {
        IrProgram program = compiler.compile(fixture("auth.tast"));

        CompilationException e = assertThrows(CompilationException.class,
                () -> compiler.plan(program, "Missing", Traversals.topological()));

        assertEquals(CompilationException.Kind.UNKNOWN_GRAPH, e.getKind());
        assertEquals("Missing", e.getSubject());
    }

    @Test
    void testCyclicGraph() throws Exception {
        IrProgram program = compiler.compile(fixture("cyclic.tast"));

        CycleException e = assertThrows(CycleException.class,
                () -> compiler.plan(program, "Ring", Traversals.topological()));
        assertEquals(List.of("A", "B", "A"), e.getCycle());

        assertEquals(2, compiler.plan(program, "Ring", Traversals.depthFirst("A")).size());
    }

    @Test
    void testCompileSource() throws TastException {
        IrProgram program = compiler.compileSource("inline.tast", "graph Inline { node Only { when it runs } }");

        Plan plan = compiler.plan(program.findGraph("Inline").orElseThrow(), Traversals.topological());

        assertEquals(1, plan.size());
    }

    @Test
    void testCompileSources() throws TastException {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.tast", "import B from \"b.tast\"\ngraph A { node Start {} Start -> B.End }");
        sources.put("b.tast", "graph B { node End {} }");

        IrProgram program = compiler.compileSources(sources);

        assertEquals(List.of("A", "B"), program.getGraphNames());
    }

    @Test
    void testMissingDependencyThenFixedByPasses() throws TastException {
        String broken = String.join("\n",
                "graph Auth {",
                "  node Login { provides [auth_token] }",
                "  node Orders { requires [auth_token] }",
                "  Login -> Orders",
                "}");

        ValidationException e = assertThrows(ValidationException.class,
                () -> compiler.compileSource("auth.tast", broken));
        assertEquals(ValidationResult.Code.MISSING_DEPENDENCY, e.getResult().getErrors().get(0).getCode());

        IrProgram fixed = compiler.compileSource("auth.tast",
                broken.replace("Login -> Orders", "Login -> Orders { passes { auth_token } }"));
        assertTrue(fixed.findGraph("Auth").isPresent());
    }

    @Test
    void testImportCycleBetweenFiles() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.tast", "import B from \"b.tast\"\ngraph A {}");
        sources.put("b.tast", "import A from \"a.tast\"\ngraph B {}");

        ImportException e = assertThrows(ImportException.class, () -> compiler.compileSources(sources));

        assertEquals(List.of("a.tast", "b.tast", "a.tast"), e.getCycle());
    }

    @Test
    void testMissingImportedFile() {
        ImportException e = assertThrows(ImportException.class,
                () -> compiler.compileSource("a.tast", "import B from \"b.tast\"\ngraph A {}"));

        assertEquals(ImportException.Kind.MISSING_FILE, e.getKind());
    }

    @Test
    void testParseFailuresAreAggregated() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("a.tast", "graph A {");
        sources.put("b.tast", "node B {}");

        SourceSetException e = assertThrows(SourceSetException.class, () -> compiler.compileSources(sources));

        assertEquals(2, e.getFailures().size());
    }

    @Test
    void testExcessPassesPolicyFromConfiguration() throws TastException {
        Properties properties = new Properties();
        properties.setProperty(TastConfiguration.EXCESS_PASSES_KEY, "warn");
        TastCompiler warning = new TastCompiler(new TastConfiguration(properties));

        IrProgram program = warning.compileSource("x.tast", String.join("\n",
                "graph X {",
                "  node A { provides [a, b] }",
                "  node B { requires [a] }",
                "  A -> B { passes [a, b] }",
                "}"));

        assertEquals(1, program.getWarnings().size());
    }

    @Test
    void testCompileDirectory(@TempDir Path dir) throws IOException, TastException {
        Files.createDirectories(dir.resolve("lib"));
        Files.writeString(dir.resolve("main.tast"),
                "import Lib from \"lib/lib.tast\"\ngraph Main { node M {} M -> Lib.L }", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("lib/lib.tast"), "graph Lib { node L {} }", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("notes.txt"), "not a source", StandardCharsets.UTF_8);

        IrProgram program = compiler.compileDirectory(dir);

        assertEquals(List.of("Lib", "Main"), program.getGraphNames());
    }

    @Test
    void testCompileEmptyDirectory(@TempDir Path dir) {
        TastException e = assertThrows(TastException.class, () -> compiler.compileDirectory(dir));
        assertTrue(e.getMessage().startsWith("No .tast files found"));
    }

    @Test
    void testMetricsCanBeDisabled() throws TastException {
        Properties properties = new Properties();
        properties.setProperty(TastConfiguration.METRICS_ENABLED_KEY, "false");
        TastCompiler quiet = new TastCompiler(new TastConfiguration(properties));

        IrProgram program = quiet.compileSource("q.tast", "graph Q { node N {} }");

        assertEquals(1, quiet.plan(program, "Q").size());
        assertFalse(quiet.getConfiguration().isMetricsEnabled());
    }
}
