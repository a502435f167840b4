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


package dev.mars.tast.compiler.graph;

import dev.mars.tast.compiler.ir.IrBuilder;
import dev.mars.tast.compiler.ir.IrNode;
import dev.mars.tast.compiler.parser.TastSourceParser;
import dev.mars.tast.core.exceptions.CompilationException;
import dev.mars.tast.core.exceptions.CycleException;
import dev.mars.tast.core.exceptions.TastException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Graph queries over small graphs compiled from source text.
 */
class DependencyGraphTest {

    private static DependencyGraph graph(String body) throws TastException {
        return DependencyGraph.of(new IrBuilder()
                .build(List.of(new TastSourceParser().parseFromString("g.tast", "graph G {\n" + body + "\n}")))
                .findGraph("G").orElseThrow());
    }

    private static List<String> names(List<IrNode> nodes) {
        List<String> names = new ArrayList<>();
        for (IrNode node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    @Test
    void testEmptyGraph() throws TastException {
        DependencyGraph graph = graph("");

        assertEquals(0, graph.nodeCount());
        assertTrue(graph.topologicalOrder().isEmpty());
        assertFalse(graph.hasCycles());
        assertTrue(graph.roots().isEmpty());
    }

    @Test
    void testAdjacency() throws TastException {
        DependencyGraph graph = graph(String.join("\n",
                "node A {} node B {} node C {}",
                "A -> B",
                "A -> C",
                "B -> C"));

        assertEquals(3, graph.nodeCount());
        assertEquals(3, graph.edgeCount());
        assertEquals(List.of("B", "C"), graph.successors("A"));
        assertEquals(List.of("A", "B"), graph.predecessors("C"));
        assertEquals(List.of("A"), graph.roots());
        assertEquals(List.of("C"), graph.leaves());
        assertEquals(2, graph.incomingEdges("C").size());
        assertTrue(graph.outgoingEdges("C").isEmpty());
        assertEquals(1, graph.positionOf("B"));
    }

    @Test
    void testPositionOfUnknownNode() throws TastException {
        DependencyGraph graph = graph("node A {}");
        assertThrows(IllegalArgumentException.class, () -> graph.positionOf("Z"));
    }

    @Test
    void testTopologicalOrderRespectsEdges() throws TastException {
        DependencyGraph graph = graph(String.join("\n",
                "node Checkout {} node Login {} node Register {} node Browse {}",
                "Register -> Login",
                "Login -> Checkout",
                "Browse -> Checkout"));

        List<String> order = names(graph.topologicalOrder());

        assertEquals(4, order.size());
        assertTrue(order.indexOf("Register") < order.indexOf("Login"));
        assertTrue(order.indexOf("Login") < order.indexOf("Checkout"));
        assertTrue(order.indexOf("Browse") < order.indexOf("Checkout"));
    }

    @Test
    void testTopologicalTieBreakIsDeclarationOrder() throws TastException {
        DependencyGraph graph = graph(String.join("\n",
                "node C {} node A {} node B {} node D {}",
                "A -> D",
                "C -> D"));

        assertEquals(List.of("C", "A", "B", "D"), names(graph.topologicalOrder()));
    }

    @Test
    void testTopologicalOrderIsDeterministic() throws TastException {
        String body = String.join("\n",
                "node E {} node D {} node C {} node B {} node A {}",
                "A -> B", "A -> C", "D -> B", "E -> A");

        List<String> first = names(graph(body).topologicalOrder());
        for (int i = 0; i < 5; i++) {
            assertEquals(first, names(graph(body).topologicalOrder()));
        }
    }

    @Test
    void testFindCycle() throws TastException {
        DependencyGraph graph = graph("node A {} node B {}\nA -> B\nB -> A");

        assertTrue(graph.hasCycles());
        assertEquals(List.of("A", "B", "A"), graph.findCycle());
    }

    @Test
    void testSelfLoop() throws TastException {
        DependencyGraph graph = graph("node A {}\nA -> A");

        assertEquals(List.of("A", "A"), graph.findCycle());
    }

    @Test
    void testCycleNotReachableFromFirstNode() throws TastException {
        DependencyGraph graph = graph("node Start {} node X {} node Y {} node Z {}\nX -> Y\nY -> Z\nZ -> X");

        assertEquals(List.of("X", "Y", "Z", "X"), graph.findCycle());
    }

    @Test
    void testTopologicalOrderFailsOnCycle() throws TastException {
        DependencyGraph graph = graph("node A {} node B {}\nA -> B\nB -> A");

        CycleException e = assertThrows(CycleException.class, graph::topologicalOrder);

        assertEquals("G", e.getGraphName());
        assertEquals(List.of("A", "B", "A"), e.getCycle());
        assertTrue(e.getMessage().contains("A -> B -> A"));
    }

    @Test
    void testReachableFrom() throws TastException {
        DependencyGraph graph = graph(String.join("\n",
                "node A {} node B {} node C {} node D {}",
                "A -> B", "B -> C", "D -> C"));

        assertEquals(Set.of("A", "B", "C"), graph.reachableFrom("A"));
        assertEquals(List.of("A", "B", "C"), new ArrayList<>(graph.reachableFrom("A")));
        assertEquals(Set.of("C"), graph.reachableFrom("C"));
    }

    @Test
    void testReachableFromUnknownNode() throws TastException {
        DependencyGraph graph = graph("node A {}");

        CompilationException e = assertThrows(CompilationException.class, () -> graph.reachableFrom("Z"));

        assertEquals(CompilationException.Kind.UNKNOWN_NODE, e.getKind());
        assertEquals("Z", e.getSubject());
    }

    @Test
    void testSubgraphIsInduced() throws TastException {
        DependencyGraph graph = graph(String.join("\n",
                "node A {} node B {} node C {}",
                "A -> B", "B -> C", "A -> C"));

        DependencyGraph sub = graph.subgraph(List.of("C", "A"));

        assertEquals(List.of("A", "C"), names(sub.getNodes()));
        assertEquals(1, sub.edgeCount());
        assertEquals("A", sub.getEdges().get(0).getSource());
        assertEquals("G", sub.getName());
    }

    @Test
    void testSubgraphWithUnknownNode() throws TastException {
        DependencyGraph graph = graph("node A {}");
        assertThrows(CompilationException.class, () -> graph.subgraph(List.of("A", "Nope")));
    }
}
