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


package dev.mars.tast.emit;

import dev.mars.tast.compiler.graph.DependencyGraph;
import dev.mars.tast.compiler.ir.IrEdge;
import dev.mars.tast.compiler.ir.IrNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a dependency graph as a Graphviz DOT digraph or a Mermaid flowchart.
 * Nodes are labelled with their description when they have one. Edges are
 * labelled with their description, or else with the keys they pass. Imported
 * nodes are drawn dashed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class GraphRenderer {

    public String toDot(DependencyGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        StringBuilder out = new StringBuilder();
        out.append("digraph ").append(dotQuote(graph.getName())).append(" {\n");
        out.append("  rankdir=LR;\n");
        for (IrNode node : graph.getNodes()) {
            out.append("  ").append(dotQuote(node.getName()))
                    .append(" [label=").append(dotQuote(label(node)));
            if (node.isImported()) {
                out.append(", style=dashed");
            }
            out.append("];\n");
        }
        for (IrEdge edge : graph.getEdges()) {
            out.append("  ").append(dotQuote(edge.getSource())).append(" -> ").append(dotQuote(edge.getTarget()));
            String label = label(edge);
            if (label != null) {
                out.append(" [label=").append(dotQuote(label)).append(']');
            }
            out.append(";\n");
        }
        out.append("}\n");
        return out.toString();
    }

    public String toMermaid(DependencyGraph graph) {
        Objects.requireNonNull(graph, "Graph cannot be null");
        // Mermaid ids cannot contain dots.
        Map<String, String> ids = new HashMap<>();
        StringBuilder out = new StringBuilder("graph TD\n");
        for (IrNode node : graph.getNodes()) {
            String id = node.getName().replace('.', '_');
            ids.put(node.getName(), id);
            out.append("  ").append(id).append("[\"").append(mermaidText(label(node))).append("\"]\n");
        }
        for (IrEdge edge : graph.getEdges()) {
            out.append("  ").append(ids.get(edge.getSource()));
            String label = label(edge);
            if (label != null) {
                out.append(" -->|\"").append(mermaidText(label)).append("\"| ");
            } else {
                out.append(" --> ");
            }
            out.append(ids.get(edge.getTarget())).append('\n');
        }
        for (IrNode node : graph.getNodes()) {
            if (node.isImported()) {
                out.append("  style ").append(ids.get(node.getName())).append(" stroke-dasharray: 5 5\n");
            }
        }
        return out.toString();
    }

    private static String label(IrNode node) {
        return node.getDescription() != null ? node.getDescription() : node.getName();
    }

    private static String label(IrEdge edge) {
        if (edge.getDescription() != null) {
            return edge.getDescription();
        }
        return edge.getPasses().isEmpty() ? null : String.join(", ", edge.getPasses());
    }

    private static String dotQuote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }

    private static String mermaidText(String text) {
        return text.replace("\"", "#quot;").replace("\n", " ");
    }
}
