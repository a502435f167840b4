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


package dev.mars.tast.core.exceptions;

import java.util.Objects;

/**
 * Exception thrown when a traversal cannot produce a plan: the requested root or
 * endpoint does not exist, the requested graph does not exist, or no path joins
 * the requested endpoints.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class CompilationException extends TastException {

    public enum Kind {
        UNKNOWN_NODE,
        UNKNOWN_GRAPH,
        NO_PATH_FOUND
    }

    private final Kind kind;
    private final String subject;

    public CompilationException(Kind kind, String subject, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.subject = subject;
    }

    public static CompilationException unknownNode(String graphName, String nodeName) {
        return new CompilationException(Kind.UNKNOWN_NODE, nodeName,
                "Unknown node '" + nodeName + "' in graph '" + graphName + "'");
    }

    public static CompilationException unknownGraph(String graphName) {
        return new CompilationException(Kind.UNKNOWN_GRAPH, graphName,
                "Unknown graph '" + graphName + "'");
    }

    public static CompilationException noPath(String from, String to) {
        return new CompilationException(Kind.NO_PATH_FOUND, from + " -> " + to,
                "No path from '" + from + "' to '" + to + "'");
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The node, graph or path the failure is about.
     */
    public String getSubject() {
        return subject;
    }
}
