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

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a traversal that needs an acyclic graph meets a cycle.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-06
 * @version 1.0
 */
public class CycleException extends TastException {

    private final String graphName;
    private final List<String> cycle;

    /**
     * @param graphName the graph containing the cycle
     * @param cycle the node names along the cycle, first and last entries equal
     */
    public CycleException(String graphName, List<String> cycle) {
        super("Cycle detected in graph '" + graphName + "': "
                + String.join(" -> ", Objects.requireNonNull(cycle, "Cycle cannot be null")));
        this.graphName = graphName;
        this.cycle = List.copyOf(cycle);
    }

    public String getGraphName() {
        return graphName;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
