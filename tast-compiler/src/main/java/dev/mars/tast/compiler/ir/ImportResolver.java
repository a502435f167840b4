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


package dev.mars.tast.compiler.ir;

import dev.mars.tast.compiler.ast.ImportDecl;
import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.core.exceptions.ImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves {@code import Graph from "path"} declarations between parsed files.
 *
 * <p>Failures are reported in a fixed order: first any import of a file that is
 * not in the set, then any file import cycle, then any import naming a graph the
 * target file does not declare.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class ImportResolver {

    private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

    private enum Mark { IN_PROGRESS, DONE }

    /**
     * Normalizes a source name so that different spellings of one path compare equal.
     */
    public static String normalize(String sourceName) {
        return Paths.get(sourceName).normalize().toString().replace('\\', '/');
    }

    /**
     * Resolves an import path relative to the directory of the importing file.
     */
    public static String resolvePath(String importer, String importPath) {
        Path resolved = Paths.get(importer).resolveSibling(importPath).normalize();
        return resolved.toString().replace('\\', '/');
    }

    /**
     * Checks every import and returns, per normalized file name, the names of the
     * graphs that file imports, in declaration order.
     *
     * @throws ImportException on a missing file, an import cycle or a missing graph
     */
    public Map<String, Set<String>> resolve(List<SourceFile> files) throws ImportException {
        Objects.requireNonNull(files, "Files cannot be null");
        Map<String, SourceFile> byName = new LinkedHashMap<>();
        for (SourceFile file : files) {
            byName.put(normalize(file.getName()), file);
        }

        Map<String, List<String>> fileEdges = new LinkedHashMap<>();
        for (Map.Entry<String, SourceFile> entry : byName.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (ImportDecl decl : entry.getValue().getImports()) {
                String target = resolvePath(entry.getKey(), decl.getPath());
                if (!byName.containsKey(target)) {
                    throw new ImportException(ImportException.Kind.MISSING_FILE, entry.getKey(), target,
                            decl.getSpan() + ": imported file '" + decl.getPath() + "' not found (resolved to "
                                    + target + ")");
                }
                targets.add(target);
            }
            fileEdges.put(entry.getKey(), targets);
        }

        List<String> cycle = findCycle(fileEdges);
        if (!cycle.isEmpty()) {
            throw ImportException.cycle(cycle);
        }

        Map<String, Set<String>> imported = new LinkedHashMap<>();
        for (Map.Entry<String, SourceFile> entry : byName.entrySet()) {
            Set<String> graphs = new LinkedHashSet<>();
            for (ImportDecl decl : entry.getValue().getImports()) {
                String target = resolvePath(entry.getKey(), decl.getPath());
                if (byName.get(target).findGraph(decl.getGraphName()).isEmpty()) {
                    throw new ImportException(ImportException.Kind.MISSING_GRAPH, entry.getKey(), target,
                            decl.getSpan() + ": file '" + target + "' does not declare graph '"
                                    + decl.getGraphName() + "'");
                }
                graphs.add(decl.getGraphName());
            }
            imported.put(entry.getKey(), graphs);
        }
        logger.debug("Resolved imports for {} file(s)", imported.size());
        return imported;
    }

    /**
     * Three-color depth-first search over the file import graph. Returns the first
     * cycle found, closed (first and last entries equal), or an empty list.
     */
    private List<String> findCycle(Map<String, List<String>> fileEdges) {
        Map<String, Mark> marks = new HashMap<>();
        for (String start : fileEdges.keySet()) {
            if (marks.containsKey(start)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            List<Integer> nextChild = new ArrayList<>();
            path.add(start);
            nextChild.add(0);
            marks.put(start, Mark.IN_PROGRESS);

            while (!path.isEmpty()) {
                int top = path.size() - 1;
                String file = path.get(top);
                List<String> targets = fileEdges.get(file);
                int child = nextChild.get(top);
                if (child >= targets.size()) {
                    marks.put(file, Mark.DONE);
                    path.remove(top);
                    nextChild.remove(top);
                    continue;
                }
                nextChild.set(top, child + 1);
                String target = targets.get(child);
                Mark mark = marks.get(target);
                if (mark == Mark.IN_PROGRESS) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    cycle.add(target);
                    return cycle;
                }
                if (mark == null) {
                    marks.put(target, Mark.IN_PROGRESS);
                    path.add(target);
                    nextChild.add(0);
                }
            }
        }
        return List.of();
    }
}
