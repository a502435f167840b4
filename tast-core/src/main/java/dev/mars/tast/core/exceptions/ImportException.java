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
 * Exception thrown when an {@code import} declaration cannot be resolved.
 * Import failures halt IR construction for every graph depending on them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public class ImportException extends TastException {

    public enum Kind {
        MISSING_FILE,
        MISSING_GRAPH,
        IMPORT_CYCLE
    }

    private final Kind kind;
    private final String sourceName;
    private final String importPath;
    private final List<String> cycle;

    public ImportException(Kind kind, String sourceName, String importPath, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.sourceName = sourceName;
        this.importPath = importPath;
        this.cycle = List.of();
    }

    /**
     * Creates an import cycle failure. The cycle is closed: its first and last
     * entries name the same file.
     */
    public static ImportException cycle(List<String> cycle) {
        Objects.requireNonNull(cycle, "Cycle cannot be null");
        return new ImportException(cycle);
    }

    private ImportException(List<String> cycle) {
        super("import cycle detected: " + String.join(" -> ", cycle));
        this.kind = Kind.IMPORT_CYCLE;
        this.sourceName = cycle.isEmpty() ? null : cycle.get(0);
        this.importPath = cycle.size() > 1 ? cycle.get(1) : null;
        this.cycle = List.copyOf(cycle);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The file containing the failing import.
     */
    public String getSourceName() {
        return sourceName;
    }

    public String getImportPath() {
        return importPath;
    }

    /**
     * The file cycle for {@link Kind#IMPORT_CYCLE}, empty otherwise.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
