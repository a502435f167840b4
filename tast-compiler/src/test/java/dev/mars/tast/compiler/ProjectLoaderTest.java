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

import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.parser.TastSourceParser;
import dev.mars.tast.core.exceptions.ImportException;
import dev.mars.tast.core.exceptions.LexException;
import dev.mars.tast.core.exceptions.ParseException;
import dev.mars.tast.core.exceptions.SourceSetException;
import dev.mars.tast.core.exceptions.TastException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProjectLoaderTest {

    @Mock
    private SourceLoader mockSourceLoader;

    private ProjectLoader projectLoader;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        projectLoader = new ProjectLoader(mockSourceLoader, new TastSourceParser(), 2);
    }

    private void source(String name, String text) throws IOException {
        when(mockSourceLoader.exists(name)).thenReturn(true);
        when(mockSourceLoader.load(name)).thenReturn(text);
    }

    private static List<String> names(List<SourceFile> files) {
        List<String> names = new ArrayList<>();
        for (SourceFile file : files) {
            names.add(file.getName());
        }
        return names;
    }

    @Test
    void testLoadsImportClosureInDiscoveryOrder() throws IOException, TastException {
        source("main.tast", "import Users from \"lib/users.tast\"\nimport Orders from \"orders.tast\"\ngraph Main {}");
        source("lib/users.tast", "import Shared from \"../shared.tast\"\ngraph Users {}");
        source("orders.tast", "graph Orders {}");
        source("shared.tast", "graph Shared {}");

        List<SourceFile> files = projectLoader.load(List.of("main.tast"));

        assertEquals(List.of("main.tast", "lib/users.tast", "orders.tast", "shared.tast"), names(files));
    }

    @Test
    void testSharedImportIsLoadedOnce() throws IOException, TastException {
        source("top.tast", "import L from \"l.tast\"\nimport R from \"r.tast\"\ngraph Top {}");
        source("l.tast", "import Base from \"base.tast\"\ngraph L {}");
        source("r.tast", "import Base from \"base.tast\"\ngraph R {}");
        source("base.tast", "graph Base {}");

        List<SourceFile> files = projectLoader.load(List.of("top.tast"));

        assertEquals(4, files.size());
        verify(mockSourceLoader, times(1)).load("base.tast");
    }

    @Test
    void testMissingImportIsLeftForValidation() throws IOException, TastException {
        source("main.tast", "import Users from \"users.tast\"\ngraph Main {}");

        List<SourceFile> files = projectLoader.load(List.of("main.tast"));

        assertEquals(List.of("main.tast"), names(files));
        verify(mockSourceLoader, never()).load("users.tast");
    }

    @Test
    void testMissingRoot() {
        ImportException e = assertThrows(ImportException.class, () -> projectLoader.load(List.of("nope.tast")));

        assertEquals(ImportException.Kind.MISSING_FILE, e.getKind());
        assertEquals("nope.tast", e.getImportPath());
    }

    @Test
    void testRootNamesAreNormalized() throws IOException, TastException {
        source("main.tast", "graph Main {}");

        List<SourceFile> files = projectLoader.load(List.of("./main.tast", "main.tast"));

        assertEquals(List.of("main.tast"), names(files));
    }

    @Test
    void testFailuresAreAggregated() throws IOException {
        source("main.tast", "import A from \"a.tast\"\nimport B from \"b.tast\"\ngraph Main {}");
        source("a.tast", "graph A { node @ }");
        source("b.tast", "graph B { node }");

        SourceSetException e = assertThrows(SourceSetException.class, () -> projectLoader.load(List.of("main.tast")));

        assertEquals(2, e.getFailures().size());
        assertInstanceOf(LexException.class, e.getFailures().get(0));
        assertInstanceOf(ParseException.class, e.getFailures().get(1));
        assertTrue(e.getMessage().startsWith("2 source file(s) failed to compile"));
    }

    @Test
    void testReadFailureIsReported() throws IOException {
        when(mockSourceLoader.exists("main.tast")).thenReturn(true);
        when(mockSourceLoader.load("main.tast")).thenThrow(new IOException("disk error"));

        SourceSetException e = assertThrows(SourceSetException.class, () -> projectLoader.load(List.of("main.tast")));

        TastException failure = e.getFailures().get(0);
        assertTrue(failure.getMessage().contains("main.tast"));
        assertInstanceOf(IOException.class, failure.getCause());
    }

    @Test
    void testInvalidParallelism() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProjectLoader(mockSourceLoader, new TastSourceParser(), 0));
    }
}
