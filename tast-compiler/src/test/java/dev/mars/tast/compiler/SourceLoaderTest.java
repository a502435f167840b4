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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceLoaderTest {

    @Test
    void testFileSystemSourceLoader(@TempDir Path dir) throws IOException {
        Files.createDirectories(dir.resolve("lib"));
        Files.writeString(dir.resolve("lib/users.tast"), "graph Users {}", StandardCharsets.UTF_8);
        FileSystemSourceLoader loader = new FileSystemSourceLoader(dir);

        assertTrue(loader.exists("lib/users.tast"));
        assertFalse(loader.exists("lib/missing.tast"));
        assertFalse(loader.exists("lib"));
        assertEquals("graph Users {}", loader.load("lib/users.tast"));
        assertThrows(IOException.class, () -> loader.load("lib/missing.tast"));
    }

    @Test
    void testMapSourceLoaderNormalizesNames() throws IOException {
        MapSourceLoader loader = new MapSourceLoader(Map.of("./lib/../main.tast", "graph Main {}"));

        assertTrue(loader.exists("main.tast"));
        assertEquals("graph Main {}", loader.load("main.tast"));
        assertFalse(loader.exists("other.tast"));
        assertThrows(FileNotFoundException.class, () -> loader.load("other.tast"));
    }
}
