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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Loads sources from the file system, resolving relative names against a base directory.
 */
public class FileSystemSourceLoader implements SourceLoader {

    private final Path baseDirectory;

    public FileSystemSourceLoader() {
        this(Paths.get(""));
    }

    public FileSystemSourceLoader(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "Base directory cannot be null");
    }

    @Override
    public boolean exists(String sourceName) {
        Path path = resolve(sourceName);
        return Files.isRegularFile(path) && Files.isReadable(path);
    }

    @Override
    public String load(String sourceName) throws IOException {
        return Files.readString(resolve(sourceName), StandardCharsets.UTF_8);
    }

    private Path resolve(String sourceName) {
        return baseDirectory.resolve(Objects.requireNonNull(sourceName, "Source name cannot be null"));
    }
}
