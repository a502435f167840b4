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

import dev.mars.tast.compiler.ir.ImportResolver;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory sources keyed by name.
 */
public class MapSourceLoader implements SourceLoader {

    private final Map<String, String> sources = new LinkedHashMap<>();

    public MapSourceLoader(Map<String, String> sources) {
        Objects.requireNonNull(sources, "Sources cannot be null");
        sources.forEach((name, text) -> this.sources.put(ImportResolver.normalize(name),
                Objects.requireNonNull(text, "Source text cannot be null")));
    }

    @Override
    public boolean exists(String sourceName) {
        return sources.containsKey(ImportResolver.normalize(sourceName));
    }

    @Override
    public String load(String sourceName) throws IOException {
        String text = sources.get(ImportResolver.normalize(sourceName));
        if (text == null) {
            throw new FileNotFoundException(sourceName);
        }
        return text;
    }
}
