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


package dev.mars.tast.compiler.parser;

import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.lexer.TokenStream;
import dev.mars.tast.core.exceptions.LexException;
import dev.mars.tast.core.exceptions.ParseException;
import dev.mars.tast.core.exceptions.TastException;

import java.nio.file.Path;

/**
 * Turns source text into a {@link SourceFile} syntax tree.
 * Implementations are stateless and may be shared between threads.
 */
public interface SourceParser {

    /**
     * Reads and parses a file. The file's path string becomes the source name.
     *
     * @throws TastException if the file cannot be read, tokenized or parsed
     */
    SourceFile parse(Path file) throws TastException;

    SourceFile parseFromString(String sourceName, String content) throws LexException, ParseException;

    /**
     * Parses a fresh pass over the given token stream.
     */
    SourceFile parse(TokenStream tokens) throws LexException, ParseException;
}
