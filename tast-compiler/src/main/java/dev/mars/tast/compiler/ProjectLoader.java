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

import dev.mars.tast.compiler.ast.ImportDecl;
import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.ir.ImportResolver;
import dev.mars.tast.compiler.parser.SourceParser;
import dev.mars.tast.core.exceptions.ImportException;
import dev.mars.tast.core.exceptions.SourceSetException;
import dev.mars.tast.core.exceptions.TastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Loads a set of root sources and everything they transitively import.
 *
 * <p>Files are discovered wave by wave: each wave is parsed in parallel, then the
 * imports of its files form the next wave. Files come back in discovery order.
 * Imports of files the loader does not have are left for the IR builder to
 * report. Every lexing and parsing failure is collected and reported together.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class ProjectLoader {

    private static final Logger logger = LoggerFactory.getLogger(ProjectLoader.class);

    private final SourceLoader sourceLoader;
    private final SourceParser parser;
    private final int parallelism;

    public ProjectLoader(SourceLoader sourceLoader, SourceParser parser, int parallelism) {
        this.sourceLoader = Objects.requireNonNull(sourceLoader, "Source loader cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Loads the roots and their import closure.
     *
     * @throws ImportException if a root does not exist
     * @throws SourceSetException if any file fails to read, tokenize or parse
     * @throws TastException if parsing is interrupted
     */
    public List<SourceFile> load(List<String> roots) throws TastException {
        Objects.requireNonNull(roots, "Roots cannot be null");
        Set<String> discovered = new LinkedHashSet<>();
        List<String> wave = new ArrayList<>();
        for (String root : roots) {
            String name = ImportResolver.normalize(root);
            if (!sourceLoader.exists(name)) {
                throw new ImportException(ImportException.Kind.MISSING_FILE, null, name,
                        "Source file not found: " + name);
            }
            if (discovered.add(name)) {
                wave.add(name);
            }
        }

        List<SourceFile> files = new ArrayList<>();
        List<TastException> failures = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            int waveNumber = 0;
            while (!wave.isEmpty()) {
                waveNumber++;
                logger.debug("Parsing wave {} with {} file(s)", waveNumber, wave.size());
                List<SourceFile> parsed = parseWave(executor, wave, failures);
                files.addAll(parsed);

                List<String> next = new ArrayList<>();
                for (SourceFile file : parsed) {
                    for (ImportDecl decl : file.getImports()) {
                        String target = ImportResolver.resolvePath(file.getName(), decl.getPath());
                        if (sourceLoader.exists(target) && discovered.add(target)) {
                            next.add(target);
                        }
                    }
                }
                wave = next;
            }
        } finally {
            executor.shutdownNow();
        }

        if (!failures.isEmpty()) {
            throw new SourceSetException(failures);
        }
        logger.debug("Loaded {} source file(s)", files.size());
        return files;
    }

    private List<SourceFile> parseWave(ExecutorService executor, List<String> wave, List<TastException> failures)
            throws TastException {
        List<Future<SourceFile>> futures = new ArrayList<>();
        for (String name : wave) {
            Callable<SourceFile> task = () -> parseOne(name);
            futures.add(executor.submit(task));
        }

        List<SourceFile> parsed = new ArrayList<>();
        for (Future<SourceFile> future : futures) {
            try {
                parsed.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TastException("Interrupted while parsing sources", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TastException) {
                    failures.add((TastException) cause);
                } else if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else {
                    throw new TastException("Unexpected failure while parsing sources", cause);
                }
            }
        }
        return parsed;
    }

    private SourceFile parseOne(String name) throws TastException {
        String text;
        try {
            text = sourceLoader.load(name);
        } catch (IOException e) {
            throw new TastException("Failed to read source file: " + name, e);
        }
        return parser.parseFromString(name, text);
    }
}
