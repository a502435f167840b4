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

/**
 * Aggregates the lexing and parsing failures of several independent source files.
 * A failing file does not stop the others from being processed, so all failures
 * are reported together.
 */
public class SourceSetException extends TastException {

    private final List<TastException> failures;

    public SourceSetException(List<? extends TastException> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
        if (this.failures.isEmpty()) {
            throw new IllegalArgumentException("At least one failure is required");
        }
    }

    public List<TastException> getFailures() {
        return failures;
    }

    private static String buildMessage(List<? extends TastException> failures) {
        StringBuilder sb = new StringBuilder();
        sb.append(failures.size()).append(" source file(s) failed to compile:");
        for (TastException failure : failures) {
            sb.append("\n  - ").append(failure.getMessage());
        }
        return sb.toString();
    }
}
