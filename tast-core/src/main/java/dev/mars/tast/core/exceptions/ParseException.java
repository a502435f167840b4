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

import dev.mars.tast.core.SourceSpan;

import java.util.Objects;

/**
 * Exception thrown when a token stream violates the structural grammar:
 * an unexpected token, an unmatched delimiter or a malformed edge.
 * The parser stops at the first violation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class ParseException extends TastException {

    private final SourceSpan span;
    private final String expected;
    private final String found;

    public ParseException(String expected, String found, SourceSpan span) {
        super("expected " + expected + ", found " + found);
        this.span = Objects.requireNonNull(span, "Span cannot be null");
        this.expected = expected;
        this.found = found;
    }

    public ParseException(String message, SourceSpan span) {
        super(message);
        this.span = Objects.requireNonNull(span, "Span cannot be null");
        this.expected = null;
        this.found = null;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * The construct the parser expected, or null for messages that are not of the
     * expected/found form.
     */
    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return span + ": " + super.getMessage();
    }
}
