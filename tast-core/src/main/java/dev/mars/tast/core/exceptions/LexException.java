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
 * Thrown when source text cannot be split into tokens: an unterminated string
 * literal, a malformed number or a character that is not valid outside free text.
 * Fatal for the file being tokenized.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class LexException extends TastException {

    private final SourceSpan span;

    public LexException(String message, SourceSpan span) {
        super(message);
        this.span = Objects.requireNonNull(span, "Span cannot be null");
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * The message without the location prefix.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return span + ": " + super.getMessage();
    }
}
