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


package dev.mars.tast.core;

import java.util.Objects;

/**
 * A region of source text, used to locate tokens, AST nodes and diagnostics.
 * Lines and columns are 1-based; offsets are 0-based character indices with an
 * exclusive end.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class SourceSpan {

    private static final SourceSpan UNKNOWN = new SourceSpan(null, 0, 0, 0, 0, 0, 0);

    private final String sourceName;
    private final int startOffset;
    private final int endOffset;
    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    public SourceSpan(String sourceName, int startOffset, int endOffset,
                      int line, int column, int endLine, int endColumn) {
        this.sourceName = sourceName;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceSpan unknown() {
        return UNKNOWN;
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     * The source name of this span is kept.
     */
    public SourceSpan merge(SourceSpan other) {
        Objects.requireNonNull(other, "Other span cannot be null");
        if (this == UNKNOWN) {
            return other;
        }
        if (other == UNKNOWN) {
            return this;
        }
        SourceSpan first = startOffset <= other.startOffset ? this : other;
        SourceSpan last = endOffset >= other.endOffset ? this : other;
        return new SourceSpan(sourceName, first.startOffset, last.endOffset,
                first.line, first.column, last.endLine, last.endColumn);
    }

    public boolean isKnown() {
        return line > 0;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceSpan that = (SourceSpan) o;
        return startOffset == that.startOffset &&
               endOffset == that.endOffset &&
               line == that.line &&
               column == that.column &&
               endLine == that.endLine &&
               endColumn == that.endColumn &&
               Objects.equals(sourceName, that.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, startOffset, endOffset, line, column, endLine, endColumn);
    }

    /**
     * Renders the span as {@code name:line:column}, omitting the name when absent.
     */
    @Override
    public String toString() {
        if (!isKnown()) {
            return sourceName != null ? sourceName : "<unknown>";
        }
        String position = line + ":" + column;
        return sourceName != null ? sourceName + ":" + position : position;
    }
}
