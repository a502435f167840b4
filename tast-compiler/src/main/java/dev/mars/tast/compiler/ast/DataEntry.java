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


package dev.mars.tast.compiler.ast;

import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;

import java.util.Objects;

/**
 * One entry of a data block: either {@code key: value}, or a bare fixture name
 * whose fields are spread into the block at this position.
 */
public final class DataEntry {

    private final String key;
    private final LiteralValue value;
    private final SourceSpan span;

    private DataEntry(String key, LiteralValue value, SourceSpan span) {
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        this.value = value;
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public static DataEntry of(String key, LiteralValue value, SourceSpan span) {
        return new DataEntry(key, Objects.requireNonNull(value, "Value cannot be null"), span);
    }

    public static DataEntry spread(String fixtureName, SourceSpan span) {
        return new DataEntry(fixtureName, null, span);
    }

    /**
     * The key, or the fixture name for a spread.
     */
    public String getKey() {
        return key;
    }

    /**
     * The literal value, or null for a spread.
     */
    public LiteralValue getValue() {
        return value;
    }

    public boolean isSpread() {
        return value == null;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataEntry that = (DataEntry) o;
        return key.equals(that.key) && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return isSpread() ? "..." + key : key + ": " + value;
    }
}
