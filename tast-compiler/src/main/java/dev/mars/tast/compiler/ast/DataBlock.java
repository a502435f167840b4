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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An explicit {@code { key: value, ... }} mapping as written in the source, before
 * fixture spreads are expanded.
 */
public final class DataBlock {

    private static final DataBlock EMPTY = new DataBlock(List.of(), SourceSpan.unknown());

    private final List<DataEntry> entries;
    private final SourceSpan span;

    public DataBlock(List<DataEntry> entries, SourceSpan span) {
        this.entries = List.copyOf(Objects.requireNonNull(entries, "Entries cannot be null"));
        this.span = span != null ? span : SourceSpan.unknown();
    }

    public static DataBlock empty() {
        return EMPTY;
    }

    public List<DataEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean hasSpreads() {
        return entries.stream().anyMatch(DataEntry::isSpread);
    }

    /**
     * The key/value entries in source order, later duplicates overriding earlier
     * ones. Spreads are skipped.
     */
    public Map<String, LiteralValue> literals() {
        Map<String, LiteralValue> result = new LinkedHashMap<>();
        for (DataEntry entry : entries) {
            if (!entry.isSpread()) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((DataBlock) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
