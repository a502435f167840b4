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


package dev.mars.tast.config;

import java.util.Locale;

/**
 * How the validator treats keys passed along an edge that the target node does
 * not list in its {@code requires}.
 */
public enum ExcessPassesPolicy {
    IGNORE,
    WARN,
    ERROR;

    /**
     * Parses a policy name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known policy
     */
    public static ExcessPassesPolicy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Policy cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
