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

/**
 * The keyword a step line starts with.
 */
public enum StepKeyword {
    GIVEN("given"),
    WHEN("when"),
    THEN("then"),
    AND("and"),
    BUT("but");

    private final String text;

    StepKeyword(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * True for {@code and} and {@code but}, which continue the previous step's kind.
     */
    public boolean isContinuation() {
        return this == AND || this == BUT;
    }

    /**
     * The kind a non-continuation keyword introduces.
     *
     * @throws IllegalStateException for {@code and} and {@code but}
     */
    public StepKind getKind() {
        switch (this) {
            case GIVEN:
                return StepKind.PRECONDITION;
            case WHEN:
                return StepKind.ACTION;
            case THEN:
                return StepKind.ASSERTION;
            default:
                throw new IllegalStateException("'" + text + "' has no kind of its own");
        }
    }
}
