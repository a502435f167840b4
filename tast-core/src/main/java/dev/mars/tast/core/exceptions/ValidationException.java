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

import dev.mars.tast.core.ValidationResult;

import java.util.Objects;

/**
 * Thrown when a parsed program is semantically inconsistent. Carries every error
 * found in the validation pass, not just the first one.
 */
public class ValidationException extends TastException {

    private final ValidationResult result;

    public ValidationException(ValidationResult result) {
        super(buildMessage(Objects.requireNonNull(result, "Validation result cannot be null")));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    private static String buildMessage(ValidationResult result) {
        StringBuilder sb = new StringBuilder("Validation failed with ")
                .append(result.getErrorCount()).append(" error(s):");
        for (ValidationResult.ValidationIssue error : result.getErrors()) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
