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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collects the semantic issues found while validating a program. Validation keeps
 * going after the first problem so that every independent violation is reported
 * in one pass.
 */
public class ValidationResult {

    /**
     * Kinds of semantic issue.
     */
    public enum Code {
        UNKNOWN_NODE,
        MISSING_DEPENDENCY,
        UNPRODUCIBLE_DATA,
        EXCESS_DATA,
        DUPLICATE_NODE,
        DUPLICATE_GRAPH,
        DUPLICATE_FIXTURE,
        UNKNOWN_FIXTURE
    }

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public void addError(Code code, SourceSpan span, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, span, null, null, message));
    }

    public void addError(Code code, SourceSpan span, String nodeName, String key, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, code, span, nodeName, key, message));
    }

    public void addWarning(Code code, SourceSpan span, String nodeName, String key, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, code, span, nodeName, key, message));
    }

    public void addAll(ValidationResult other) {
        Objects.requireNonNull(other, "Validation result cannot be null");
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    /**
     * Returns the errors carrying the given code, in the order they were found.
     */
    public List<ValidationIssue> getErrors(Code code) {
        return errors.stream()
                .filter(issue -> issue.getCode() == code)
                .collect(Collectors.toList());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * A single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final Code code;
        private final SourceSpan span;
        private final String nodeName;
        private final String key;
        private final String message;

        public ValidationIssue(Severity severity, Code code, SourceSpan span,
                               String nodeName, String key, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.code = Objects.requireNonNull(code, "Code cannot be null");
            this.span = span != null ? span : SourceSpan.unknown();
            this.nodeName = nodeName;
            this.key = key;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public Code getCode() {
            return code;
        }

        public SourceSpan getSpan() {
            return span;
        }

        /**
         * The node the issue concerns, or null when it is not node-specific.
         */
        public String getNodeName() {
            return nodeName;
        }

        /**
         * The data key the issue concerns, or null.
         */
        public String getKey() {
            return key;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   code == that.code &&
                   Objects.equals(span, that.span) &&
                   Objects.equals(nodeName, that.nodeName) &&
                   Objects.equals(key, that.key) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, code, span, nodeName, key, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name()).append(' ').append(code.name());

            if (span.isKnown()) {
                sb.append(" (").append(span).append(")");
            }

            sb.append(": ").append(message);

            return sb.toString();
        }
    }
}
