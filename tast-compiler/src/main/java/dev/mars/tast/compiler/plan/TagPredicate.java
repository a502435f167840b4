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


package dev.mars.tast.compiler.plan;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A boolean expression over a node's tags: a tag name, {@code NOT}, {@code AND}
 * and {@code OR}. Immutable.
 *
 * <p>{@link #parse(String)} accepts expressions such as {@code smoke AND NOT slow}
 * and {@code smoke,critical}; a comma means OR, OR binds loosest and NOT tightest.
 */
public abstract class TagPredicate {

    private static final Pattern OR_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+(?i:OR)\\s+");
    private static final Pattern AND_SEPARATOR = Pattern.compile("\\s+(?i:AND)\\s+");
    private static final Pattern NOT_PREFIX = Pattern.compile("^(?i:NOT)\\s+");
    private static final Pattern TAG_NAME = Pattern.compile("[A-Za-z0-9_.:-]+");

    private TagPredicate() {
    }

    public abstract boolean test(Set<String> tags);

    public static TagPredicate tag(String name) {
        return new Tag(name);
    }

    public static TagPredicate not(TagPredicate operand) {
        return new Not(operand);
    }

    public static TagPredicate and(TagPredicate left, TagPredicate right) {
        return new And(left, right);
    }

    public static TagPredicate or(TagPredicate left, TagPredicate right) {
        return new Or(left, right);
    }

    public TagPredicate and(TagPredicate other) {
        return and(this, other);
    }

    public TagPredicate or(TagPredicate other) {
        return or(this, other);
    }

    public TagPredicate negate() {
        return not(this);
    }

    /**
     * Parses a tag expression.
     *
     * @throws IllegalArgumentException if the expression is empty or contains an invalid tag name
     */
    public static TagPredicate parse(String expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Tag expression cannot be empty");
        }
        TagPredicate result = null;
        for (String alternative : OR_SEPARATOR.split(trimmed)) {
            TagPredicate conjunction = null;
            for (String term : AND_SEPARATOR.split(alternative.trim())) {
                TagPredicate parsed = parseTerm(term.trim(), expression);
                conjunction = conjunction == null ? parsed : and(conjunction, parsed);
            }
            result = result == null ? conjunction : or(result, conjunction);
        }
        return result;
    }

    private static TagPredicate parseTerm(String term, String expression) {
        int negations = 0;
        String remaining = term;
        while (NOT_PREFIX.matcher(remaining).find()) {
            remaining = NOT_PREFIX.matcher(remaining).replaceFirst("");
            negations++;
        }
        if (!TAG_NAME.matcher(remaining).matches()) {
            throw new IllegalArgumentException("Invalid tag '" + remaining + "' in expression '" + expression + "'");
        }
        TagPredicate predicate = tag(remaining);
        for (int i = 0; i < negations; i++) {
            predicate = not(predicate);
        }
        return predicate;
    }

    private static final class Tag extends TagPredicate {
        private final String name;

        Tag(String name) {
            this.name = Objects.requireNonNull(name, "Tag name cannot be null");
        }

        @Override
        public boolean test(Set<String> tags) {
            return tags.contains(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Tag && ((Tag) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Not extends TagPredicate {
        private final TagPredicate operand;

        Not(TagPredicate operand) {
            this.operand = Objects.requireNonNull(operand, "Operand cannot be null");
        }

        @Override
        public boolean test(Set<String> tags) {
            return !operand.test(tags);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).operand.equals(operand);
        }

        @Override
        public int hashCode() {
            return 31 * operand.hashCode() + 1;
        }

        @Override
        public String toString() {
            return operand instanceof Tag ? "NOT " + operand : "NOT (" + operand + ")";
        }
    }

    private static final class And extends TagPredicate {
        private final List<TagPredicate> operands;

        And(TagPredicate left, TagPredicate right) {
            this.operands = List.of(Objects.requireNonNull(left, "Left operand cannot be null"),
                    Objects.requireNonNull(right, "Right operand cannot be null"));
        }

        @Override
        public boolean test(Set<String> tags) {
            return operands.get(0).test(tags) && operands.get(1).test(tags);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof And && ((And) o).operands.equals(operands);
        }

        @Override
        public int hashCode() {
            return 31 * operands.hashCode() + 2;
        }

        @Override
        public String toString() {
            return render(operands.get(0)) + " AND " + render(operands.get(1));
        }

        private static String render(TagPredicate operand) {
            return operand instanceof Or ? "(" + operand + ")" : operand.toString();
        }
    }

    private static final class Or extends TagPredicate {
        private final List<TagPredicate> operands;

        Or(TagPredicate left, TagPredicate right) {
            this.operands = List.of(Objects.requireNonNull(left, "Left operand cannot be null"),
                    Objects.requireNonNull(right, "Right operand cannot be null"));
        }

        @Override
        public boolean test(Set<String> tags) {
            return operands.get(0).test(tags) || operands.get(1).test(tags);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Or && ((Or) o).operands.equals(operands);
        }

        @Override
        public int hashCode() {
            return 31 * operands.hashCode() + 3;
        }

        @Override
        public String toString() {
            return operands.get(0) + " OR " + operands.get(1);
        }
    }
}
