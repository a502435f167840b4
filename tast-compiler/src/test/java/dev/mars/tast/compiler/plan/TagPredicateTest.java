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

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TagPredicateTest {

    @Test
    void testSingleTag() {
        TagPredicate smoke = TagPredicate.parse("smoke");

        assertTrue(smoke.test(Set.of("smoke", "fast")));
        assertFalse(smoke.test(Set.of("slow")));
        assertFalse(smoke.test(Set.of()));
    }

    @Test
    void testCommaMeansOr() {
        TagPredicate predicate = TagPredicate.parse("smoke, critical");

        assertTrue(predicate.test(Set.of("critical")));
        assertTrue(predicate.test(Set.of("smoke")));
        assertFalse(predicate.test(Set.of("slow")));
    }

    @Test
    void testAndNotPrecedence() {
        TagPredicate predicate = TagPredicate.parse("smoke AND NOT slow OR critical");

        assertTrue(predicate.test(Set.of("smoke")));
        assertFalse(predicate.test(Set.of("smoke", "slow")));
        assertTrue(predicate.test(Set.of("slow", "critical")));
        assertEquals("smoke AND NOT slow OR critical", predicate.toString());
    }

    @Test
    void testOperatorsAreCaseInsensitive() {
        TagPredicate predicate = TagPredicate.parse("smoke and not slow");

        assertTrue(predicate.test(Set.of("smoke")));
        assertFalse(predicate.test(Set.of("smoke", "slow")));
    }

    @Test
    void testDoubleNegation() {
        assertTrue(TagPredicate.parse("NOT NOT smoke").test(Set.of("smoke")));
    }

    @Test
    void testTagNamesMayContainPunctuation() {
        assertTrue(TagPredicate.parse("team:auth").test(Set.of("team:auth")));
        assertTrue(TagPredicate.parse("v1.2-beta").test(Set.of("v1.2-beta")));
    }

    @Test
    void testCombinators() {
        TagPredicate predicate = TagPredicate.tag("a").and(TagPredicate.tag("b").or(TagPredicate.tag("c")));

        assertTrue(predicate.test(Set.of("a", "c")));
        assertFalse(predicate.test(Set.of("a")));
        assertEquals("a AND (b OR c)", predicate.toString());
        assertEquals("NOT (a AND (b OR c))", predicate.negate().toString());
    }

    @Test
    void testInvalidExpressions() {
        assertThrows(IllegalArgumentException.class, () -> TagPredicate.parse(""));
        assertThrows(IllegalArgumentException.class, () -> TagPredicate.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> TagPredicate.parse("smoke AND"));
        assertThrows(IllegalArgumentException.class, () -> TagPredicate.parse("sm oke"));
        assertThrows(NullPointerException.class, () -> TagPredicate.parse(null));
    }
}
