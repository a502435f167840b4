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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LiteralValueTest {

    @Test
    void testStringLiteral() {
        LiteralValue value = LiteralValue.ofString("alice@example.com");

        assertEquals(LiteralValue.Type.STRING, value.getType());
        assertEquals("alice@example.com", value.asString());
        assertEquals("alice@example.com", value.toPlainValue());
        assertEquals("\"alice@example.com\"", value.toString());
    }

    @Test
    void testIntegerNumberBecomesLong() {
        LiteralValue value = LiteralValue.ofNumber("42");

        assertEquals(new BigDecimal("42"), value.asNumber());
        assertEquals(42L, value.toPlainValue());
    }

    @Test
    void testNegativeAndFractionalNumbers() {
        assertEquals(-3L, LiteralValue.ofNumber("-3").toPlainValue());
        assertEquals(2.5d, LiteralValue.ofNumber("2.5").toPlainValue());
        assertEquals(2L, LiteralValue.ofNumber("2.0").toPlainValue());
    }

    @Test
    void testMalformedNumberRejected() {
        assertThrows(NumberFormatException.class, () -> LiteralValue.ofNumber("4x"));
    }

    @Test
    void testBooleanLiterals() {
        assertTrue(LiteralValue.ofBoolean(true).asBoolean());
        assertFalse(LiteralValue.ofBoolean(false).asBoolean());
        assertEquals(Boolean.TRUE, LiteralValue.ofBoolean(true).toPlainValue());
        assertSame(LiteralValue.ofBoolean(true), LiteralValue.ofBoolean(true));
    }

    @Test
    void testNullLiteral() {
        LiteralValue value = LiteralValue.nullValue();

        assertTrue(value.isNull());
        assertNull(value.toPlainValue());
        assertEquals("null", value.toString());
    }

    @Test
    void testDurations() {
        assertEquals(Duration.ofMillis(250), LiteralValue.ofDuration("250ms").asDuration());
        assertEquals(Duration.ofSeconds(30), LiteralValue.ofDuration("30s").asDuration());
        assertEquals(Duration.ofMinutes(5), LiteralValue.ofDuration("5m").asDuration());
        assertEquals(Duration.ofHours(2), LiteralValue.ofDuration("2h").asDuration());
        assertEquals(Duration.ofDays(1), LiteralValue.ofDuration("1d").asDuration());
        assertEquals(Duration.ofMillis(1500), LiteralValue.ofDuration("1.5s").asDuration());
        assertEquals("30s", LiteralValue.ofDuration("30s").toPlainValue());
    }

    @Test
    void testUnknownDurationUnitRejected() {
        assertThrows(IllegalArgumentException.class, () -> LiteralValue.ofDuration("3w"));
        assertThrows(IllegalArgumentException.class, () -> LiteralValue.ofDuration("s"));
    }

    @Test
    void testDurationUnits() {
        assertTrue(LiteralValue.isDurationUnit("ms"));
        assertTrue(LiteralValue.isDurationUnit("d"));
        assertFalse(LiteralValue.isDurationUnit("w"));
        assertFalse(LiteralValue.isDurationUnit("sec"));
    }

    @Test
    void testWrongAccessorThrows() {
        LiteralValue value = LiteralValue.ofString("x");

        assertThrows(IllegalStateException.class, value::asNumber);
        assertThrows(IllegalStateException.class, value::asBoolean);
        assertThrows(IllegalStateException.class, value::asDuration);
    }

    @Test
    void testEqualityUsesTypeAndText() {
        assertEquals(LiteralValue.ofString("1"), LiteralValue.ofString("1"));
        assertNotEquals(LiteralValue.ofString("1"), LiteralValue.ofNumber("1"));
        assertEquals(LiteralValue.ofNumber("10").hashCode(), LiteralValue.ofNumber("10").hashCode());
    }
}
