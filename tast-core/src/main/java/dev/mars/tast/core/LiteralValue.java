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

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * An immutable literal from a data block or from step prose: a string, a number,
 * a boolean, a duration (a number with a time unit such as {@code 30s}) or null.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public final class LiteralValue {

    public enum Type {
        STRING, NUMBER, BOOLEAN, DURATION, NULL
    }

    private static final LiteralValue NULL = new LiteralValue(Type.NULL, null, "null");
    private static final LiteralValue TRUE = new LiteralValue(Type.BOOLEAN, Boolean.TRUE, "true");
    private static final LiteralValue FALSE = new LiteralValue(Type.BOOLEAN, Boolean.FALSE, "false");

    private final Type type;
    private final Object value;
    private final String text;

    private LiteralValue(Type type, Object value, String text) {
        this.type = type;
        this.value = value;
        this.text = text;
    }

    public static LiteralValue ofString(String value) {
        Objects.requireNonNull(value, "String value cannot be null");
        return new LiteralValue(Type.STRING, value, value);
    }

    public static LiteralValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LiteralValue nullValue() {
        return NULL;
    }

    /**
     * Parses a decimal number such as {@code 42}, {@code -3} or {@code 2.5}.
     *
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static LiteralValue ofNumber(String text) {
        Objects.requireNonNull(text, "Number text cannot be null");
        return new LiteralValue(Type.NUMBER, new BigDecimal(text), text);
    }

    /**
     * Parses a duration literal: a non-negative number followed by one of
     * {@code ms}, {@code s}, {@code m}, {@code h} or {@code d}.
     *
     * @throws IllegalArgumentException if the unit is unknown or the amount is malformed
     */
    public static LiteralValue ofDuration(String text) {
        Objects.requireNonNull(text, "Duration text cannot be null");
        return new LiteralValue(Type.DURATION, parseDuration(text), text);
    }

    /**
     * Returns true if {@code unit} is a recognized duration suffix.
     */
    public static boolean isDurationUnit(String unit) {
        switch (unit) {
            case "ms":
            case "s":
            case "m":
            case "h":
            case "d":
                return true;
            default:
                return false;
        }
    }

    private static Duration parseDuration(String text) {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        int unitStart = 0;
        while (unitStart < trimmed.length()
                && (Character.isDigit(trimmed.charAt(unitStart)) || trimmed.charAt(unitStart) == '.')) {
            unitStart++;
        }
        if (unitStart == 0 || unitStart == trimmed.length()) {
            throw new IllegalArgumentException("Malformed duration: " + text);
        }
        String unit = trimmed.substring(unitStart);
        if (!isDurationUnit(unit)) {
            throw new IllegalArgumentException("Unknown duration unit '" + unit + "' in " + text);
        }
        BigDecimal amount = new BigDecimal(trimmed.substring(0, unitStart));
        BigDecimal millis;
        switch (unit) {
            case "ms":
                millis = amount;
                break;
            case "s":
                millis = amount.multiply(BigDecimal.valueOf(1_000L));
                break;
            case "m":
                millis = amount.multiply(BigDecimal.valueOf(60_000L));
                break;
            case "h":
                millis = amount.multiply(BigDecimal.valueOf(3_600_000L));
                break;
            default:
                millis = amount.multiply(BigDecimal.valueOf(86_400_000L));
                break;
        }
        return Duration.ofMillis(millis.longValue());
    }

    public Type getType() {
        return type;
    }

    /**
     * The source text of the literal, e.g. {@code 30s} or {@code 2.50}. For strings
     * this is the unescaped content.
     */
    public String getText() {
        return text;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public String asString() {
        return text;
    }

    public BigDecimal asNumber() {
        if (type != Type.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return (BigDecimal) value;
    }

    public boolean asBoolean() {
        if (type != Type.BOOLEAN) {
            throw new IllegalStateException("Not a boolean: " + this);
        }
        return (Boolean) value;
    }

    public Duration asDuration() {
        if (type != Type.DURATION) {
            throw new IllegalStateException("Not a duration: " + this);
        }
        return (Duration) value;
    }

    /**
     * Converts the literal to a plain Java value for serializers: String, Long,
     * Double, Boolean or null. Durations keep their source text.
     */
    @JsonValue
    public Object toPlainValue() {
        switch (type) {
            case STRING:
            case DURATION:
                return text;
            case BOOLEAN:
                return value;
            case NUMBER:
                BigDecimal number = (BigDecimal) value;
                if (number.scale() <= 0 || number.stripTrailingZeros().scale() <= 0) {
                    try {
                        return number.longValueExact();
                    } catch (ArithmeticException e) {
                        return number.doubleValue();
                    }
                }
                return number.doubleValue();
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LiteralValue that = (LiteralValue) o;
        return type == that.type && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type == Type.STRING ? '"' + text + '"' : text;
    }
}
