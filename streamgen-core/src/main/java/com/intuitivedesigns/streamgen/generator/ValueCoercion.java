/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.generator;

import com.intuitivedesigns.streamgen.config.FieldSpec;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Converts raw configuration values (as loaded from YAML) to a field's declared type.
 *
 * <ul>
 * <li>int/long: numbers truncate toward zero, strings are parsed, booleans become 1 or 0</li>
 * <li>double: numbers widen, strings are parsed</li>
 * <li>boolean: true/false/yes/no/1/0 strings are parsed, other strings are true when non-empty,
 *     numbers are true when non-zero</li>
 * <li>string: {@link String#valueOf(Object)}</li>
 * </ul>
 */
final class ValueCoercion {

    private ValueCoercion() {}

    static Object coerce(FieldSpec field, Object raw) {
        if (raw == null) {
            throw ValueGenerator.fail(field, "cannot coerce null to " + field.type().id());
        }
        try {
            return switch (field.type()) {
                case INT -> Math.toIntExact(toLong(raw));
                case LONG -> toLong(raw);
                case DOUBLE -> toDouble(raw);
                case BOOLEAN -> toBoolean(raw);
                case STRING -> String.valueOf(raw);
            };
        } catch (NumberFormatException | ArithmeticException e) {
            throw new GenerationException("Field '" + field.name() + "': cannot coerce '" + raw + "' to " + field.type().id(), e);
        }
    }

    private static long toLong(Object raw) {
        if (raw instanceof Boolean b) return b ? 1L : 0L;
        if (raw instanceof Number n) return n.longValue();
        String s = raw.toString().trim();
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            // "12.7" -> 12, matching numeric truncation
            return new BigDecimal(s).longValue();
        }
    }

    private static double toDouble(Object raw) {
        if (raw instanceof Boolean b) return b ? 1d : 0d;
        if (raw instanceof Number n) return n.doubleValue();
        return Double.parseDouble(raw.toString().trim());
    }

    // Recognizes textual false values; a plain truthiness check would make "false" true
    private static boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) return b;
        if (raw instanceof Number n) return n.doubleValue() != 0d;
        String s = raw.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0", "" -> false;
            default -> true;
        };
    }
}
