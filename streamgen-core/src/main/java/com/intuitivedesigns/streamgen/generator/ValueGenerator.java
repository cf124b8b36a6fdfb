/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.generator;

import com.intuitivedesigns.streamgen.config.FieldSpec;
import com.intuitivedesigns.streamgen.config.FieldType;
import com.intuitivedesigns.streamgen.dictionary.DictionaryProvider;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Builds records from an ordered list of {@link FieldSpec}s.
 *
 * <p>Field order is record order. A later field with the same name overwrites the earlier value
 * in place, keeping the position of the first occurrence.</p>
 *
 * <p>Instances are not thread-safe when sharing a {@link Random}; the emission loop owns one.</p>
 */
public final class ValueGenerator {

    private final DictionaryProvider dictionaries;
    private final Random random;
    private final Clock clock;

    public ValueGenerator(DictionaryProvider dictionaries) {
        this(dictionaries, new Random(), Clock.systemDefaultZone());
    }

    public ValueGenerator(DictionaryProvider dictionaries, Random random, Clock clock) {
        this.dictionaries = Objects.requireNonNull(dictionaries, "dictionaries");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return one record, field name to typed value, in declaration order
     * @throws GenerationException if a field cannot be produced
     * @throws com.intuitivedesigns.streamgen.dictionary.DictionaryException if a dictionary lookup fails
     */
    public Map<String, Object> generate(List<FieldSpec> fields) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            record.put(field.name(), generateValue(field));
        }
        return record;
    }

    public Object generateValue(FieldSpec field) {
        return switch (field.rule()) {
            case RANDOM_RANGE -> randomRange(field);
            case RANDOM_FROM_LIST -> randomFromList(field);
            case RANDOM_FROM_DICTIONARY -> randomFromDictionary(field);
            case NOW -> now(field);
            case CONSTANT -> constant(field);
        };
    }

    private Object randomRange(FieldSpec field) {
        Number min = field.min();
        Number max = field.max();
        if (min == null || max == null) {
            throw fail(field, "min and max must be specified for random_range rule");
        }
        FieldType type = field.type();
        if (type.isIntegral()) {
            long lo = min.longValue();
            long hi = max.longValue();
            if (lo > hi) {
                throw fail(field, "min (" + lo + ") exceeds max (" + hi + ")");
            }
            long v = uniformInclusive(lo, hi);
            return (type == FieldType.INT) ? toInt(field, v) : Long.valueOf(v);
        }
        if (type == FieldType.DOUBLE) {
            double lo = min.doubleValue();
            double hi = max.doubleValue();
            if (lo > hi) {
                throw fail(field, "min (" + lo + ") exceeds max (" + hi + ")");
            }
            double v = lo + random.nextDouble() * (hi - lo);
            return Math.round(v * 100d) / 100d;
        }
        throw fail(field, "random_range not supported for type: " + type.id());
    }

    private Object randomFromList(FieldSpec field) {
        List<Object> list = field.list();
        if (list == null || list.isEmpty()) {
            throw fail(field, "list must be specified for random_from_list rule");
        }
        return ValueCoercion.coerce(field, list.get(random.nextInt(list.size())));
    }

    private Object randomFromDictionary(FieldSpec field) {
        if (field.dictionary() == null || field.dictionaryColumn() == null) {
            throw fail(field, "dictionary and dictionary_column must be specified for random_from_dictionary rule");
        }
        return dictionaries.randomValue(field.dictionary(), field.dictionaryColumn());
    }

    private Object now(FieldSpec field) {
        if (field.type().isIntegral()) {
            return clock.millis();
        }
        if (field.type() == FieldType.STRING) {
            return LocalDateTime.now(clock).toString();
        }
        throw fail(field, "now not supported for type: " + field.type().id());
    }

    private Object constant(FieldSpec field) {
        if (field.value() == null) {
            throw fail(field, "value must be specified for constant rule");
        }
        return ValueCoercion.coerce(field, field.value());
    }

    private long uniformInclusive(long lo, long hi) {
        if (hi < Long.MAX_VALUE) {
            return random.nextLong(lo, hi + 1);
        }
        if (lo > Long.MIN_VALUE) {
            return random.nextLong(lo - 1, hi) + 1;
        }
        return random.nextLong();
    }

    private static Integer toInt(FieldSpec field, long v) {
        try {
            return Math.toIntExact(v);
        } catch (ArithmeticException e) {
            throw fail(field, "value " + v + " does not fit type int");
        }
    }

    static GenerationException fail(FieldSpec field, String message) {
        return new GenerationException("Field '" + field.name() + "': " + message);
    }
}
