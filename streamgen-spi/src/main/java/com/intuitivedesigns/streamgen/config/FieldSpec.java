/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One schema field: its name, value type, generation rule and the rule-specific parameters.
 *
 * <p>Parameters not used by the rule are ignored. {@code dictionaryColumn} is either an
 * {@link Integer} (positional index) or a {@link String} (column name). Raw values in
 * {@code list} and {@code value} are kept as loaded and coerced to {@code type} at generation time.</p>
 *
 * @param name             field name, unique within a record by convention (duplicates overwrite)
 * @param type             value type
 * @param rule             generation rule
 * @param min              lower bound for {@link RuleType#RANDOM_RANGE}
 * @param max              upper bound for {@link RuleType#RANDOM_RANGE}
 * @param list             candidate raw values for {@link RuleType#RANDOM_FROM_LIST}
 * @param dictionary       dictionary name for {@link RuleType#RANDOM_FROM_DICTIONARY}
 * @param dictionaryColumn column name or index for {@link RuleType#RANDOM_FROM_DICTIONARY}
 * @param value            literal for {@link RuleType#CONSTANT}
 */
public record FieldSpec(
        String name,
        FieldType type,
        RuleType rule,
        Number min,
        Number max,
        List<Object> list,
        String dictionary,
        Object dictionaryColumn,
        Object value
) {

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rule, "rule");
        // List.copyOf rejects nulls; YAML lists may legitimately carry them
        list = (list == null) ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }

    // --- Factories ---

    public static FieldSpec range(String name, FieldType type, Number min, Number max) {
        return new FieldSpec(name, type, RuleType.RANDOM_RANGE, min, max, null, null, null, null);
    }

    public static FieldSpec fromList(String name, FieldType type, List<Object> values) {
        return new FieldSpec(name, type, RuleType.RANDOM_FROM_LIST, null, null, values, null, null, null);
    }

    public static FieldSpec fromDictionary(String name, String dictionary, Object column) {
        return new FieldSpec(name, FieldType.STRING, RuleType.RANDOM_FROM_DICTIONARY, null, null, null, dictionary, column, null);
    }

    public static FieldSpec now(String name, FieldType type) {
        return new FieldSpec(name, type, RuleType.NOW, null, null, null, null, null, null);
    }

    public static FieldSpec constant(String name, FieldType type, Object value) {
        return new FieldSpec(name, type, RuleType.CONSTANT, null, null, null, null, null, value);
    }

    /**
     * Checks that the rule's required parameters are present and consistent with {@link #type()}.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public void validate() {
        switch (rule) {
            case RANDOM_RANGE -> {
                if (min == null || max == null) {
                    throw invalid("min and max must be specified for random_range rule");
                }
                if (!type.isNumeric()) {
                    throw invalid("random_range not supported for type: " + type.id());
                }
                if (type.isIntegral() ? min.longValue() > max.longValue() : min.doubleValue() > max.doubleValue()) {
                    throw invalid("min (" + min + ") must not exceed max (" + max + ")");
                }
                if (type == FieldType.INT && (!fitsInt(min) || !fitsInt(max))) {
                    throw invalid("min and max must lie within the int range for type: int");
                }
            }
            case RANDOM_FROM_LIST -> {
                if (list == null || list.isEmpty()) {
                    throw invalid("list must be specified for random_from_list rule");
                }
            }
            case RANDOM_FROM_DICTIONARY -> {
                if (dictionary == null || dictionary.isBlank()) {
                    throw invalid("dictionary must be specified for random_from_dictionary rule");
                }
                if (dictionaryColumn == null) {
                    throw invalid("dictionary_column must be specified for random_from_dictionary rule");
                }
                if (!(dictionaryColumn instanceof Integer) && !(dictionaryColumn instanceof String)) {
                    throw invalid("dictionary_column must be a column name or index");
                }
            }
            case NOW -> {
                if (type != FieldType.STRING && !type.isIntegral()) {
                    throw invalid("now not supported for type: " + type.id());
                }
            }
            case CONSTANT -> {
                if (value == null) {
                    throw invalid("value must be specified for constant rule");
                }
            }
        }
    }

    private static boolean fitsInt(Number n) {
        return n.longValue() >= Integer.MIN_VALUE && n.longValue() <= Integer.MAX_VALUE;
    }

    private ConfigurationException invalid(String message) {
        return new ConfigurationException("Field '" + name + "': " + message);
    }
}
