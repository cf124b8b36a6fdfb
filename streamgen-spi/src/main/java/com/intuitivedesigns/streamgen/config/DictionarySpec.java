/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reference data table backing {@link RuleType#RANDOM_FROM_DICTIONARY} fields.
 *
 * @param file      delimited file to load
 * @param columns   output column name mapped to a positional index ({@link Integer}) or, when
 *                  {@code header} is set, a header name ({@link String}); insertion order is kept
 * @param delimiter field separator
 * @param header    whether the first row holds column names rather than data
 */
public record DictionarySpec(Path file, Map<String, Object> columns, char delimiter, boolean header) {

    public static final char DEFAULT_DELIMITER = ',';

    public DictionarySpec {
        Objects.requireNonNull(file, "file");
        columns = (columns == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public DictionarySpec(Path file, Map<String, Object> columns) {
        this(file, columns, DEFAULT_DELIMITER, false);
    }
}
