/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.dictionary;

import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.DictionarySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory reference tables loaded once from delimited files.
 *
 * <p>Each data row becomes an ordered map from output column name to raw cell text, following
 * the column mapping of the {@link DictionarySpec}. Rows narrower than the mapping are kept and
 * the missing cells are empty strings; no row is ever dropped for its width.</p>
 */
public final class DictionaryProvider {

    private static final Logger log = LoggerFactory.getLogger(DictionaryProvider.class);

    private final Map<String, List<Map<String, String>>> tables = new ConcurrentHashMap<>();
    private final Random random;

    public DictionaryProvider() {
        this(new Random());
    }

    public DictionaryProvider(Random random) {
        this.random = random;
    }

    /**
     * Load all configured dictionaries in order, stopping at the first failure.
     */
    public void loadAll(Map<String, DictionarySpec> dictionaries) {
        dictionaries.forEach(this::load);
    }

    /**
     * Read the file into memory and register it under {@code name}, replacing any previous table.
     *
     * @throws DictionaryException    {@link DictionaryException.Reason#NOT_FOUND} if the file is missing,
     *                                {@link DictionaryException.Reason#READ_FAILED} on I/O errors
     * @throws ConfigurationException if a named column cannot be resolved against the header
     */
    public void load(String name, DictionarySpec spec) {
        Path file = spec.file();
        if (!Files.isRegularFile(file)) {
            throw new DictionaryException(DictionaryException.Reason.NOT_FOUND, "Dictionary file not found: " + file);
        }

        List<Map<String, String>> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Map<String, Integer> positions = null;
            String line;
            while ((line = reader.readLine()) != null) {
                List<String> cells = DelimitedLines.split(line, spec.delimiter());
                if (positions == null) {
                    positions = resolvePositions(name, spec, spec.header() ? cells : null);
                    if (spec.header()) continue;
                }
                Map<String, String> entry = new LinkedHashMap<>();
                positions.forEach((column, index) -> entry.put(column, index < cells.size() ? cells.get(index) : ""));
                rows.add(Collections.unmodifiableMap(entry));
            }
        } catch (IOException e) {
            throw new DictionaryException(DictionaryException.Reason.READ_FAILED, "Failed reading dictionary '" + name + "': " + file, e);
        }

        tables.put(name, Collections.unmodifiableList(rows));
        log.info("Loaded dictionary '{}' from {} ({} rows, columns={})", name, file, rows.size(), spec.columns().keySet());
    }

    /**
     * Pick a uniformly random row and return one of its cells.
     *
     * @param column output column name ({@link String}) or position in the column mapping ({@link Integer})
     * @throws DictionaryException if the dictionary is not loaded, empty, or the column does not resolve
     */
    public String randomValue(String name, Object column) {
        List<Map<String, String>> rows = tables.get(name);
        if (rows == null) {
            throw new DictionaryException(DictionaryException.Reason.NOT_LOADED, "Dictionary '" + name + "' not loaded");
        }
        if (rows.isEmpty()) {
            throw new DictionaryException(DictionaryException.Reason.EMPTY, "Dictionary '" + name + "' is empty");
        }

        Map<String, String> row = rows.get(random.nextInt(rows.size()));

        if (column instanceof Integer index) {
            if (index < 0 || index >= row.size()) {
                throw new DictionaryException(DictionaryException.Reason.INDEX_OUT_OF_RANGE,
                        "Column index " + index + " out of range for dictionary '" + name + "'");
            }
            return new ArrayList<>(row.values()).get(index);
        }

        String key = String.valueOf(column);
        String value = row.get(key);
        if (value == null) {
            throw new DictionaryException(DictionaryException.Reason.COLUMN_NOT_FOUND,
                    "Column '" + key + "' not found in dictionary '" + name + "'");
        }
        return value;
    }

    public boolean isLoaded(String name) {
        return tables.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(tables.keySet());
    }

    public int size(String name) {
        List<Map<String, String>> rows = tables.get(name);
        return rows == null ? 0 : rows.size();
    }

    private static Map<String, Integer> resolvePositions(String name, DictionarySpec spec, List<String> header) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        spec.columns().forEach((column, ref) -> positions.put(column, resolvePosition(name, column, ref, header)));
        return positions;
    }

    private static int resolvePosition(String name, String column, Object ref, List<String> header) {
        if (ref instanceof Number n) {
            if (n.intValue() < 0) {
                throw new ConfigurationException("Dictionary '" + name + "' column '" + column + "' has negative index " + n);
            }
            return n.intValue();
        }
        String label = String.valueOf(ref).trim();
        if (header != null) {
            int idx = header.indexOf(label);
            if (idx >= 0) return idx;
            throw new ConfigurationException("Dictionary '" + name + "' column '" + column + "' references unknown header '" + label + "'");
        }
        try {
            return Integer.parseInt(label);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Dictionary '" + name + "' column '" + column + "' is named ('" + label + "') but the file has no header row");
        }
    }
}
