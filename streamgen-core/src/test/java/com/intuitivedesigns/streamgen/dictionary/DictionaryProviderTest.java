/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.dictionary;

import com.intuitivedesigns.streamgen.config.ConfigurationException;
import com.intuitivedesigns.streamgen.config.DictionarySpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryProviderTest {

    @TempDir
    Path dir;

    @Test
    void testHeaderColumnsResolveByLabel() throws Exception {
        Path file = write("cities.csv", "id,city,country\n1,Paris,FR\n2,Lyon,FR\n3,Berlin,DE\n");
        DictionaryProvider provider = new DictionaryProvider(new Random(7));

        provider.load("cities", new DictionarySpec(file, columns("name", "city", "code", "country"), ',', true));

        assertEquals(3, provider.size("cities"));
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(provider.randomValue("cities", "name"));
        }
        assertEquals(Set.of("Paris", "Lyon", "Berlin"), seen);
    }

    @Test
    void testIntegerColumnIndexesMappingOrder() throws Exception {
        Path file = write("one.csv", "a,b\n");
        DictionaryProvider provider = new DictionaryProvider();

        provider.load("one", new DictionarySpec(file, columns("second", 1, "first", 0), ',', false));

        assertEquals("b", provider.randomValue("one", 0));
        assertEquals("a", provider.randomValue("one", 1));
        assertEquals("a", provider.randomValue("one", "first"));
    }

    @Test
    void testShortRowsKeptWithEmptyCells() throws Exception {
        Path file = write("short.txt", "x|y\nz\n");
        DictionaryProvider provider = new DictionaryProvider();

        provider.load("short", new DictionarySpec(file, columns("a", 0, "b", 1), '|', false));

        assertEquals(2, provider.size("short"));
        Set<String> bValues = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            bValues.add(provider.randomValue("short", "b"));
        }
        assertEquals(Set.of("y", ""), bValues);
    }

    @Test
    void testQuotedCells() throws Exception {
        Path file = write("q.csv", "\"Smith, John\",\"say \"\"hi\"\"\"\n");
        DictionaryProvider provider = new DictionaryProvider();

        provider.load("q", new DictionarySpec(file, columns("name", 0, "quote", 1), ',', false));

        assertEquals("Smith, John", provider.randomValue("q", "name"));
        assertEquals("say \"hi\"", provider.randomValue("q", "quote"));
    }

    @Test
    void testMissingFile() {
        DictionaryProvider provider = new DictionaryProvider();

        DictionaryException e = assertThrows(DictionaryException.class,
                () -> provider.load("gone", new DictionarySpec(dir.resolve("nope.csv"), columns("a", 0), ',', false)));

        assertEquals(DictionaryException.Reason.NOT_FOUND, e.reason());
        assertFalse(provider.isLoaded("gone"));
    }

    @Test
    void testNamedColumnWithoutHeaderIsConfigError() throws Exception {
        Path file = write("n.csv", "a,b\n");
        DictionaryProvider provider = new DictionaryProvider();

        assertThrows(ConfigurationException.class,
                () -> provider.load("n", new DictionarySpec(file, columns("x", "city"), ',', false)));
        assertThrows(ConfigurationException.class,
                () -> provider.load("n", new DictionarySpec(file, columns("x", "city"), ',', true)));
    }

    @Test
    void testLookupFailures() throws Exception {
        DictionaryProvider provider = new DictionaryProvider();
        provider.load("empty", new DictionarySpec(write("e.csv", "h1\n"), columns("a", "h1"), ',', true));
        provider.load("one", new DictionarySpec(write("o.csv", "v\n"), columns("a", 0), ',', false));

        assertEquals(DictionaryException.Reason.NOT_LOADED,
                assertThrows(DictionaryException.class, () -> provider.randomValue("other", 0)).reason());
        assertEquals(DictionaryException.Reason.EMPTY,
                assertThrows(DictionaryException.class, () -> provider.randomValue("empty", 0)).reason());
        assertEquals(DictionaryException.Reason.INDEX_OUT_OF_RANGE,
                assertThrows(DictionaryException.class, () -> provider.randomValue("one", 3)).reason());
        assertEquals(DictionaryException.Reason.COLUMN_NOT_FOUND,
                assertThrows(DictionaryException.class, () -> provider.randomValue("one", "zzz")).reason());
    }

    @Test
    void testLoadAllRegistersEveryName() throws Exception {
        Map<String, DictionarySpec> specs = new LinkedHashMap<>();
        specs.put("a", new DictionarySpec(write("a.csv", "1\n"), columns("v", 0), ',', false));
        specs.put("b", new DictionarySpec(write("b.csv", "2\n"), columns("v", 0), ',', false));
        DictionaryProvider provider = new DictionaryProvider();

        provider.loadAll(specs);

        assertEquals(Set.of("a", "b"), provider.names());
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static Map<String, Object> columns(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }
}
