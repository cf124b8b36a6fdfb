/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class EnumIdsTest {

    @Test
    void testKafkaIsAliasForBroker() {
        assertEquals(OutputKind.BROKER, OutputKind.fromId("kafka"));
        assertEquals(OutputKind.BROKER, OutputKind.fromId(" Broker "));
        assertEquals("broker", OutputKind.BROKER.id());
    }

    @Test
    void testIdsAreCaseInsensitive() {
        assertEquals(RuleType.RANDOM_FROM_LIST, RuleType.fromId("Random_From_List"));
        assertEquals(FieldType.DOUBLE, FieldType.fromId("DOUBLE"));
        assertEquals(RollingPeriod.HOURLY, RollingPeriod.fromId("hourly"));
    }

    @Test
    void testUnknownIdListsOptions() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> FieldType.fromId("float"));

        assertTrue(e.getMessage().contains("float"));
        assertTrue(e.getMessage().contains("double"));
    }

    @Test
    void testMissingIdRejected() {
        assertThrows(ConfigurationException.class, () -> OutputKind.fromId(null));
        assertThrows(ConfigurationException.class, () -> RuleType.fromId("  "));
    }

    @Test
    void testPeriodKeys() {
        LocalDateTime t = LocalDateTime.of(2025, 3, 14, 9, 26);

        assertEquals("20250314_09", RollingPeriod.HOURLY.periodKey(t));
        assertEquals("20250314", RollingPeriod.DAILY.periodKey(t));
    }
}
