/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fully parsed application configuration: the single producer plus the global sections it draws on.
 *
 * @param dictionaries   dictionaries by name, loaded in insertion order
 * @param broker         broker settings, null when absent
 * @param fileOutput     file output settings
 * @param errorLog       error log settings
 * @param metricsEnabled whether Micrometer metrics are recorded
 * @param producer       the producer definition
 */
public record AppConfig(
        Map<String, DictionarySpec> dictionaries,
        BrokerConfig broker,
        FileOutputConfig fileOutput,
        ErrorLogConfig errorLog,
        boolean metricsEnabled,
        ProducerSpec producer
) {

    public AppConfig {
        dictionaries = (dictionaries == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dictionaries));
        fileOutput = (fileOutput != null) ? fileOutput : FileOutputConfig.defaults();
        errorLog = (errorLog != null) ? errorLog : ErrorLogConfig.defaults();
        Objects.requireNonNull(producer, "producer");
    }

    public static AppConfig forProducer(ProducerSpec producer) {
        return new AppConfig(Map.of(), null, null, ErrorLogConfig.disabled(), false, producer);
    }

    public AppConfig withBroker(BrokerConfig newBroker) {
        return new AppConfig(dictionaries, newBroker, fileOutput, errorLog, metricsEnabled, producer);
    }

    public AppConfig withDictionaries(Map<String, DictionarySpec> newDictionaries) {
        return new AppConfig(newDictionaries, broker, fileOutput, errorLog, metricsEnabled, producer);
    }

    public AppConfig withFileOutput(FileOutputConfig newFileOutput) {
        return new AppConfig(dictionaries, broker, newFileOutput, errorLog, metricsEnabled, producer);
    }

    public AppConfig withErrorLog(ErrorLogConfig newErrorLog) {
        return new AppConfig(dictionaries, broker, fileOutput, newErrorLog, metricsEnabled, producer);
    }
}
