/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One producer definition.
 *
 * <p>Immutable except for the rate setting, which the control plane may hot-swap while the
 * producer runs. The setting is held as a single {@link RateSetting} reference so readers always
 * observe a consistent rate/interval pair.</p>
 */
public final class ProducerSpec {

    private final String name;
    private final OutputKind output;
    private final List<FieldSpec> fields;
    private final String topic;
    private final String filePath;

    private volatile RateSetting rateSetting;

    public ProducerSpec(String name,
                        OutputKind output,
                        List<FieldSpec> fields,
                        RateSetting rateSetting,
                        String topic,
                        String filePath) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("producer.name is required");
        }
        this.name = name.trim();
        this.output = Objects.requireNonNull(output, "output");
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
        this.rateSetting = (rateSetting != null) ? rateSetting : RateSetting.none();
        this.topic = topic;
        this.filePath = filePath;
    }

    public String name() { return name; }
    public OutputKind output() { return output; }
    public List<FieldSpec> fields() { return fields; }
    public String topic() { return topic; }
    public String filePath() { return filePath; }

    public RateSetting rateSetting() { return rateSetting; }
    public Integer rate() { return rateSetting.rate(); }
    public String interval() { return rateSetting.interval(); }

    /**
     * Replaces the rate setting. Setting a rate clears the interval and vice versa.
     */
    public void updateRateSetting(RateSetting setting) {
        this.rateSetting = Objects.requireNonNull(setting, "setting");
    }

    /**
     * Validates every field. Duplicate names are legal; they are only reported back so callers
     * can log them, since later fields overwrite earlier ones in generated records.
     *
     * @return the duplicated field names, empty if none
     * @throws ConfigurationException if any field is invalid
     */
    public Set<String> validate() {
        if (fields.isEmpty()) {
            throw new ConfigurationException("Producer '" + name + "' defines no fields");
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new HashSet<>();
        for (FieldSpec field : fields) {
            field.validate();
            if (!seen.add(field.name())) {
                duplicates.add(field.name());
            }
        }
        return duplicates;
    }

    @Override
    public String toString() {
        return "ProducerSpec{name='" + name + "', output=" + output.id() + ", fields=" + fields.size() +
                ", rate=" + rate() + ", interval=" + interval() + '}';
    }
}
