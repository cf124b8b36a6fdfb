/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.cli;

import com.intuitivedesigns.streamgen.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimal command-line parser.
 *
 * Supports:
 * - {@code --option value} and {@code --option=value}
 * - {@code --flag} (no value follows, or the next token is another option)
 * - positional arguments
 * - short aliases registered with {@link #alias(String, String)} before {@link #parse(String[])}
 */
public final class CliArgs {

    private final Map<String, String> options = new HashMap<>();
    private final Set<String> flags = new HashSet<>();
    private final List<String> positionals = new ArrayList<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Set<String> flagNames = new HashSet<>();

    public CliArgs alias(String shortName, String longName) {
        aliases.put(shortName, longName);
        return this;
    }

    /**
     * Declare a name that never takes a value, so a following positional is not swallowed.
     */
    public CliArgs flag(String name) {
        flagNames.add(name);
        return this;
    }

    public CliArgs parse(String[] args) {
        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];

            if (arg.startsWith("--") && arg.length() > 2) {
                String key = arg.substring(2);
                int eq = key.indexOf('=');
                if (eq > 0) {
                    options.put(key.substring(0, eq), key.substring(eq + 1));
                } else if (!flagNames.contains(key) && i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    options.put(key, args[++i]);
                } else {
                    flags.add(key);
                }
            } else if (arg.startsWith("-") && arg.length() > 1 && aliases.containsKey(arg.substring(1))) {
                String key = aliases.get(arg.substring(1));
                if (!flagNames.contains(key) && i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    options.put(key, args[++i]);
                } else {
                    flags.add(key);
                }
            } else {
                positionals.add(arg);
            }
        }
        return this;
    }

    /**
     * @return option value or null if not present
     */
    public String option(String name) {
        return options.get(name);
    }

    public String option(String name, String def) {
        String v = options.get(name);
        return (v == null || v.isBlank()) ? def : v;
    }

    /**
     * @throws ConfigurationException if the value is present but not an integer
     */
    public Integer intOption(String name) {
        String v = options.get(name);
        if (v == null) return null;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " must be an integer: " + v);
        }
    }

    public boolean hasFlag(String name) {
        return flags.contains(name);
    }

    public List<String> positionals() {
        return Collections.unmodifiableList(positionals);
    }
}
