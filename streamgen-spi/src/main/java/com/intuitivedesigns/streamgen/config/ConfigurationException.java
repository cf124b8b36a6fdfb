/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.config;

/**
 * Raised when configuration is missing, malformed or internally inconsistent.
 * Fatal to producer initialization: a producer never starts with a configuration
 * that fails validation.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
