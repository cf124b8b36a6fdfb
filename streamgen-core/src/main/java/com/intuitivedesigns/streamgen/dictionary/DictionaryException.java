/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgen.dictionary;

/**
 * Failure loading a dictionary or looking a value up in one.
 */
public class DictionaryException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        READ_FAILED,
        NOT_LOADED,
        EMPTY,
        COLUMN_NOT_FOUND,
        INDEX_OUT_OF_RANGE
    }

    private final Reason reason;

    public DictionaryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DictionaryException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
