/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.queue.model;

import java.util.Map;
import java.util.Optional;

/**
 * An external notification that the holder of the lock named by {@code key} has finished.
 * The key is kept as received: a string, a number, a boolean, or anything else a record carries.
 * Falsy keys ({@code null}, empty string, zero, {@code false}) name no lock and are ignored.
 */
public record ReleaseSignal(Object key) {

    public static final String KEY_FIELD = "key";

    /**
     * Extracts a signal from an arbitrary record, keeping the raw {@code key} value.
     */
    public static ReleaseSignal fromRecord(Map<String, ?> record) {
        return new ReleaseSignal(record == null ? null : record.get(KEY_FIELD));
    }

    /**
     * Checks if this signal names a lock.
     */
    public boolean hasKey() {
        if (key == null) {
            return false;
        }
        if (key instanceof String s) {
            return !s.isEmpty();
        }
        if (key instanceof Number n) {
            double value = n.doubleValue();
            return value != 0 && !Double.isNaN(value);
        }
        if (key instanceof Boolean b) {
            return b;
        }
        return true;
    }

    /**
     * Text form of a scalar key, used to select a queue by name.
     * Numbers and booleans are converted; other values select nothing.
     */
    public Optional<String> keyText() {
        if (key instanceof String s) {
            return Optional.of(s);
        }
        if (key instanceof Number || key instanceof Boolean) {
            return Optional.of(String.valueOf(key));
        }
        return Optional.empty();
    }

    /**
     * Strict match against an entry key: only an equal string matches.
     */
    public boolean matches(String entryKey) {
        return key instanceof String s && s.equals(entryKey);
    }
}
