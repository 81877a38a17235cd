package com.lexgate.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a task function. Only {@link #ACTIVE} functions execute.
 */
public enum TfStatus {
    ACTIVE, STUB, DISABLED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TfStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        return TfStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
