package com.lexgate.core.model;

import java.util.Locale;

/**
 * Priority tiers of task functions. {@code L1} outranks {@code L4}.
 */
public enum PrecedenceTier {
    L1, L2, L3, L4;

    public int rank() {
        return ordinal() + 1;
    }

    public static PrecedenceTier fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Precedence tier must not be blank");
        }
        return PrecedenceTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
