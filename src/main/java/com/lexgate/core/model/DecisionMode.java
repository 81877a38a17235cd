package com.lexgate.core.model;

import java.util.Locale;

public enum DecisionMode {
    /** Resolvable findings are patched without review. */
    AUTO,
    /** Every finding is routed to a reviewer, even when a fix is computable. */
    ASK;

    public static DecisionMode fromString(String value) {
        return DecisionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
