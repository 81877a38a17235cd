package com.lexgate.core.model;

import java.util.Arrays;

/**
 * Post-apply checks a task function declares under {@code verify}.
 */
public enum AcceptancePredicate {
    /** Every touched file still parses. */
    PARSES("parses"),
    /** A re-scan finds no resolvable finding of the function. */
    FIXED_POINT("fixed-point"),
    /** A re-scan finds no finding of the function at all. */
    ABSENT("absent");

    private final String wireName;

    AcceptancePredicate(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AcceptancePredicate fromString(String value) {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown acceptance predicate: " + value));
    }
}
