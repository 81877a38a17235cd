package com.lexgate.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Vocabulary of edits the engine is allowed to make. A task function lists the subset it
 * permits under {@code allowed_transforms}.
 */
public enum Transform {
    NARROW_CATCH("narrow-catch"),
    RETHROW("rethrow"),
    CHAIN_CAUSE("chain-cause"),
    REPLACE_TYPE("replace-type"),
    RENAME_CALL("rename-call");

    private final String wireName;

    Transform(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Transform> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst();
    }
}
