package com.lexgate.core.registry;

import java.util.Arrays;

/**
 * Value types a schema field rule can demand.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    STRING_LIST("string-list"),
    ENUM("enum"),
    ENUM_LIST("enum-list");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    public static FieldType fromString(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field type: " + value));
    }
}
