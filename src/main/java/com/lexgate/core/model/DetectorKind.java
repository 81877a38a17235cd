package com.lexgate.core.model;

import java.util.Locale;

/**
 * The closed set of detection strategies a task function can select.
 */
public enum DetectorKind {
    BROAD_CATCH,
    EMPTY_CATCH,
    CAUSE_DROPPED,
    FORBIDDEN_TYPE,
    FORBIDDEN_CALL,
    LONG_METHOD,
    SQL_CONCAT,
    SYNTAX_ERROR;

    public static DetectorKind fromString(String value) {
        return DetectorKind.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
