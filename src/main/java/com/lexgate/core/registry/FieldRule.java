package com.lexgate.core.registry;

import java.util.List;

/**
 * One entry of the TF schema document.
 *
 * @param path    dotted path into the TF document, e.g. {@code decision_rule.mode}
 * @param values  permitted values for enum types
 * @param pattern regular expression a string value must match, or null
 * @param min     inclusive lower bound for numbers, or null
 * @param max     inclusive upper bound for numbers, or null
 */
public record FieldRule(
        String path,
        FieldType type,
        boolean required,
        List<String> values,
        String pattern,
        Double min,
        Double max
) {

    public FieldRule {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
