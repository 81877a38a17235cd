package com.lexgate.core.model;

import java.util.List;

/**
 * Files a task function may examine and touch: included by at least one
 * {@code include} glob and excluded by none of the {@code exclude} globs.
 */
public record Footprint(List<String> include, List<String> exclude) {

    public Footprint {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static Footprint of(String... include) {
        return new Footprint(List.of(include), List.of());
    }

    public boolean covers(String relativePath) {
        return PathGlob.matchesAny(include, relativePath) && !PathGlob.matchesAny(exclude, relativePath);
    }
}
