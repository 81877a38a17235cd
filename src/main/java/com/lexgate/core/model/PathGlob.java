package com.lexgate.core.model;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Glob matching over tree-relative, {@code /}-separated paths.
 * <p>
 * A leading {@code **}{@code /} also matches files at the tree root, so
 * {@code **}{@code /*.java} covers {@code App.java} as well as {@code src/App.java}.
 * Compiled matchers are kept in a small least-recently-used cache.
 */
public final class PathGlob {

    static final int CACHE_SIZE = 256;

    private static final Map<String, PathMatcher> MATCHERS = Collections.synchronizedMap(
            new LinkedHashMap<>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, PathMatcher> eldest) {
                    return size() > CACHE_SIZE;
                }
            });

    private PathGlob() {}

    /**
     * @throws IllegalArgumentException if {@code glob} is not a valid glob
     */
    public static boolean matches(String glob, String relativePath) {
        if (glob == null || glob.isBlank() || relativePath == null || relativePath.isEmpty()) {
            return false;
        }
        var path = Paths.get(relativePath);
        if (matcher(glob).matches(path)) {
            return true;
        }
        return glob.startsWith("**/") && matcher(glob.substring(3)).matches(path);
    }

    public static boolean matchesAny(Collection<String> globs, String relativePath) {
        if (globs == null || globs.isEmpty()) {
            return false;
        }
        for (String glob : globs) {
            if (matches(glob, relativePath)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return why {@code glob} cannot be compiled, or empty when it is valid
     */
    public static Optional<String> problem(String glob) {
        if (glob == null || glob.isBlank()) {
            return Optional.of("empty glob");
        }
        try {
            matcher(glob);
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage().lines().findFirst().orElse("invalid glob"));
        }
    }

    static int cachedMatchers() {
        return MATCHERS.size();
    }

    private static PathMatcher matcher(String glob) {
        synchronized (MATCHERS) {
            PathMatcher matcher = MATCHERS.get(glob);
            if (matcher == null) {
                matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
                MATCHERS.put(glob, matcher);
            }
            return matcher;
        }
    }
}
