package com.lexgate.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The change under review: an identifier such as {@code PR-42} plus the files it touches.
 */
public record ChangeContext(String id, SortedSet<String> changedFiles) {

    /** Waivers recorded with this context apply to every change. */
    public static final String ANY = "*";

    public ChangeContext {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Change context id must not be blank");
        }
        changedFiles = Collections.unmodifiableSortedSet(
                changedFiles == null ? new TreeSet<>() : new TreeSet<>(changedFiles));
    }

    public static ChangeContext of(String id, Collection<String> changedFiles) {
        return new ChangeContext(id, changedFiles == null ? null : new TreeSet<>(changedFiles));
    }

    /**
     * Reads a newline-delimited changed-file list. Blank lines and {@code #} comments are
     * skipped; paths are normalised to {@code /} separators without a leading {@code ./}.
     */
    public static ChangeContext fromList(String id, String text) {
        var files = new TreeSet<String>();
        for (String raw : text.split("\\r?\\n")) {
            String path = raw.strip().replace('\\', '/');
            if (path.isEmpty() || path.startsWith("#")) {
                continue;
            }
            while (path.startsWith("./")) {
                path = path.substring(2);
            }
            files.add(path);
        }
        return new ChangeContext(id, files);
    }
}
