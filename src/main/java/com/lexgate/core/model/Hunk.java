package com.lexgate.core.model;

import java.util.List;

/**
 * Replacement of {@code before.size()} lines starting at {@code startLine} with {@code after}.
 * An empty {@code before} inserts ahead of {@code startLine}.
 */
public record Hunk(int startLine, List<String> before, List<String> after) {

    public Hunk {
        before = List.copyOf(before);
        after = List.copyOf(after);
    }

    /** Last original line touched; equals {@code startLine - 1} for a pure insertion. */
    public int endLine() {
        return startLine + before.size() - 1;
    }

    public int delta() {
        return after.size() - before.size();
    }
}
