package com.lexgate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * A 1-based, inclusive source region.
 */
public record Span(
        @JsonProperty("start_line") int startLine,
        @JsonProperty("start_col") int startColumn,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("end_col") int endColumn
) implements Comparable<Span> {

    private static final Comparator<Span> ORDER = Comparator
            .comparingInt(Span::startLine)
            .thenComparingInt(Span::startColumn)
            .thenComparingInt(Span::endLine)
            .thenComparingInt(Span::endColumn);

    public Span {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid span " + startLine + ".." + endLine);
        }
    }

    public static Span line(int line) {
        return new Span(line, 1, line, 1);
    }

    @Override
    public int compareTo(Span other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
