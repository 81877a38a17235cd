package com.lexgate.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * A single violation produced by a task function's detector.
 *
 * @param resolved true when the decision rule resolves the finding to an allowed transform
 */
public record Finding(
        String tfId,
        PrecedenceTier tier,
        String file,
        Span span,
        double confidence,
        String message,
        String frame,
        List<String> hints,
        boolean resolved
) {

    /** Stream order: file, start line, start column, then TF id. */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::file)
            .thenComparingInt((Finding f) -> f.span().startLine())
            .thenComparingInt(f -> f.span().startColumn())
            .thenComparing(Finding::tfId)
            .thenComparing(Finding::span);

    public Finding {
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public FindingKey key() {
        return new FindingKey(tfId, file, span);
    }

    public int line() {
        return span.startLine();
    }
}
