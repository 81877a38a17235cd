package com.lexgate.core.detect;

import com.lexgate.core.model.Span;
import com.lexgate.core.model.Transform;

import java.util.List;

/**
 * What a strategy reports for one occurrence: where, why, and either the edits that fix it
 * or the reason it cannot be fixed mechanically.
 */
public record Detection(
        Span span,
        String message,
        String frame,
        List<String> hints,
        Transform transform,
        List<TextEdit> edits,
        String ambiguity
) {

    public Detection {
        hints = hints == null ? List.of() : List.copyOf(hints);
        edits = edits == null ? List.of() : List.copyOf(edits);
    }

    public static Detection fixable(Span span, String message, String frame, List<String> hints,
                                    Transform transform, List<TextEdit> edits) {
        return new Detection(span, message, frame, hints, transform, edits, null);
    }

    public static Detection unfixable(Span span, String message, String frame, List<String> hints,
                                      String reason) {
        return new Detection(span, message, frame, hints, null, List.of(), reason);
    }

    public boolean hasFix() {
        return transform != null && !edits.isEmpty();
    }
}
