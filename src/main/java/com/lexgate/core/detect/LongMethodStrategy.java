package com.lexgate.core.detect;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reports methods and constructors spanning more than {@code max_lines} lines. Suggest-only.
 */
public class LongMethodStrategy implements DetectionStrategy {

    static final int DEFAULT_MAX_LINES = 100;

    @Override
    public DetectorKind kind() {
        return DetectorKind.LONG_METHOD;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        int maxLines = spec.intParam("max_lines", DEFAULT_MAX_LINES);
        var detections = new ArrayList<Detection>();
        for (CallableDeclaration callable : unit.requireCompilationUnit().findAll(CallableDeclaration.class)) {
            Span span = unit.span(callable);
            int lines = span.endLine() - span.startLine() + 1;
            if (lines <= maxLines) {
                continue;
            }
            detections.add(Detection.unfixable(span,
                    callable.getNameAsString() + " spans " + lines + " lines (limit " + maxLines + ")",
                    SyntaxFrames.describe(callable),
                    List.of(callable.getNameAsString()),
                    "splitting a method needs human judgement"));
        }
        detections.sort(Comparator.comparing(Detection::span));
        return detections;
    }
}
