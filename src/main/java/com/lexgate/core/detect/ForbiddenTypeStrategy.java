package com.lexgate.core.detect;

import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags references to types listed in {@code replacements} and swaps in the mapped type.
 * An empty mapping reports the reference without a fix.
 */
public class ForbiddenTypeStrategy implements DetectionStrategy {

    @Override
    public DetectorKind kind() {
        return DetectorKind.FORBIDDEN_TYPE;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        Map<String, String> replacements = spec.mapParam("replacements", Map.of());
        var detections = new ArrayList<Detection>();
        for (ClassOrInterfaceType type : unit.requireCompilationUnit().findAll(ClassOrInterfaceType.class)) {
            String name = type.getNameAsString();
            if (!replacements.containsKey(name)) {
                continue;
            }
            String message = "use of forbidden type " + name;
            String frame = SyntaxFrames.describe(type);
            String replacement = replacements.get(name).trim();
            if (replacement.isEmpty()) {
                detections.add(Detection.unfixable(unit.span(type.getName()), message, frame, List.of(name),
                        "no replacement configured for " + name));
            } else if (type.getScope().isPresent()) {
                detections.add(Detection.unfixable(unit.span(type.getName()), message, frame, List.of(name),
                        "qualified reference " + type.asString() + " needs its package reviewed"));
            } else {
                detections.add(Detection.fixable(unit.span(type.getName()), message, frame, List.of(name),
                        Transform.REPLACE_TYPE, List.of(unit.replace(type.getName(), replacement))));
            }
        }
        return detections;
    }
}
