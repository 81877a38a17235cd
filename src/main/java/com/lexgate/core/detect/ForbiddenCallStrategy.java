package com.lexgate.core.detect;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags calls listed in {@code methods}. Entries are either a bare method name, matched on
 * any receiver, or {@code Receiver.method}, matched against the receiver as written.
 * Calls inside methods named in {@code allowed_in} are permitted. A {@code rename} entry
 * turns the finding into a method rename.
 */
public class ForbiddenCallStrategy implements DetectionStrategy {

    @Override
    public DetectorKind kind() {
        return DetectorKind.FORBIDDEN_CALL;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        List<String> methods = spec.listParam("methods", List.of());
        List<String> allowedIn = spec.listParam("allowed_in", List.of());
        Map<String, String> rename = spec.mapParam("rename", Map.of());

        var detections = new ArrayList<Detection>();
        for (MethodCallExpr call : unit.requireCompilationUnit().findAll(MethodCallExpr.class)) {
            String qualified = call.getScope().map(s -> s + ".").orElse("") + call.getNameAsString();
            String matched = methods.stream()
                    .filter(m -> m.contains(".") ? m.equals(qualified) : m.equals(call.getNameAsString()))
                    .findFirst()
                    .orElse(null);
            if (matched == null) {
                continue;
            }
            boolean allowed = SyntaxFrames.enclosingMethod(call)
                    .map(MethodDeclaration::getNameAsString)
                    .filter(allowedIn::contains)
                    .isPresent();
            if (allowed) {
                continue;
            }

            String message = "call to forbidden method " + matched;
            String frame = SyntaxFrames.describe(call);
            String target = rename.getOrDefault(matched, "").trim();
            if (target.isEmpty()) {
                detections.add(Detection.unfixable(unit.span(call), message, frame, List.of(qualified),
                        "no automatic replacement for " + matched));
            } else {
                String newName = target.substring(target.lastIndexOf('.') + 1);
                detections.add(Detection.fixable(unit.span(call), message, frame, List.of(qualified),
                        Transform.RENAME_CALL, List.of(unit.replace(call.getName(), newName))));
            }
        }
        return detections;
    }
}
