package com.lexgate.core.detect;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags {@code catch} clauses of overly broad types and narrows them to the exception types
 * implied by the calls in the try block.
 * <p>
 * Keys of the {@code narrowing} parameter are call tokens: {@code Files.} matches any call on
 * {@code Files}, {@code new FileReader} matches that constructor, {@code Integer.parseInt}
 * matches the qualified call and a bare name such as {@code readValue} matches the method on
 * any receiver. Values are exception types, qualified when outside {@code java.lang}.
 */
public class BroadCatchStrategy implements DetectionStrategy {

    static final List<String> DEFAULT_BROAD_TYPES = List.of("Exception", "Throwable", "RuntimeException");

    static final Map<String, String> DEFAULT_NARROWING = defaultNarrowing();

    @Override
    public DetectorKind kind() {
        return DetectorKind.BROAD_CATCH;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        List<String> broadTypes = spec.listParam("broad_types", DEFAULT_BROAD_TYPES);
        Map<String, String> narrowing = spec.mapParam("narrowing", DEFAULT_NARROWING);

        var detections = new ArrayList<Detection>();
        for (CatchClause clause : unit.requireCompilationUnit().findAll(CatchClause.class)) {
            Type type = clause.getParameter().getType();
            if (!type.isClassOrInterfaceType()) {
                continue;
            }
            String typeName = type.asClassOrInterfaceType().getNameAsString();
            if (!broadTypes.contains(typeName)) {
                continue;
            }

            var exceptions = new TreeSet<String>();
            var hints = new ArrayList<String>();
            clause.getParentNode()
                    .filter(TryStmt.class::isInstance)
                    .map(TryStmt.class::cast)
                    .ifPresent(tryStmt -> {
                        for (String token : callTokens(tryStmt)) {
                            for (var entry : narrowing.entrySet()) {
                                if (!entry.getValue().isBlank() && tokenMatches(entry.getKey(), token)) {
                                    exceptions.add(entry.getValue());
                                    if (!hints.contains(token)) {
                                        hints.add(token);
                                    }
                                }
                            }
                        }
                    });

            String message = "catch of broad type " + typeName;
            String frame = SyntaxFrames.describe(clause);
            if (exceptions.isEmpty()) {
                detections.add(Detection.unfixable(unit.span(type), message, frame, hints,
                        "no call in the try block maps to a specific exception type"));
                continue;
            }
            var spelled = new LinkedHashSet<String>();
            exceptions.forEach(e -> spelled.add(unit.typeReference(e)));
            detections.add(Detection.fixable(unit.span(type), message, frame, hints,
                    Transform.NARROW_CATCH, List.of(unit.replace(type, String.join(" | ", spelled)))));
        }
        return detections;
    }

    /** Call tokens of the try block and its resources, in source order. */
    private static Set<String> callTokens(TryStmt tryStmt) {
        var tokens = new LinkedHashSet<String>();
        var roots = new ArrayList<Node>(tryStmt.getResources());
        roots.add(tryStmt.getTryBlock());
        for (Node root : roots) {
            root.walk(node -> {
                if (node instanceof MethodCallExpr call) {
                    tokens.add(call.getScope().map(s -> s + ".").orElse("") + call.getNameAsString());
                } else if (node instanceof ObjectCreationExpr creation) {
                    tokens.add("new " + creation.getType().getNameAsString());
                }
            });
        }
        return tokens;
    }

    static boolean tokenMatches(String key, String token) {
        if (key.startsWith("new ")) {
            return key.equals(token);
        }
        if (token.startsWith("new ")) {
            return false;
        }
        if (key.endsWith(".")) {
            return token.startsWith(key);
        }
        if (key.contains(".")) {
            return token.equals(key);
        }
        int dot = token.lastIndexOf('.');
        return key.equals(dot < 0 ? token : token.substring(dot + 1));
    }

    private static Map<String, String> defaultNarrowing() {
        var map = new LinkedHashMap<String, String>();
        map.put("Files.", "java.io.IOException");
        map.put("new FileInputStream", "java.io.IOException");
        map.put("new FileOutputStream", "java.io.IOException");
        map.put("new FileReader", "java.io.IOException");
        map.put("new FileWriter", "java.io.IOException");
        map.put("Integer.parseInt", "NumberFormatException");
        map.put("Long.parseLong", "NumberFormatException");
        map.put("Double.parseDouble", "NumberFormatException");
        map.put("Class.forName", "ClassNotFoundException");
        map.put("Thread.sleep", "InterruptedException");
        return Collections.unmodifiableMap(map);
    }
}
