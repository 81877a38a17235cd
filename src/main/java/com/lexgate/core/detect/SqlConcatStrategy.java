package com.lexgate.core.detect;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports SQL sinks whose query argument is built by concatenating non-literal values,
 * either inline or through a local variable initialised that way. Suggest-only.
 */
public class SqlConcatStrategy implements DetectionStrategy {

    static final List<String> DEFAULT_SINKS =
            List.of("execute", "executeQuery", "executeUpdate", "prepareStatement", "addBatch");

    @Override
    public DetectorKind kind() {
        return DetectorKind.SQL_CONCAT;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        List<String> sinks = spec.listParam("sinks", DEFAULT_SINKS);
        var detections = new ArrayList<Detection>();
        for (MethodCallExpr call : unit.requireCompilationUnit().findAll(MethodCallExpr.class)) {
            if (!sinks.contains(call.getNameAsString()) || call.getArguments().isEmpty()) {
                continue;
            }
            Expression query = unwrap(call.getArgument(0));
            var hints = new ArrayList<String>();
            boolean dynamic = isDynamicConcat(query);
            if (!dynamic && query.isNameExpr()) {
                String variable = query.asNameExpr().getNameAsString();
                dynamic = localInitializer(call, variable).map(SqlConcatStrategy::isDynamicConcat).orElse(false);
                if (dynamic) {
                    hints.add(variable);
                }
            }
            if (dynamic) {
                detections.add(Detection.unfixable(unit.span(call),
                        "query passed to " + call.getNameAsString() + " is built by string concatenation",
                        SyntaxFrames.describe(call), hints,
                        "binding parameters changes the call shape; needs review"));
            }
        }
        return detections;
    }

    private static boolean isDynamicConcat(Expression expression) {
        Expression e = unwrap(expression);
        if (!(e instanceof BinaryExpr binary) || binary.getOperator() != BinaryExpr.Operator.PLUS) {
            return false;
        }
        return hasNonLiteralOperand(binary.getLeft()) || hasNonLiteralOperand(binary.getRight());
    }

    private static boolean hasNonLiteralOperand(Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS) {
            return hasNonLiteralOperand(binary.getLeft()) || hasNonLiteralOperand(binary.getRight());
        }
        return !e.isLiteralExpr();
    }

    private static Optional<Expression> localInitializer(Node call, String variable) {
        Optional<Node> scope = call.getParentNode();
        while (scope.isPresent() && !(scope.get() instanceof CallableDeclaration<?>)) {
            scope = scope.get().getParentNode();
        }
        return scope.flatMap(s -> s.findAll(VariableDeclarator.class).stream()
                .filter(v -> v.getNameAsString().equals(variable))
                .findFirst()
                .flatMap(VariableDeclarator::getInitializer));
    }

    private static Expression unwrap(Expression expression) {
        Expression e = expression;
        while (e instanceof EnclosedExpr enclosed) {
            e = enclosed.getInner();
        }
        return e;
    }
}
