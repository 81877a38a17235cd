package com.lexgate.core.detect;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags {@code throw new X(...)} inside a catch block when the caught exception is not passed
 * on as the cause. A single-argument constructor gets the caught variable appended.
 */
public class CauseDroppedStrategy implements DetectionStrategy {

    @Override
    public DetectorKind kind() {
        return DetectorKind.CAUSE_DROPPED;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        var detections = new ArrayList<Detection>();
        for (ThrowStmt throwStmt : unit.requireCompilationUnit().findAll(ThrowStmt.class)) {
            if (!(throwStmt.getExpression() instanceof ObjectCreationExpr creation)) {
                continue;
            }
            Optional<CatchClause> handler = enclosingCatch(throwStmt);
            if (handler.isEmpty()) {
                continue;
            }
            String caught = handler.get().getParameter().getNameAsString();
            boolean chained = creation.getArguments().stream()
                    .anyMatch(arg -> arg.isNameExpr() && arg.asNameExpr().getNameAsString().equals(caught));
            if (chained) {
                continue;
            }

            String type = creation.getType().getNameAsString();
            String message = "new " + type + " drops the caught exception '" + caught + "'";
            String frame = SyntaxFrames.describe(throwStmt);
            int arity = creation.getArguments().size();
            if (arity == 1) {
                Expression last = creation.getArgument(0);
                detections.add(Detection.fixable(unit.span(creation), message, frame, List.of(caught),
                        Transform.CHAIN_CAUSE, List.of(unit.insertAfter(last, ", " + caught))));
            } else {
                String reason = arity == 0
                        ? "constructor of " + type + " takes no arguments; chain the cause by hand"
                        : "constructor of " + type + " takes " + arity + " arguments; cause position is unknown";
                detections.add(Detection.unfixable(unit.span(creation), message, frame, List.of(caught), reason));
            }
        }
        return detections;
    }

    /** Nearest catch clause around {@code node}, not crossing lambda or member boundaries. */
    private static Optional<CatchClause> enclosingCatch(Node node) {
        Optional<Node> current = node.getParentNode();
        while (current.isPresent()) {
            Node n = current.get();
            if (n instanceof CatchClause clause) {
                return Optional.of(clause);
            }
            if (n instanceof LambdaExpr || n instanceof BodyDeclaration<?>) {
                return Optional.empty();
            }
            current = n.getParentNode();
        }
        return Optional.empty();
    }
}
