package com.lexgate.core.detect;

import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;
import com.lexgate.core.model.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags catch blocks without statements and rethrows the caught exception wrapped in an
 * unchecked type ({@code wrapper}, default {@code IllegalStateException}).
 * <p>
 * A block that only holds a comment documents a deliberate choice; with
 * {@code comment_means_intentional} (default true) it is reported but left for review.
 */
public class EmptyCatchStrategy implements DetectionStrategy {

    @Override
    public DetectorKind kind() {
        return DetectorKind.EMPTY_CATCH;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        String wrapper = unit.typeReference(spec.stringParam("wrapper", "IllegalStateException"));
        boolean commentMeansIntentional = spec.booleanParam("comment_means_intentional", true);
        String nl = unit.lineSeparator();

        var detections = new ArrayList<Detection>();
        for (CatchClause clause : unit.requireCompilationUnit().findAll(CatchClause.class)) {
            BlockStmt body = clause.getBody();
            if (!body.getStatements().isEmpty()) {
                continue;
            }
            String param = clause.getParameter().getNameAsString();
            String message = "empty catch block swallows " + clause.getParameter().getType().asString();
            String frame = SyntaxFrames.describe(clause);

            if (commentMeansIntentional && !body.getAllContainedComments().isEmpty()) {
                detections.add(Detection.unfixable(unit.span(clause), message, frame, List.of(param),
                        "handler is commented as intentionally empty"));
                continue;
            }

            String indent = unit.indentOf(unit.span(clause).startLine());
            String step = indent.contains("\t") ? "\t" : "    ";
            String replacement = "{" + nl
                    + indent + step + "throw new " + wrapper + "(" + param + ");" + nl
                    + indent + "}";
            detections.add(Detection.fixable(unit.span(clause), message, frame, List.of(param),
                    Transform.RETHROW, List.of(unit.replace(body, replacement))));
        }
        return detections;
    }
}
