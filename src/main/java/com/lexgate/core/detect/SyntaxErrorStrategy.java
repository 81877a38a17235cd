package com.lexgate.core.detect;

import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;

import java.util.List;

/**
 * Reports a file that does not parse as a finding of its own.
 */
public class SyntaxErrorStrategy implements DetectionStrategy {

    @Override
    public DetectorKind kind() {
        return DetectorKind.SYNTAX_ERROR;
    }

    @Override
    public boolean requiresParse() {
        return false;
    }

    @Override
    public List<Detection> detect(SourceUnit unit, DetectorSpec spec) {
        if (unit.parses()) {
            return List.of();
        }
        return List.of(Detection.unfixable(unit.problemSpan(),
                "file does not parse: " + unit.parseProblem(),
                "<file>", List.of(), "unparseable source cannot be repaired automatically"));
    }
}
