package com.lexgate.core.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.PrecedenceTier;
import com.lexgate.core.model.Span;

import java.util.List;

/**
 * Wire shape of one finding in the findings stream and the gate report.
 */
public record FindingLine(
        @JsonProperty("tf_id") String tfId,
        @JsonProperty("tier") String tier,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("col") int col,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("end_col") int endCol,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("message") String message,
        @JsonProperty("frame") String frame,
        @JsonProperty("hints") List<String> hints,
        @JsonProperty("resolved") boolean resolved
) {

    public static FindingLine of(Finding finding) {
        Span span = finding.span();
        return new FindingLine(finding.tfId(), finding.tier().name(), finding.file(),
                span.startLine(), span.startColumn(), span.endLine(), span.endColumn(),
                finding.confidence(), finding.message(), finding.frame(), finding.hints(), finding.resolved());
    }

    /**
     * @throws IllegalArgumentException if a required field is missing or the tier or span is not valid
     */
    public Finding toFinding() {
        if (tfId == null || file == null) {
            throw new IllegalArgumentException("tf_id and file are required");
        }
        return new Finding(tfId, PrecedenceTier.fromString(tier), file,
                new Span(line, col, endLine, endCol), confidence,
                message == null ? "" : message, frame == null ? "" : frame, hints, resolved);
    }
}
