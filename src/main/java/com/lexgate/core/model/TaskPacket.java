package com.lexgate.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Self-contained work item handed to an external reviewer for a finding the engine
 * could not resolve on its own.
 *
 * @param codeFrame the finding's lines with two lines of context either side, numbered
 * @param reason    why the engine did not patch it
 */
public record TaskPacket(
        @JsonProperty("tf_id") String tfId,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("span") Span span,
        @JsonProperty("code_frame") String codeFrame,
        @JsonProperty("allowed_transforms") List<String> allowedTransforms,
        @JsonProperty("decision_rule") String decisionRule,
        @JsonProperty("hints") List<String> hints,
        @JsonProperty("reason") String reason
) {

    public TaskPacket {
        allowedTransforms = List.copyOf(allowedTransforms);
        hints = List.copyOf(hints);
    }
}
