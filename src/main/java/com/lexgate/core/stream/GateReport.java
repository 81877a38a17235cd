package com.lexgate.core.stream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lexgate.core.LexgateException;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.model.PrecedenceTier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON form of a {@link GateDecision}.
 */
public record GateReport(
        @JsonProperty("context") String context,
        @JsonProperty("total_findings") int totalFindings,
        @JsonProperty("gated_tier") int gatedTier,
        @JsonProperty("in_footprint") int inFootprint,
        @JsonProperty("waivers") int waivers,
        @JsonProperty("suppressed") int suppressed,
        @JsonProperty("remaining") int remaining,
        @JsonProperty("changed_files") int changedFiles,
        @JsonProperty("gating_tiers") List<String> gatingTiers,
        @JsonProperty("decision") String decision,
        @JsonProperty("remaining_findings") List<FindingLine> remainingFindings
) {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static GateReport of(String context, GateDecision decision) {
        return new GateReport(context, decision.totalFindings(), decision.gatedTier(), decision.inFootprint(),
                decision.waivers(), decision.suppressed(), decision.remaining(), decision.changedFiles(),
                decision.gatingTiers().stream().map(PrecedenceTier::name).toList(),
                decision.decision(),
                decision.remainingFindings().stream().map(FindingLine::of).toList());
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new LexgateException("Cannot render gate report: " + e.getMessage(), e);
        }
    }

    public void write(Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, toJson() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LexgateException("Cannot write gate report to " + target + ": " + e.getMessage(), e);
        }
    }
}
