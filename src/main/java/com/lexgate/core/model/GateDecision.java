package com.lexgate.core.model;

import java.util.List;

/**
 * Outcome of one gate evaluation. Derived from findings, never stored.
 */
public record GateDecision(
        int totalFindings,
        int gatedTier,
        int inFootprint,
        int waivers,
        int suppressed,
        int remaining,
        int changedFiles,
        List<PrecedenceTier> gatingTiers,
        List<Finding> remainingFindings
) {

    public GateDecision {
        gatingTiers = List.copyOf(gatingTiers);
        remainingFindings = List.copyOf(remainingFindings);
    }

    public boolean passed() {
        return remaining == 0;
    }

    public String decision() {
        return passed() ? "pass" : "fail";
    }
}
