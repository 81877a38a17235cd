package com.lexgate.core.gate;

import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.PrecedenceTier;

import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which findings can block a merge: those of a gating tier, plus any task function named
 * explicitly.
 */
public record GateConfig(Set<PrecedenceTier> gatingTiers, Set<String> extraTfIds) {

    public GateConfig {
        gatingTiers = gatingTiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(gatingTiers));
        extraTfIds = Set.copyOf(extraTfIds);
    }

    public static GateConfig defaults() {
        return new GateConfig(EnumSet.of(PrecedenceTier.L1), Set.of());
    }

    public static GateConfig from(LexgateProperties.Gate gate) {
        var tiers = EnumSet.noneOf(PrecedenceTier.class);
        gate.getTiers().forEach(t -> tiers.add(PrecedenceTier.fromString(t)));
        return new GateConfig(tiers, new TreeSet<>(gate.getExtraTfIds()));
    }
}
