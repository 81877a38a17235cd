package com.lexgate.core.gate;

import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.model.Waiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Decides whether a change may merge.
 * <p>
 * Keeps the findings of gating tiers (or explicitly gated task functions) that sit in the
 * change's files, removes those covered by an active waiver for the same task function, and
 * fails when any remain. Pure: the same inputs always give the same decision.
 */
@Service
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    public GateDecision evaluate(List<Finding> findings, ChangeContext change, Collection<Waiver> waivers,
                                 GateConfig config, Instant now) {
        List<Finding> gated = findings.stream()
                .filter(f -> config.gatingTiers().contains(f.tier()) || config.extraTfIds().contains(f.tfId()))
                .toList();
        List<Finding> inFootprint = gated.stream()
                .filter(f -> change.changedFiles().contains(f.file()))
                .toList();
        List<Waiver> active = waivers.stream()
                .filter(w -> w.isActiveFor(change, now))
                .distinct()
                .toList();
        List<Finding> remaining = inFootprint.stream()
                .filter(f -> active.stream().noneMatch(w -> w.tfId().equals(f.tfId()) && w.covers(f.file())))
                .sorted(Finding.ORDER)
                .toList();

        var decision = new GateDecision(
                findings.size(),
                gated.size(),
                inFootprint.size(),
                active.size(),
                inFootprint.size() - remaining.size(),
                remaining.size(),
                change.changedFiles().size(),
                List.copyOf(new TreeSet<>(config.gatingTiers())),
                remaining);
        log.info("Gate {} for {}: {} gated, {} in footprint, {} suppressed by {} waiver(s), {} remaining",
                decision.decision(), change.id(), decision.gatedTier(), decision.inFootprint(),
                decision.suppressed(), decision.waivers(), decision.remaining());
        return decision;
    }
}
