package com.lexgate.core.gate;

import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.model.PrecedenceTier;
import com.lexgate.core.model.Span;
import com.lexgate.core.model.Waiver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GateEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private final GateEvaluator evaluator = new GateEvaluator();
    private final ChangeContext change = ChangeContext.of("PR-42", List.of("src/A.java"));

    private static Finding finding(String tfId, PrecedenceTier tier, String file, int line) {
        return new Finding(tfId, tier, file, Span.line(line), 0.9, "catch of broad type Exception",
                "A.f()", List.of(), false);
    }

    // ── Scenarios ────────────────────────────────────────────────────

    @Nested
    @DisplayName("single broad catch in the only changed file")
    class SingleFinding {

        private final List<Finding> findings = List.of(finding("X-001", PrecedenceTier.L1, "src/A.java", 12));

        @Test
        @DisplayName("fails with one remaining finding when nothing is waived")
        void failsWithoutWaiver() {
            GateDecision decision = evaluator.evaluate(findings, change, List.of(), GateConfig.defaults(), NOW);

            assertFalse(decision.passed());
            assertEquals("fail", decision.decision());
            assertEquals(1, decision.remaining());
            assertEquals(findings, decision.remainingFindings());
        }

        @Test
        @DisplayName("passes with an unexpired waiver for the context")
        void passesWithWaiver() {
            var waiver = new Waiver("X-001", "*", Instant.parse("2026-12-31T00:00:00Z"), "vendor code", "PR-42");

            GateDecision decision = evaluator.evaluate(findings, change, List.of(waiver), GateConfig.defaults(), NOW);

            assertTrue(decision.passed());
            assertEquals(0, decision.remaining());
            assertEquals(1, decision.suppressed());
            assertEquals(1, decision.waivers());
        }

        @Test
        @DisplayName("an expired waiver suppresses nothing")
        void expiredWaiver() {
            var waiver = new Waiver("X-001", "*", Instant.parse("2026-01-01T00:00:00Z"), "", "PR-42");

            GateDecision decision = evaluator.evaluate(findings, change, List.of(waiver), GateConfig.defaults(), NOW);

            assertEquals(1, decision.remaining());
            assertEquals(0, decision.waivers());
        }

        @Test
        @DisplayName("a waiver for another context suppresses nothing")
        void otherContextWaiver() {
            var waiver = new Waiver("X-001", "*", null, "", "PR-7");

            assertFalse(evaluator.evaluate(findings, change, List.of(waiver), GateConfig.defaults(), NOW).passed());
        }
    }

    // ── Footprint and tiers ──────────────────────────────────────────

    @Test
    @DisplayName("findings outside the changed files never block")
    void footprint() {
        List<Finding> findings = List.of(
                finding("X-001", PrecedenceTier.L1, "src/A.java", 3),
                finding("X-001", PrecedenceTier.L1, "src/Untouched.java", 3));

        GateDecision decision = evaluator.evaluate(findings, change, List.of(), GateConfig.defaults(), NOW);

        assertEquals(2, decision.gatedTier());
        assertEquals(1, decision.inFootprint());
        assertEquals(1, decision.remaining());
        assertEquals("src/A.java", decision.remainingFindings().get(0).file());
    }

    @Test
    @DisplayName("only gating tiers and named functions block")
    void tiers() {
        List<Finding> findings = List.of(
                finding("TYP-020", PrecedenceTier.L3, "src/A.java", 3),
                finding("CPL-017", PrecedenceTier.L4, "src/A.java", 9));

        assertTrue(evaluator.evaluate(findings, change, List.of(), GateConfig.defaults(), NOW).passed());

        var config = new GateConfig(Set.of(PrecedenceTier.L1), Set.of("TYP-020"));
        GateDecision decision = evaluator.evaluate(findings, change, List.of(), config, NOW);
        assertEquals(1, decision.remaining());
        assertEquals("TYP-020", decision.remainingFindings().get(0).tfId());
    }

    @Test
    void configFromProperties() {
        var gate = new LexgateProperties.Gate();
        gate.setTiers(List.of("l1", "L2"));
        gate.setExtraTfIds(List.of("SQL-007"));

        GateConfig config = GateConfig.from(gate);

        assertEquals(Set.of(PrecedenceTier.L1, PrecedenceTier.L2), config.gatingTiers());
        assertEquals(Set.of("SQL-007"), config.extraTfIds());
    }

    // ── Properties ───────────────────────────────────────────────────

    @Test
    @DisplayName("adding waivers never increases the remaining count")
    void monotonic() {
        List<Finding> findings = List.of(
                finding("X-001", PrecedenceTier.L1, "src/A.java", 3),
                finding("X-001", PrecedenceTier.L1, "src/A.java", 20),
                finding("Y-002", PrecedenceTier.L1, "src/A.java", 8));
        List<Waiver> candidates = List.of(
                new Waiver("Y-002", "src/A.java", null, "", "PR-42"),
                new Waiver("Z-003", "*", null, "", "*"),
                new Waiver("X-001", "src/**", null, "", "*"));

        var waivers = new ArrayList<Waiver>();
        int previous = evaluator.evaluate(findings, change, waivers, GateConfig.defaults(), NOW).remaining();
        assertEquals(3, previous);
        for (Waiver waiver : candidates) {
            waivers.add(waiver);
            int now = evaluator.evaluate(findings, change, waivers, GateConfig.defaults(), NOW).remaining();
            assertTrue(now <= previous, "remaining grew after adding " + waiver);
            previous = now;
        }
        assertEquals(0, previous);
    }

    @Test
    @DisplayName("the same inputs give the same decision")
    void deterministic() {
        List<Finding> findings = List.of(
                finding("X-001", PrecedenceTier.L1, "src/A.java", 20),
                finding("X-001", PrecedenceTier.L1, "src/A.java", 3));

        GateDecision first = evaluator.evaluate(findings, change, List.of(), GateConfig.defaults(), NOW);
        GateDecision second = evaluator.evaluate(List.of(findings.get(1), findings.get(0)), change, List.of(),
                GateConfig.defaults(), NOW);

        assertEquals(first, second);
        assertEquals(3, first.remainingFindings().get(0).line());
    }
}
