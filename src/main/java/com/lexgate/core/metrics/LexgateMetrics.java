package com.lexgate.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Lexgate runs.
 */
@Service
public class LexgateMetrics {

    private final MeterRegistry registry;

    public LexgateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("lexgate.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFindings(String tfId, String tier, int count) {
        Counter.builder("lexgate.findings.total")
                .tag("tf", tfId)
                .tag("tier", tier)
                .register(registry)
                .increment(count);
    }

    public void recordFilesScanned(int count) {
        DistributionSummary.builder("lexgate.scan.files")
                .description("Files examined per scan")
                .register(registry)
                .record(count);
    }

    /**
     * @param reason short failure class, e.g. "parse" or "detector"
     */
    public void recordDetectorFailure(String reason) {
        Counter.builder("lexgate.detector.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordProposal(String outcome) {
        Counter.builder("lexgate.proposals.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordPatchesApplied(int count) {
        Counter.builder("lexgate.patches.applied")
                .register(registry)
                .increment(count);
    }

    public void recordApplyConflicts(int count) {
        Counter.builder("lexgate.patches.conflicts")
                .description("Patches skipped for drift or overlap")
                .register(registry)
                .increment(count);
    }

    public void recordVerifyResult(String status) {
        Counter.builder("lexgate.verify.results")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordGateResult(boolean passed, int remaining) {
        Counter.builder("lexgate.gate.evaluations")
                .tag("result", passed ? "pass" : "fail")
                .register(registry)
                .increment();

        DistributionSummary.builder("lexgate.gate.remaining")
                .description("Unwaived gating findings per evaluation")
                .register(registry)
                .record(remaining);
    }

    public void recordIngestOutcome(String outcome) {
        Counter.builder("lexgate.bridge.ingested")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
