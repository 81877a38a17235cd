package com.lexgate.core.engine;

import com.lexgate.core.LexgateException;
import com.lexgate.core.apply.ApplyEngine;
import com.lexgate.core.apply.ApplyResult;
import com.lexgate.core.bridge.AgentBridge;
import com.lexgate.core.bridge.IngestEntry;
import com.lexgate.core.bridge.IngestResult;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.gate.GateConfig;
import com.lexgate.core.gate.GateEvaluator;
import com.lexgate.core.logging.MdcContext;
import com.lexgate.core.metrics.LexgateMetrics;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.TaskPacket;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.propose.ProposalBatch;
import com.lexgate.core.propose.Proposer;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.registry.TfRegistryLoader;
import com.lexgate.core.scanner.RunContext;
import com.lexgate.core.scanner.ScanResult;
import com.lexgate.core.scanner.TreeScanner;
import com.lexgate.core.scanner.TreeWalker;
import com.lexgate.core.verify.VerifyReport;
import com.lexgate.core.verify.Verifier;
import com.lexgate.core.waiver.WaiverLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs the stages of one pass over a tree in strict sequence:
 * scan, propose, apply, task emission, verify, re-scan and gate.
 * <p>
 * Each entry point generates a run id, puts it in the MDC for the duration of the call and
 * records stage timings. Parsed sources are cached per run and discarded when it ends.
 */
@Service
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final TfRegistryLoader registryLoader;
    private final TreeScanner scanner;
    private final TreeWalker walker;
    private final Proposer proposer;
    private final ApplyEngine applyEngine;
    private final Verifier verifier;
    private final WaiverLedger ledger;
    private final GateEvaluator gateEvaluator;
    private final AgentBridge bridge;
    private final LexgateProperties properties;
    private final LexgateMetrics metrics;

    public PolicyEngine(TfRegistryLoader registryLoader, TreeScanner scanner, TreeWalker walker,
                        Proposer proposer, ApplyEngine applyEngine, Verifier verifier,
                        WaiverLedger ledger, GateEvaluator gateEvaluator, AgentBridge bridge,
                        LexgateProperties properties, LexgateMetrics metrics) {
        this.registryLoader = registryLoader;
        this.scanner = scanner;
        this.walker = walker;
        this.proposer = proposer;
        this.applyEngine = applyEngine;
        this.verifier = verifier;
        this.ledger = ledger;
        this.gateEvaluator = gateEvaluator;
        this.bridge = bridge;
        this.properties = properties;
        this.metrics = metrics;
    }

    public TfRegistry loadRegistry(Path root) {
        return timed("registry", () -> registryLoader.load(root));
    }

    public ScanResult scan(Path root, TfRegistry registry) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            return scanStage(new RunContext(runId, root), registry);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Scans and proposes without touching the tree.
     */
    public ProposalBatch propose(Path root, TfRegistry registry) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            var context = new RunContext(runId, root);
            ScanResult scan = scanStage(context, registry);
            return proposeStage(context, registry, scan);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Scans and proposes, then rewrites the ambiguous findings' task packets.
     */
    public List<TaskPacket> emitTasks(Path root, TfRegistry registry) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            var context = new RunContext(runId, root);
            ProposalBatch batch = proposeStage(context, registry, scanStage(context, registry));
            return timed("emit", () -> bridge.emit(root, batch.ambiguous(), registry));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Scan, propose, apply, emit and verify. Stops short of gating.
     */
    public RunReport apply(Path root, TfRegistry registry, ChangeContext change, Instant now) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            return repair(runId, root, registry, change, now);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * The whole pipeline: repair, then re-scan the patched tree and gate the change on what is left.
     */
    public RunReport run(Path root, TfRegistry registry, ChangeContext change, Instant now) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} for {} ({} changed file(s))", runId, change.id(), change.changedFiles().size());
            RunReport repaired = repair(runId, root, registry, change, now);
            ScanResult rescan = scanStage(new RunContext(runId + "-rescan", root), registry);
            GateDecision decision = gateStage(root, rescan.findings(), change, now);
            return new RunReport(runId, repaired.scan(), repaired.proposals(), repaired.applied(),
                    repaired.tasks(), repaired.verify(), rescan, decision);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the check suite and the acceptance predicates of {@code tfIds} over {@code files}.
     * Each function is checked only against the files its footprint covers.
     *
     * @param tfIds functions to check; every active function when empty
     * @param files tree-relative files; every file of the tree when empty
     */
    public VerifyReport verify(Path root, TfRegistry registry, Collection<String> tfIds,
                               Collection<String> files, ChangeContext change, Instant now) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            Collection<String> candidates = files.isEmpty() ? treeFiles(root) : files;
            Set<String> wanted = Set.copyOf(tfIds);
            var touched = new TreeMap<String, List<String>>();
            for (TaskFunction tf : registry.active()) {
                if (!wanted.isEmpty() && !wanted.contains(tf.id())) {
                    continue;
                }
                List<String> covered = candidates.stream().filter(tf.footprint()::covers).sorted().toList();
                if (!covered.isEmpty()) {
                    touched.put(tf.id(), covered);
                }
            }
            return verifyStage(root, registry, touched, ledger.active(root, change, now));
        } finally {
            MdcContext.clear();
        }
    }

    public GateDecision gate(Path root, List<Finding> findings, ChangeContext change, Instant now) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            return gateStage(root, findings, change, now);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reads reviewer diffs from {@code diffDir} and ingests them.
     */
    public IngestResult ingest(Path root, Path diffDir, TfRegistry registry, ChangeContext change, Instant now) {
        String runId = generateRunId();
        MdcContext.setRun(runId);
        try {
            IngestResult result = timed("ingest",
                    () -> bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, now));
            result.entries().stream().map(IngestEntry::outcome)
                    .forEach(o -> metrics.recordIngestOutcome(o.name().toLowerCase()));
            log.info("Ingested {} diff(s): {} accepted, {} already applied, {} waived, {} rejected",
                    result.entries().size(), result.accepted(), result.alreadyApplied(),
                    result.waived(), result.rejected());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Generates a run ID in the format LXG-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LXG-%d-%04d", year, count);
    }

    // ── Stages ───────────────────────────────────────────────────────

    private RunReport repair(String runId, Path root, TfRegistry registry, ChangeContext change, Instant now) {
        var context = new RunContext(runId, root);
        ScanResult scan = scanStage(context, registry);
        ProposalBatch batch = proposeStage(context, registry, scan);

        ApplyResult applied = timed("apply", () -> applyEngine.apply(root, batch.patches()));
        metrics.recordPatchesApplied(applied.applied().size());
        metrics.recordApplyConflicts(applied.conflicts().size());
        applied.conflicts().forEach(c -> log.warn("{} {}: patch skipped, {}",
                c.patch().tfId(), c.patch().file(), c.reason()));

        List<TaskPacket> tasks = timed("emit", () -> bridge.emit(root, batch.ambiguous(), registry));
        VerifyReport verify = verifyStage(root, registry, applied.touchedFilesByTf(),
                ledger.active(root, change, now));
        return new RunReport(runId, scan, batch, applied, tasks, verify, null, null);
    }

    private ScanResult scanStage(RunContext context, TfRegistry registry) {
        ScanResult scan = timed("scan", () -> scanner.scan(context, registry));
        metrics.recordFilesScanned(scan.filesScanned());
        scan.findings().stream()
                .collect(Collectors.groupingBy(f -> f.tfId() + "|" + f.tier(), TreeMap::new, Collectors.counting()))
                .forEach((key, count) -> {
                    String[] parts = key.split("\\|", 2);
                    metrics.recordFindings(parts[0], parts[1], count.intValue());
                });
        scan.failures().forEach(f -> metrics.recordDetectorFailure(
                f.reason().startsWith("unparseable") ? "parse" : "detector"));
        return scan;
    }

    private ProposalBatch proposeStage(RunContext context, TfRegistry registry, ScanResult scan) {
        ProposalBatch batch = timed("propose", () -> proposer.proposeAll(context, registry, scan.findings()));
        batch.patches().forEach(p -> metrics.recordProposal("resolved"));
        batch.ambiguous().forEach(p -> metrics.recordProposal("ambiguous"));
        batch.rejected().forEach(p -> metrics.recordProposal("rejected"));
        return batch;
    }

    private VerifyReport verifyStage(Path root, TfRegistry registry,
                                     Map<String, ? extends Collection<String>> touched,
                                     Collection<Waiver> waivers) {
        VerifyReport report = timed("verify", () -> verifier.verify(root, registry, touched, waivers));
        metrics.recordVerifyResult(report.passed() ? "pass" : "fail");
        return report;
    }

    private GateDecision gateStage(Path root, List<Finding> findings, ChangeContext change, Instant now) {
        Set<Waiver> waivers = ledger.active(root, change, now);
        GateDecision decision = timed("gate", () -> gateEvaluator.evaluate(findings, change, waivers,
                GateConfig.from(properties.getGate()), now));
        metrics.recordGateResult(decision.passed(), decision.remaining());
        return decision;
    }

    public List<String> treeFiles(Path root) {
        try {
            return walker.files(root);
        } catch (IOException e) {
            throw new LexgateException("Cannot walk " + root + ": " + e.getMessage(), e);
        }
    }

    private <T> T timed(String stage, Supplier<T> body) {
        long start = System.currentTimeMillis();
        try {
            return body.get();
        } finally {
            metrics.recordStageDuration(stage, System.currentTimeMillis() - start);
        }
    }
}
