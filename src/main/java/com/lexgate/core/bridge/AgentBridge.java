package com.lexgate.core.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lexgate.core.LexgateException;
import com.lexgate.core.apply.ApplyEngine;
import com.lexgate.core.apply.ApplyResult;
import com.lexgate.core.apply.UnifiedDiff;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.Patch;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.TaskPacket;
import com.lexgate.core.model.Transform;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.propose.Proposal;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.TreeWalker;
import com.lexgate.core.verify.Verifier;
import com.lexgate.core.verify.VerifyReport;
import com.lexgate.core.waiver.WaiverLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Hands findings the engine will not patch to an external reviewer and takes their diffs back.
 * <p>
 * Outbound, each ambiguous finding becomes one JSON task packet in
 * {@code lexgate.bridge.tasks-dir}. Inbound, each returned diff is applied to a scratch copy
 * of the tree and verified there first; only a diff that verifies is applied to the real
 * tree. A diff that fails verification is not applied and a waiver naming the failure is
 * recorded for the change context, expiring after {@code lexgate.bridge.waiver-ttl}.
 */
@Service
public class AgentBridge {

    private static final Logger log = LoggerFactory.getLogger(AgentBridge.class);

    private static final Pattern TASK_FILE = Pattern.compile("^task_\\d{3,}_.+\\.json$");
    private static final Pattern TF_ID_IN_NAME = Pattern.compile("([A-Z]+-\\d{3})");
    private static final int FRAME_CONTEXT = 2;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final LexgateProperties properties;
    private final ApplyEngine applyEngine;
    private final Verifier verifier;
    private final WaiverLedger ledger;
    private final TreeWalker walker;

    public AgentBridge(LexgateProperties properties, ApplyEngine applyEngine, Verifier verifier,
                       WaiverLedger ledger, TreeWalker walker) {
        this.properties = properties;
        this.applyEngine = applyEngine;
        this.verifier = verifier;
        this.ledger = ledger;
        this.walker = walker;
    }

    public Path tasksDir(Path root) {
        return root.resolve(properties.getBridge().getTasksDir());
    }

    // ── Emit ─────────────────────────────────────────────────────────

    /**
     * Builds one packet per ambiguous finding, in finding order.
     */
    public List<TaskPacket> packets(Path root, List<Proposal> ambiguous, TfRegistry registry) {
        return ambiguous.stream()
                .sorted(Comparator.comparing(Proposal::finding, Finding.ORDER))
                .map(p -> toPacket(root, p, registry))
                .toList();
    }

    /**
     * Replaces the contents of the tasks directory with packets for {@code ambiguous}.
     *
     * @return the packets written, in file-number order
     */
    public List<TaskPacket> emit(Path root, List<Proposal> ambiguous, TfRegistry registry) {
        Path dir = tasksDir(root);
        List<TaskPacket> packets = packets(root, ambiguous, registry);
        try {
            Files.createDirectories(dir);
            clearPackets(dir);
            int n = 0;
            for (TaskPacket packet : packets) {
                n++;
                Path target = dir.resolve(String.format("task_%03d_%s.json", n, packet.tfId()));
                objectMapper.writeValue(target.toFile(), packet);
            }
        } catch (IOException e) {
            throw new LexgateException("Cannot write task packets to " + dir + ": " + e.getMessage(), e);
        }
        log.info("Emitted {} task packet(s) to {}", packets.size(), dir);
        return packets;
    }

    private TaskPacket toPacket(Path root, Proposal proposal, TfRegistry registry) {
        Finding finding = proposal.finding();
        Optional<TaskFunction> tf = registry.find(finding.tfId());
        List<String> transforms = tf.map(t -> t.allowedTransforms().stream().map(Transform::wireName).toList())
                .orElse(List.of());
        String rule = tf.map(t -> t.decisionRule().text()).orElse("");
        return new TaskPacket(finding.tfId(), finding.file(), finding.line(), finding.span(),
                codeFrame(root, finding), transforms, rule == null ? "" : rule,
                finding.hints(), proposal.reason());
    }

    /** The finding's lines plus two lines either side, each prefixed with its number. */
    String codeFrame(Path root, Finding finding) {
        String content;
        try {
            content = Files.readString(root.resolve(finding.file()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read {} for a code frame: {}", finding.file(), e.getMessage());
            return finding.frame();
        }
        String[] lines = content.split("\r?\n", -1);
        int from = Math.max(1, finding.span().startLine() - FRAME_CONTEXT);
        int to = Math.min(lines.length, finding.span().endLine() + FRAME_CONTEXT);
        var sb = new StringBuilder();
        for (int n = from; n <= to; n++) {
            sb.append(String.format("%4d | %s", n, lines[n - 1]));
            if (n < to) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static void clearPackets(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path old : stream.filter(p -> TASK_FILE.matcher(p.getFileName().toString()).matches()).toList()) {
                Files.delete(old);
            }
        }
    }

    // ── Ingest ───────────────────────────────────────────────────────

    /**
     * Reads every {@code *.diff} and {@code *.patch} file of {@code dir} in name order.
     * A file named after a task function (e.g. {@code BEX-001.diff}) is attributed to it
     * unless the diff itself carries a {@code # tf_id} header.
     */
    public List<AgentDiff> readDiffs(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new LexgateException("Diff directory not found: " + dir);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".diff") || name.endsWith(".patch");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new LexgateException("Cannot list diffs in " + dir + ": " + e.getMessage(), e);
        }

        var diffs = new ArrayList<AgentDiff>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            Matcher m = TF_ID_IN_NAME.matcher(name);
            String nameTfId = m.find() ? m.group(1) : null;
            try {
                diffs.add(parseDiff(name, nameTfId, Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                diffs.add(AgentDiff.malformed(name, nameTfId, "cannot read: " + e.getMessage()));
            }
        }
        return diffs;
    }

    static AgentDiff parseDiff(String source, String defaultTfId, String text) {
        List<Patch> patches;
        try {
            patches = UnifiedDiff.parse(text, defaultTfId);
        } catch (IllegalArgumentException e) {
            return AgentDiff.malformed(source, defaultTfId, e.getMessage());
        }
        if (patches.isEmpty()) {
            return AgentDiff.malformed(source, defaultTfId, "no hunks");
        }
        if (patches.stream().anyMatch(p -> p.tfId() == null)) {
            return AgentDiff.malformed(source, defaultTfId, "no tf_id in file name or header");
        }
        var escaping = patches.stream().map(Patch::file).filter(ApplyEngine::escapesTree).findFirst();
        if (escaping.isPresent()) {
            return AgentDiff.malformed(source, patches.get(0).tfId(), "path escapes the tree: " + escaping.get());
        }
        return new AgentDiff(source, patches.get(0).tfId(), patches, null);
    }

    /**
     * Ingests {@code diffs} one at a time, each against the tree as left by the ones before.
     */
    public IngestResult ingest(Path root, List<AgentDiff> diffs, TfRegistry registry,
                               ChangeContext change, Instant now) {
        var entries = new ArrayList<IngestEntry>();
        ApplyResult applied = ApplyResult.empty();
        for (AgentDiff diff : diffs) {
            if (diff.isMalformed()) {
                log.warn("Rejected diff {}: {}", diff.source(), diff.error());
                entries.add(new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.REJECTED, diff.error()));
                continue;
            }
            IngestEntry entry = ingestOne(root, diff, registry, change, now);
            if (entry.outcome() == IngestOutcome.ACCEPTED) {
                ApplyResult real = applyEngine.apply(root, diff.patches());
                if (!real.conflicts().isEmpty()) {
                    entry = new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.REJECTED,
                            real.conflicts().get(0).reason());
                }
                applied = applied.merge(real);
            }
            log.info("Diff {} ({}): {}", diff.source(), diff.tfId(), entry.outcome());
            entries.add(entry);
        }
        return new IngestResult(entries, applied);
    }

    private IngestEntry ingestOne(Path root, AgentDiff diff, TfRegistry registry,
                                  ChangeContext change, Instant now) {
        Path sandbox = null;
        try {
            sandbox = copyTree(root);
            ApplyResult trial = applyEngine.apply(sandbox, diff.patches());
            if (!trial.conflicts().isEmpty()) {
                return new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.REJECTED,
                        trial.conflicts().get(0).reason());
            }
            if (trial.applied().isEmpty()) {
                return new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.ALREADY_APPLIED, "");
            }
            VerifyReport report = verifier.verify(sandbox, registry, trial.touchedFilesByTf(), List.of());
            if (report.passed()) {
                return new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.ACCEPTED, "");
            }
            String failure = report.summary();
            ledger.record(root, new Waiver(diff.tfId(), scopeOf(diff),
                    now.plus(properties.getBridge().getWaiverTtl()),
                    "agent diff " + diff.source() + " failed verification: " + failure, change.id()));
            return new IngestEntry(diff.source(), diff.tfId(), IngestOutcome.WAIVED, failure);
        } catch (IOException e) {
            throw new LexgateException("Cannot prepare a scratch tree for " + diff.source() + ": " + e.getMessage(), e);
        } finally {
            if (sandbox != null) {
                deleteDirectory(sandbox);
            }
        }
    }

    private static String scopeOf(AgentDiff diff) {
        List<String> files = diff.patches().stream().map(Patch::file).distinct().toList();
        return files.size() == 1 ? files.get(0) : ChangeContext.ANY;
    }

    private Path copyTree(Path root) throws IOException {
        Path sandbox = Files.createTempDirectory("lexgate-ingest-");
        for (String file : walker.files(root)) {
            Path target = sandbox.resolve(file);
            Files.createDirectories(target.getParent());
            Files.copy(root.resolve(file), target);
        }
        return sandbox;
    }

    private static void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not remove scratch tree {}: {}", dir, e.getMessage());
        }
    }
}
