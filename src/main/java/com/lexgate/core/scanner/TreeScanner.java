package com.lexgate.core.scanner;

import com.lexgate.core.LexgateException;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.detect.DecisionRules;
import com.lexgate.core.detect.Detection;
import com.lexgate.core.detect.DetectionStrategy;
import com.lexgate.core.detect.SourceUnit;
import com.lexgate.core.detect.StrategyRegistry;
import com.lexgate.core.logging.MdcContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.FindingKey;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.registry.TfRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs every active task function's detector over the files its footprint covers.
 * <p>
 * Files are examined on a fixed worker pool; results are re-sorted by
 * (file, line, column, TF id) and deduplicated by finding key before they leave the stage.
 * A file one detector cannot handle is recorded as a {@link DetectorFailure} and the scan
 * moves on.
 */
@Service
public class TreeScanner {

    private static final Logger log = LoggerFactory.getLogger(TreeScanner.class);

    private final StrategyRegistry strategies;
    private final TreeWalker walker;
    private final LexgateProperties properties;

    public TreeScanner(StrategyRegistry strategies, TreeWalker walker, LexgateProperties properties) {
        this.strategies = strategies;
        this.walker = walker;
        this.properties = properties;
    }

    public ScanResult scan(RunContext context, TfRegistry registry) {
        List<String> files;
        try {
            files = walker.files(context.root());
        } catch (IOException e) {
            throw new LexgateException("Cannot walk " + context.root() + ": " + e.getMessage(), e);
        }
        return scan(context, registry, files);
    }

    /**
     * Scans the given tree-relative files only.
     */
    public ScanResult scan(RunContext context, TfRegistry registry, List<String> files) {
        List<TaskFunction> active = registry.active();
        Queue<Finding> findings = new ConcurrentLinkedQueue<>();
        Queue<DetectorFailure> failures = new ConcurrentLinkedQueue<>();

        int parallelism = Math.max(1, properties.getScan().getParallelism());
        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try {
            var futures = files.stream()
                    .map(file -> CompletableFuture.runAsync(
                            () -> scanFile(context, active, file, findings, failures), pool))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException e) {
            throw new LexgateException("Scan aborted: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }

        var unique = new LinkedHashMap<FindingKey, Finding>();
        findings.stream().sorted(Finding.ORDER).forEach(f -> unique.putIfAbsent(f.key(), f));
        var sortedFailures = failures.stream()
                .sorted(Comparator.comparing(DetectorFailure::file).thenComparing(DetectorFailure::tfId))
                .toList();

        log.info("Scanned {} file(s): {} finding(s), {} detector failure(s)",
                files.size(), unique.size(), sortedFailures.size());
        return new ScanResult(new ArrayList<>(unique.values()), sortedFailures, files.size());
    }

    /**
     * Findings of one task function in one file.
     *
     * @throws DetectorException if the file cannot be read or parsed, or the detector fails
     */
    public List<Finding> findingsFor(RunContext context, TaskFunction tf, String file) {
        return detectionsFor(context, tf, file).stream()
                .map(d -> toFinding(tf, file, d))
                .sorted(Finding.ORDER)
                .toList();
    }

    /**
     * Raw detections of one task function in one file, cached per run.
     *
     * @throws DetectorException if the file cannot be read or parsed, or the detector fails
     */
    public List<Detection> detectionsFor(RunContext context, TaskFunction tf, String file) {
        DetectionStrategy strategy = strategies.strategyFor(tf.kind());
        SourceUnit unit;
        try {
            unit = context.unit(file);
        } catch (LexgateException e) {
            throw new DetectorException(e.getMessage(), e);
        }
        if (strategy.requiresParse() && !unit.parses()) {
            throw new DetectorException("unparseable: " + unit.parseProblem() + " at " + unit.problemSpan());
        }
        try {
            return context.detections(tf.id(), file, () -> strategy.detect(unit, tf.detector()));
        } catch (RuntimeException e) {
            throw new DetectorException(tf.kind() + " failed: " + e.getMessage(), e);
        }
    }

    private void scanFile(RunContext context, List<TaskFunction> active, String file,
                          Queue<Finding> findings, Queue<DetectorFailure> failures) {
        for (TaskFunction tf : active) {
            MdcContext.setFile(context.runId(), tf.id(), file);
            try {
                if (covers(tf, file)) {
                    findings.addAll(findingsFor(context, tf, file));
                }
            } catch (DetectorException e) {
                log.warn("{} skipped {}: {}", tf.id(), file, e.getMessage());
                log.debug("Detector failure detail", e);
                failures.add(new DetectorFailure(tf.id(), file, e.getMessage()));
            } finally {
                MdcContext.clearFile();
            }
        }
    }

    private static boolean covers(TaskFunction tf, String file) {
        try {
            return tf.footprint().covers(file);
        } catch (IllegalArgumentException e) {
            throw new DetectorException("invalid footprint glob: " + e.getMessage().lines().findFirst().orElse(""), e);
        }
    }

    private static Finding toFinding(TaskFunction tf, String file, Detection detection) {
        return new Finding(
                tf.id(),
                tf.tier(),
                file,
                detection.span(),
                tf.confidence(),
                detection.message(),
                detection.frame(),
                detection.hints(),
                DecisionRules.resolves(tf, detection));
    }
}
