package com.lexgate.core.verify;

import com.lexgate.core.LexgateException;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.detect.SourceUnit;
import com.lexgate.core.model.AcceptancePredicate;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.DetectorException;
import com.lexgate.core.scanner.RunContext;
import com.lexgate.core.scanner.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Checks a patched tree: the external check suite first, then each applied task function's
 * acceptance predicates over the files it touched.
 * <p>
 * A predicate failure is downgraded to {@link VerifyStatus#WAIVED} when an active waiver for
 * the function covers one of its touched files.
 */
@Service
public class Verifier {

    private static final Logger log = LoggerFactory.getLogger(Verifier.class);

    private final CheckSuite checkSuite;
    private final TreeScanner scanner;
    private final LexgateProperties properties;

    public Verifier(CheckSuite checkSuite, TreeScanner scanner, LexgateProperties properties) {
        this.checkSuite = checkSuite;
        this.scanner = scanner;
        this.properties = properties;
    }

    public VerifyReport verify(Path tree, TfRegistry registry,
                               Map<String, ? extends Collection<String>> touchedByTf,
                               Collection<Waiver> activeWaivers) {
        return verify(tree, registry, touchedByTf, activeWaivers, properties.getVerify().getTimeout());
    }

    /**
     * @param touchedByTf files each applied task function rewrote
     * @param timeout     budget for each external check
     */
    public VerifyReport verify(Path tree, TfRegistry registry,
                               Map<String, ? extends Collection<String>> touchedByTf,
                               Collection<Waiver> activeWaivers, Duration timeout) {
        List<CheckOutcome> checks = checkSuite.run(tree, timeout);
        VerifyStatus suite = suiteStatus(checks);

        var context = new RunContext("verify", tree);
        var verdicts = new ArrayList<TfVerdict>();
        for (var entry : new TreeMap<>(touchedByTf).entrySet()) {
            String tfId = entry.getKey();
            List<String> files = entry.getValue().stream().sorted().distinct().toList();
            Optional<TaskFunction> tf = registry.find(tfId);
            List<AcceptancePredicate> predicates = tf.map(TaskFunction::verify)
                    .orElse(List.of(AcceptancePredicate.PARSES));

            var failures = new ArrayList<String>();
            for (String file : files) {
                for (AcceptancePredicate predicate : predicates) {
                    check(context, tf.orElse(null), predicate, file).ifPresent(failures::add);
                }
            }

            VerifyStatus status;
            if (failures.isEmpty()) {
                status = VerifyStatus.PASS;
            } else if (isWaived(tfId, files, activeWaivers)) {
                log.info("{} failed verification but is waived: {}", tfId, failures.get(0));
                status = VerifyStatus.WAIVED;
            } else {
                log.warn("{} failed verification: {}", tfId, failures.get(0));
                status = VerifyStatus.FAIL;
            }
            verdicts.add(new TfVerdict(tfId, status, files, failures));
        }

        var report = new VerifyReport(suite, checks, verdicts);
        log.info("Verification {}: suite {}, {} TF verdict(s)", report.passed() ? "passed" : "failed",
                suite, verdicts.size());
        return report;
    }

    static VerifyStatus suiteStatus(List<CheckOutcome> checks) {
        if (checks.stream().anyMatch(c -> c.status() == VerifyStatus.TIMEOUT)) {
            return VerifyStatus.TIMEOUT;
        }
        if (checks.stream().anyMatch(c -> c.status() == VerifyStatus.FAIL)) {
            return VerifyStatus.FAIL;
        }
        return VerifyStatus.PASS;
    }

    private Optional<String> check(RunContext context, TaskFunction tf, AcceptancePredicate predicate, String file) {
        if (predicate == AcceptancePredicate.PARSES) {
            try {
                SourceUnit unit = context.unit(file);
                return unit.parses()
                        ? Optional.empty()
                        : Optional.of(file + " no longer parses: " + unit.parseProblem());
            } catch (LexgateException e) {
                return Optional.of(e.getMessage());
            }
        }
        if (tf == null) {
            return Optional.empty();
        }
        List<Finding> findings;
        try {
            findings = scanner.findingsFor(context, tf, file);
        } catch (DetectorException e) {
            return Optional.of(file + ": " + e.getMessage());
        }
        long remaining = predicate == AcceptancePredicate.FIXED_POINT
                ? findings.stream().filter(Finding::resolved).count()
                : findings.size();
        if (remaining == 0) {
            return Optional.empty();
        }
        return Optional.of(file + ": " + remaining + " finding(s) remain after patching ("
                + predicate.wireName() + ")");
    }

    private static boolean isWaived(String tfId, List<String> files, Collection<Waiver> activeWaivers) {
        return activeWaivers.stream()
                .anyMatch(w -> w.tfId().equals(tfId) && files.stream().anyMatch(w::covers));
    }
}
