package com.lexgate.core.propose;

import com.lexgate.core.detect.DecisionRules;
import com.lexgate.core.detect.Detection;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.Patch;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.DetectorException;
import com.lexgate.core.scanner.RunContext;
import com.lexgate.core.scanner.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides, for each finding, whether the engine can patch it on its own.
 * <p>
 * The decision is re-derived from the run's cached syntax tree, so a finding that no longer
 * reproduces against the tree is rejected rather than patched blindly. Edits outside the
 * function's allowed transforms are never produced.
 */
@Service
public class Proposer {

    private static final Logger log = LoggerFactory.getLogger(Proposer.class);

    private final TreeScanner scanner;

    public Proposer(TreeScanner scanner) {
        this.scanner = scanner;
    }

    public Proposal propose(RunContext context, TfRegistry registry, Finding finding) {
        Optional<TaskFunction> tf = registry.find(finding.tfId()).filter(TaskFunction::isActive);
        if (tf.isEmpty()) {
            return Proposal.rejected(finding, "TF " + finding.tfId() + " is unknown or not active");
        }

        List<Detection> detections;
        try {
            detections = scanner.detectionsFor(context, tf.get(), finding.file());
        } catch (DetectorException e) {
            return Proposal.rejected(finding, e.getMessage());
        }
        Optional<Detection> current = detections.stream()
                .filter(d -> d.span().equals(finding.span()))
                .findFirst();
        if (current.isEmpty()) {
            return Proposal.rejected(finding, "finding no longer reproduces at " + finding.file() + ":" + finding.span());
        }

        Optional<String> ambiguity = DecisionRules.ambiguity(tf.get(), current.get());
        if (ambiguity.isPresent()) {
            return Proposal.ambiguous(finding, ambiguity.get());
        }
        try {
            return Proposal.resolved(finding,
                    PatchBuilder.build(context.unit(finding.file()), tf.get(), finding.key(), current.get().edits()));
        } catch (IllegalArgumentException e) {
            return Proposal.rejected(finding, e.getMessage());
        }
    }

    /**
     * Proposes for every finding without touching the tree.
     */
    public ProposalBatch proposeAll(RunContext context, TfRegistry registry, List<Finding> findings) {
        var patches = new ArrayList<Patch>();
        var ambiguous = new ArrayList<Proposal>();
        var rejected = new ArrayList<Proposal>();
        for (Finding finding : findings) {
            Proposal proposal = propose(context, registry, finding);
            switch (proposal.outcome()) {
                case RESOLVED -> patches.add(proposal.patch());
                case AMBIGUOUS -> ambiguous.add(proposal);
                case REJECTED -> {
                    log.warn("Rejected {}: {}", finding.key(), proposal.reason());
                    rejected.add(proposal);
                }
            }
        }
        log.info("Proposed {} patch(es), {} ambiguous, {} rejected", patches.size(), ambiguous.size(), rejected.size());
        return new ProposalBatch(patches, ambiguous, rejected);
    }
}
