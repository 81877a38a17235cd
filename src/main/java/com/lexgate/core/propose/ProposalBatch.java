package com.lexgate.core.propose;

import com.lexgate.core.model.Patch;

import java.util.List;

/**
 * Proposals for a whole finding stream, split by outcome. Order follows the findings.
 */
public record ProposalBatch(List<Patch> patches, List<Proposal> ambiguous, List<Proposal> rejected) {

    public ProposalBatch {
        patches = List.copyOf(patches);
        ambiguous = List.copyOf(ambiguous);
        rejected = List.copyOf(rejected);
    }
}
