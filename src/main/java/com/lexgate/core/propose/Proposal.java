package com.lexgate.core.propose;

import com.lexgate.core.model.Finding;
import com.lexgate.core.model.Patch;

/**
 * What the proposer decided for one finding. {@code patch} is set only for
 * {@link ProposalOutcome#RESOLVED}; {@code reason} only for the other outcomes.
 */
public record Proposal(ProposalOutcome outcome, Finding finding, Patch patch, String reason) {

    public static Proposal resolved(Finding finding, Patch patch) {
        return new Proposal(ProposalOutcome.RESOLVED, finding, patch, null);
    }

    public static Proposal ambiguous(Finding finding, String reason) {
        return new Proposal(ProposalOutcome.AMBIGUOUS, finding, null, reason);
    }

    public static Proposal rejected(Finding finding, String reason) {
        return new Proposal(ProposalOutcome.REJECTED, finding, null, reason);
    }
}
