package com.lexgate.core.propose;

public enum ProposalOutcome {
    /** A patch within the allowed transforms was computed. */
    RESOLVED,
    /** The decision rule needs information only a reviewer has. */
    AMBIGUOUS,
    /** The finding no longer applies to the current tree or registry. */
    REJECTED
}
