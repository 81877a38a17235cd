package com.lexgate.core.bridge;

public enum IngestOutcome {
    /** Verified in isolation and applied to the tree. */
    ACCEPTED,
    /** Every hunk was already in place; nothing written. */
    ALREADY_APPLIED,
    /** Failed verification; a time-bound waiver was recorded instead. */
    WAIVED,
    /** Could not be parsed or applied at all; nothing recorded. */
    REJECTED
}
