package com.lexgate.core.bridge;

import com.lexgate.core.apply.ApplyResult;

import java.util.List;

/**
 * Outcome of an ingest batch.
 *
 * @param applied what the accepted diffs did to the real tree
 */
public record IngestResult(List<IngestEntry> entries, ApplyResult applied) {

    public IngestResult {
        entries = List.copyOf(entries);
    }

    public long accepted() {
        return count(IngestOutcome.ACCEPTED);
    }

    public long alreadyApplied() {
        return count(IngestOutcome.ALREADY_APPLIED);
    }

    public long waived() {
        return count(IngestOutcome.WAIVED);
    }

    public long rejected() {
        return count(IngestOutcome.REJECTED);
    }

    private long count(IngestOutcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }
}
