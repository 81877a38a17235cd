package com.lexgate.core.model;

import java.util.List;

/**
 * A line-level edit to one file. Pure data; the apply engine decides whether it still fits.
 *
 * @param findingKey the finding this patch repairs, or null for diffs ingested from reviewers
 * @param baseSha256 hash of the content the patch was computed from, or null when unknown
 */
public record Patch(
        String tfId,
        PrecedenceTier tier,
        FindingKey findingKey,
        String file,
        String baseSha256,
        List<Hunk> hunks
) {

    public Patch {
        if (hunks == null || hunks.isEmpty()) {
            throw new IllegalArgumentException("Patch for " + file + " has no hunks");
        }
        hunks = List.copyOf(hunks);
    }

    public int startLine() {
        return hunks.get(0).startLine();
    }

    public int endLine() {
        return hunks.get(hunks.size() - 1).endLine();
    }

    /** Tier used for ordering; patches without one rank after every tier. */
    public int tierRank() {
        return tier == null ? Integer.MAX_VALUE : tier.rank();
    }
}
