package com.lexgate.core.bridge;

/**
 * What happened to one ingested diff.
 *
 * @param detail one-line reason, empty for accepted diffs
 */
public record IngestEntry(String source, String tfId, IngestOutcome outcome, String detail) {
}
