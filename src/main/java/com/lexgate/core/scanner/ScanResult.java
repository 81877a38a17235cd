package com.lexgate.core.scanner;

import com.lexgate.core.model.Finding;

import java.util.List;

/**
 * Ordered, deduplicated findings of one scan plus the files that could not be examined.
 */
public record ScanResult(List<Finding> findings, List<DetectorFailure> failures, int filesScanned) {

    public ScanResult {
        findings = List.copyOf(findings);
        failures = List.copyOf(failures);
    }

    public List<Finding> resolved() {
        return findings.stream().filter(Finding::resolved).toList();
    }

    public List<Finding> unresolved() {
        return findings.stream().filter(f -> !f.resolved()).toList();
    }
}
