package com.lexgate.core.verify;

import java.util.List;

/**
 * Verification of one tree. Suite failures ("the build is broken") and task function
 * failures ("this patch regressed") are kept apart.
 */
public record VerifyReport(VerifyStatus suiteStatus, List<CheckOutcome> checks, List<TfVerdict> verdicts) {

    public VerifyReport {
        checks = List.copyOf(checks);
        verdicts = List.copyOf(verdicts);
    }

    public boolean passed() {
        return suiteStatus == VerifyStatus.PASS
                && verdicts.stream().noneMatch(v -> v.status() == VerifyStatus.FAIL);
    }

    public List<TfVerdict> failedVerdicts() {
        return verdicts.stream().filter(v -> v.status() == VerifyStatus.FAIL).toList();
    }

    /** One-line summary naming the first failure, for logs and waiver rationales. */
    public String summary() {
        if (passed()) {
            return "verification passed";
        }
        if (suiteStatus != VerifyStatus.PASS) {
            return checks.stream()
                    .filter(c -> c.status() != VerifyStatus.PASS)
                    .findFirst()
                    .map(c -> "check '" + c.name() + "' " + c.status())
                    .orElse("check suite " + suiteStatus);
        }
        TfVerdict first = failedVerdicts().get(0);
        return first.tfId() + ": " + String.join("; ", first.failures());
    }
}
