package com.lexgate.core.verify;

public enum VerifyStatus {
    PASS,
    FAIL,
    /** The check did not finish within the caller's budget. Never conflated with FAIL. */
    TIMEOUT,
    /** A task function's failure downgraded by an active waiver. */
    WAIVED
}
