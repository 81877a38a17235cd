package com.lexgate.dispatch.cli;

/**
 * Process exit statuses shared by every subcommand.
 */
final class ExitCodes {

    /** Stage completed; for {@code gate} and {@code run}, the gate passed. */
    static final int OK = 0;
    /** Gate or verification failed. */
    static final int FAILED = 1;
    /** Stage could not complete: registry errors, unreadable inputs. */
    static final int FATAL = 2;

    private ExitCodes() {}
}
