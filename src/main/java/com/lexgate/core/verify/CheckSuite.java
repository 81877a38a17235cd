package com.lexgate.core.verify;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * The external style, type and test checks run against a tree after patching.
 */
public interface CheckSuite {

    /**
     * Runs the checks in order inside {@code tree}, stopping at the first that does not pass.
     *
     * @param timeout budget for each check
     */
    List<CheckOutcome> run(Path tree, Duration timeout);
}
