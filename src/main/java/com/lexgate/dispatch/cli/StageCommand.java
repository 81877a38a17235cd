package com.lexgate.dispatch.cli;

import com.lexgate.core.LexgateException;
import com.lexgate.core.registry.RegistryException;
import com.lexgate.core.registry.SchemaViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Base for subcommands that run a pipeline stage. Turns stage-fatal exceptions into one-line
 * errors and exit status 2; the stack trace goes to the debug log only.
 */
abstract class StageCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StageCommand.class);

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (RegistryException e) {
            ConsoleOutput.error(e.getMessage());
            for (SchemaViolation violation : e.getViolations()) {
                ConsoleOutput.error("  " + violation.tfId() + " " + violation.field() + ": "
                        + violation.reason() + " (" + violation.source() + ")");
            }
            log.debug("Registry failure", e);
            return ExitCodes.FATAL;
        } catch (LexgateException e) {
            ConsoleOutput.error(e.getMessage());
            log.debug("Stage failure", e);
            return ExitCodes.FATAL;
        }
    }

    protected abstract int execute();
}
