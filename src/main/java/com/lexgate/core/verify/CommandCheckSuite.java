package com.lexgate.core.verify;

import com.lexgate.core.config.LexgateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the commands configured under {@code lexgate.verify.commands} as child processes.
 * <p>
 * Output goes to a temporary file rather than a pipe so a chatty process can never block
 * the timeout.
 */
@Component
public class CommandCheckSuite implements CheckSuite {

    private static final Logger log = LoggerFactory.getLogger(CommandCheckSuite.class);
    private static final int OUTPUT_TAIL_CHARS = 4000;

    private final LexgateProperties properties;

    public CommandCheckSuite(LexgateProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<CheckOutcome> run(Path tree, Duration timeout) {
        var outcomes = new ArrayList<CheckOutcome>();
        for (LexgateProperties.CheckCommand command : properties.getVerify().getCommands()) {
            CheckOutcome outcome = runOne(tree, command, timeout);
            outcomes.add(outcome);
            if (outcome.status() != VerifyStatus.PASS) {
                log.info("Check '{}' ended {}, skipping remaining checks", command.getName(), outcome.status());
                break;
            }
        }
        return outcomes;
    }

    CheckOutcome runOne(Path tree, LexgateProperties.CheckCommand command, Duration timeout) {
        String name = command.getName() != null ? command.getName() : String.join(" ", command.getArgv());
        log.debug("Running check '{}': {}", name, command.getArgv());
        long started = System.nanoTime();

        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("lexgate-check-", ".log");
            process = new ProcessBuilder(command.getArgv())
                    .directory(tree.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Check '{}' timed out after {}", name, timeout);
                return new CheckOutcome(name, VerifyStatus.TIMEOUT, -1, tail(output), elapsed(started));
            }
            int exitCode = process.exitValue();
            return new CheckOutcome(name, exitCode == 0 ? VerifyStatus.PASS : VerifyStatus.FAIL,
                    exitCode, tail(output), elapsed(started));
        } catch (IOException e) {
            log.warn("Check '{}' could not start: {}", name, e.getMessage());
            return new CheckOutcome(name, VerifyStatus.FAIL, -1, "cannot run: " + e.getMessage(), elapsed(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new CheckOutcome(name, VerifyStatus.FAIL, -1, "interrupted", elapsed(started));
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Could not delete check output {}", output, e);
                }
            }
        }
    }

    private static String tail(Path output) {
        try {
            // check output is not guaranteed to be UTF-8; undecodable bytes become U+FFFD
            String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            return text.length() <= OUTPUT_TAIL_CHARS ? text : text.substring(text.length() - OUTPUT_TAIL_CHARS);
        } catch (IOException e) {
            log.warn("Cannot read check output {}: {}", output, e.getMessage());
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }

    private static long elapsed(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
