package com.lexgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Lexgate.
 * Each pipeline stage is a subcommand; {@code run} chains them all.
 */
@Command(
        name = "lexgate",
        mixinStandardHelpOptions = true,
        version = "Lexgate 0.1.0",
        description = "Policy-driven static analysis, repair and merge gating for Java source trees",
        subcommands = {
                ScanCommand.class,
                ProposeCommand.class,
                ApplyCommand.class,
                VerifyCommand.class,
                GateCommand.class,
                RunCommand.class,
                TasksCommand.class,
                TfCommand.class,
                WaiverCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LexgateCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
