package com.lexgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: lexgate waiver add|list
 */
@Command(name = "waiver", mixinStandardHelpOptions = true,
        description = "Record and inspect waivers",
        subcommands = {WaiverAddCommand.class, WaiverListCommand.class})
@Component
public class WaiverCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: add or list");
    }
}
