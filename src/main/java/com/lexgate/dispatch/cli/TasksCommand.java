package com.lexgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: lexgate tasks emit|ingest
 */
@Command(name = "tasks", mixinStandardHelpOptions = true,
        description = "Exchange work with external reviewers",
        subcommands = {TasksEmitCommand.class, TasksIngestCommand.class})
@Component
public class TasksCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: emit or ingest");
    }
}
