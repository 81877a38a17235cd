package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.engine.RunReport;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.stream.FindingsStream;
import com.lexgate.core.stream.GateReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: lexgate run
 * <p>
 * The whole pipeline in one pass: scan, propose, apply, emit, verify, re-scan and gate.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the full pipeline and gate the change")
@Component
public class RunCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Mixin
    ChangeOptions change;

    @Option(names = "--findings-out", description = "Write the post-repair findings stream to this file")
    Path findingsOut;

    @Option(names = "--report", description = "Write the gate report (JSON) to this file")
    Path report;

    private final PolicyEngine engine;

    public RunCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        TfRegistry registry = engine.loadRegistry(root);
        ChangeContext context = change.change(() -> engine.treeFiles(root));
        RunReport run = engine.run(root, registry, context, change.now());

        ApplyCommand.printRepair(run);
        ConsoleOutput.gate(run.gate());
        if (findingsOut != null) {
            FindingsStream.write(findingsOut, run.rescan().findings());
        }
        if (report != null) {
            GateReport.of(context.id(), run.gate()).write(report);
        }
        return run.gate().passed() ? ExitCodes.OK : ExitCodes.FAILED;
    }
}
