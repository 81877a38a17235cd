package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.stream.FindingsStream;
import com.lexgate.core.stream.GateReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: lexgate gate
 * <p>
 * Decides whether the change may merge. Findings come from a findings stream when one is
 * given, otherwise from a fresh scan. Exits 1 when unwaived gating findings remain.
 */
@Command(name = "gate", mixinStandardHelpOptions = true, description = "Gate a change on unresolved findings")
@Component
public class GateCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Mixin
    ChangeOptions change;

    @Option(names = "--findings", description = "Findings stream (JSON Lines) to gate on (default: scan the tree)")
    Path findingsFile;

    @Option(names = "--report", description = "Write the gate report (JSON) to this file")
    Path report;

    private final PolicyEngine engine;

    public GateCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        List<Finding> findings = findingsFile != null
                ? FindingsStream.read(findingsFile)
                : engine.scan(root, engine.loadRegistry(root)).findings();
        ChangeContext context = change.change(() -> engine.treeFiles(root));
        GateDecision decision = engine.gate(root, findings, context, change.now());
        ConsoleOutput.gate(decision);
        if (report != null) {
            GateReport.of(context.id(), decision).write(report);
            ConsoleOutput.info("Gate report written to " + report);
        }
        return decision.passed() ? ExitCodes.OK : ExitCodes.FAILED;
    }
}
