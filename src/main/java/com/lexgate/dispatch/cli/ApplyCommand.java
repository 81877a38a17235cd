package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.engine.RunReport;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.registry.TfRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.nio.file.Path;

/**
 * CLI command: lexgate apply
 * <p>
 * Scans, applies every resolvable patch, emits task packets for the rest and verifies the
 * patched tree.
 */
@Command(name = "apply", mixinStandardHelpOptions = true, description = "Apply resolvable patches and verify them")
@Component
public class ApplyCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Mixin
    ChangeOptions change;

    private final PolicyEngine engine;

    public ApplyCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        TfRegistry registry = engine.loadRegistry(root);
        ChangeContext context = change.change(() -> engine.treeFiles(root));
        RunReport report = engine.apply(root, registry, context, change.now());
        printRepair(report);
        return ExitCodes.OK;
    }

    static void printRepair(RunReport report) {
        ConsoleOutput.info("Run " + report.runId() + ": " + report.scan().findings().size() + " finding(s), "
                + report.proposals().patches().size() + " patch(es) proposed");
        report.applied().changedFiles().forEach(f -> ConsoleOutput.success("patched " + f));
        report.applied().conflicts().forEach(ConsoleOutput::conflict);
        if (!report.applied().alreadyApplied().isEmpty()) {
            ConsoleOutput.info(report.applied().alreadyApplied().size() + " patch(es) already applied");
        }
        if (!report.tasks().isEmpty()) {
            ConsoleOutput.info(report.tasks().size() + " task packet(s) emitted for review");
        }
        ConsoleOutput.verifyReport(report.verify());
    }
}
