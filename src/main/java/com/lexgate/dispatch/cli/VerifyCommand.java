package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.verify.VerifyReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: lexgate verify
 * <p>
 * Runs the configured check suite and the acceptance predicates of the selected task
 * functions over the changed files.
 */
@Command(name = "verify", mixinStandardHelpOptions = true, description = "Run the check suite and acceptance predicates")
@Component
public class VerifyCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Mixin
    ChangeOptions change;

    @Option(names = "--tf", description = "Task function to check; repeatable (default: every active one)")
    List<String> tfIds = new ArrayList<>();

    private final PolicyEngine engine;

    public VerifyCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        TfRegistry registry = engine.loadRegistry(root);
        ChangeContext context = change.change(() -> engine.treeFiles(root));
        VerifyReport report = engine.verify(root, registry, tfIds, context.changedFiles(), context, change.now());
        ConsoleOutput.verifyReport(report);
        return report.passed() ? ExitCodes.OK : ExitCodes.FAILED;
    }
}
