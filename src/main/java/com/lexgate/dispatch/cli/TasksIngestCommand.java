package com.lexgate.dispatch.cli;

import com.lexgate.core.bridge.IngestEntry;
import com.lexgate.core.bridge.IngestResult;
import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.ChangeContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: lexgate tasks ingest --from &lt;dir&gt;
 * <p>
 * Verifies reviewer diffs in isolation and applies the ones that pass; the others are
 * waived for the change context.
 */
@Command(name = "ingest", mixinStandardHelpOptions = true, description = "Verify and apply reviewer diffs")
@Component
public class TasksIngestCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Mixin
    ChangeOptions change;

    @Option(names = "--from", required = true, description = "Directory holding *.diff / *.patch files")
    Path from;

    private final PolicyEngine engine;

    public TasksIngestCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        ChangeContext context = change.change(() -> engine.treeFiles(root));
        IngestResult result = engine.ingest(root, from, engine.loadRegistry(root), context, change.now());
        for (IngestEntry entry : result.entries()) {
            String label = entry.source() + " (" + entry.tfId() + ")";
            switch (entry.outcome()) {
                case ACCEPTED -> ConsoleOutput.success(label + " accepted");
                case ALREADY_APPLIED -> ConsoleOutput.info(label + " already applied");
                case WAIVED -> ConsoleOutput.warn(label + " waived: " + entry.detail());
                case REJECTED -> ConsoleOutput.error(label + " rejected: " + entry.detail());
            }
        }
        ConsoleOutput.info(result.accepted() + " accepted, " + result.alreadyApplied() + " already applied, "
                + result.waived() + " waived, " + result.rejected() + " rejected");
        return ExitCodes.OK;
    }
}
