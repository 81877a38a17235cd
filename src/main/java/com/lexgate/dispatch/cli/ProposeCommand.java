package com.lexgate.dispatch.cli;

import com.lexgate.core.apply.UnifiedDiff;
import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.propose.Proposal;
import com.lexgate.core.propose.ProposalBatch;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.stream.PatchStream;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: lexgate propose
 * <p>
 * Dry run: prints the patch stream the engine would apply, and the findings it would hand
 * to a reviewer, without touching the tree.
 */
@Command(name = "propose", mixinStandardHelpOptions = true, description = "Show the patches the engine would apply")
@Component
public class ProposeCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Option(names = {"--out", "-o"}, description = "Write the patch stream to this file instead of stdout")
    Path out;

    private final PolicyEngine engine;

    public ProposeCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        Path root = tree.root();
        TfRegistry registry = engine.loadRegistry(root);
        ProposalBatch batch = engine.propose(root, registry);

        if (out != null) {
            PatchStream.write(out, batch.patches());
            ConsoleOutput.success(batch.patches().size() + " patch(es) written to " + out);
        } else {
            System.out.print(UnifiedDiff.renderAll(batch.patches()));
        }
        for (Proposal p : batch.ambiguous()) {
            ConsoleOutput.warn("ambiguous " + p.finding().tfId() + " " + p.finding().file() + ":"
                    + p.finding().line() + ": " + p.reason());
        }
        for (Proposal p : batch.rejected()) {
            ConsoleOutput.error("rejected " + p.finding().tfId() + " " + p.finding().file() + ":"
                    + p.finding().line() + ": " + p.reason());
        }
        return ExitCodes.OK;
    }
}
