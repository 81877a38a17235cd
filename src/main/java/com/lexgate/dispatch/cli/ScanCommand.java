package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.Finding;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.DetectorFailure;
import com.lexgate.core.scanner.ScanResult;
import com.lexgate.core.stream.FindingsStream;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * CLI command: lexgate scan
 * <p>
 * Runs every active task function over the tree and reports the findings, optionally
 * writing them as a findings stream.
 */
@Command(name = "scan", mixinStandardHelpOptions = true, description = "Scan the tree for task function findings")
@Component
public class ScanCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Option(names = {"--out", "-o"}, description = "Write the findings stream (JSON Lines) to this file")
    Path out;

    @Option(names = "--json", description = "Print the findings stream instead of a summary")
    boolean json;

    private final PolicyEngine engine;

    public ScanCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        Path root = tree.root();
        TfRegistry registry = engine.loadRegistry(root);
        ScanResult scan = engine.scan(root, registry);

        if (json) {
            System.out.print(FindingsStream.render(scan.findings()));
        } else {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Scanned " + scan.filesScanned() + " files with "
                    + registry.active().size() + " active task functions");
            scan.findings().forEach(ConsoleOutput::finding);
            for (DetectorFailure failure : scan.failures()) {
                ConsoleOutput.warn(failure.tfId() + " " + failure.file() + ": " + failure.reason());
            }
            long fixable = scan.findings().stream().filter(Finding::resolved).count();
            ConsoleOutput.info(scan.findings().size() + " finding(s), " + fixable + " fixable, "
                    + scan.failures().size() + " detector failure(s)");
        }
        if (out != null) {
            FindingsStream.write(out, scan.findings());
            if (!json) {
                ConsoleOutput.success("Findings written to " + out);
            }
        }
        return ExitCodes.OK;
    }
}
