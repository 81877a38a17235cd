package com.lexgate.dispatch.cli;

import com.lexgate.core.model.Waiver;
import com.lexgate.core.waiver.WaiverDocument;
import com.lexgate.core.waiver.WaiverLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Instant;

/**
 * CLI command: lexgate waiver list
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List the waivers declared for a change context")
@Component
public class WaiverListCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Option(names = "--context", defaultValue = "*", description = "Change context id (default: any context)")
    String context;

    @Option(names = "--now", description = "Instant expiry is judged against, ISO-8601 (default: current time)")
    Instant now;

    private final WaiverLedger ledger;

    public WaiverListCommand(WaiverLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    protected int execute() {
        Instant at = now != null ? now : Instant.now();
        WaiverDocument document = ledger.load(tree.root(), context);
        for (Waiver waiver : document.waivers()) {
            String line = waiver.toLine();
            if (waiver.isExpired(at)) {
                ConsoleOutput.info("(expired) " + line);
            } else {
                System.out.println(line);
            }
        }
        document.warnings().forEach(ConsoleOutput::warn);
        ConsoleOutput.info(document.waivers().size() + " waiver(s), " + document.warnings().size() + " warning(s)");
        return ExitCodes.OK;
    }
}
