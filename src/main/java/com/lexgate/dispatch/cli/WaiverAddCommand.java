package com.lexgate.dispatch.cli;

import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.PathGlob;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.waiver.WaiverDocumentParser;
import com.lexgate.core.waiver.WaiverLedger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Instant;

/**
 * CLI command: lexgate waiver add --tf &lt;id&gt;
 */
@Command(name = "add", mixinStandardHelpOptions = true, description = "Append a waiver to a change context's document")
@Component
public class WaiverAddCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @Option(names = "--tf", required = true, description = "Task function to waive")
    String tfId;

    @Option(names = "--scope", defaultValue = "*", description = "Path glob the waiver covers (default: whole repo)")
    String scope;

    @Option(names = "--expires", description = "Expiry: ISO date or instant (default: never)")
    String expires;

    @Option(names = "--reason", defaultValue = "", description = "Rationale recorded with the waiver")
    String reason;

    @Option(names = "--context", defaultValue = "*", description = "Change context id (default: any context)")
    String context;

    private final WaiverLedger ledger;

    public WaiverAddCommand(WaiverLedger ledger) {
        this.ledger = ledger;
    }

    @Override
    protected int execute() {
        if (!WaiverDocumentParser.isTfId(tfId)) {
            ConsoleOutput.error("Invalid task function id: " + tfId);
            return ExitCodes.FATAL;
        }
        if (!ChangeContext.ANY.equals(scope) && PathGlob.problem(scope).isPresent()) {
            ConsoleOutput.error("Invalid --scope glob '" + scope + "': " + PathGlob.problem(scope).get());
            return ExitCodes.FATAL;
        }
        Instant expiry = null;
        if (expires != null) {
            expiry = WaiverDocumentParser.parseExpiry(expires);
            if (expiry == null) {
                ConsoleOutput.error("Invalid --expires value: " + expires);
                return ExitCodes.FATAL;
            }
        }
        var waiver = new Waiver(tfId, scope, expiry, reason, context);
        ledger.record(tree.root(), waiver);
        ConsoleOutput.success("Waived " + tfId + " for " + (ChangeContext.ANY.equals(context) ? "any context" : context)
                + " in " + ledger.documentFor(tree.root(), context));
        return ExitCodes.OK;
    }
}
