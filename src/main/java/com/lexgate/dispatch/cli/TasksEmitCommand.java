package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.TaskPacket;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: lexgate tasks emit
 * <p>
 * Writes one task packet per finding the engine cannot patch on its own.
 */
@Command(name = "emit", mixinStandardHelpOptions = true, description = "Write task packets for ambiguous findings")
@Component
public class TasksEmitCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    private final PolicyEngine engine;

    public TasksEmitCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        ConsoleOutput.printBanner();
        Path root = tree.root();
        List<TaskPacket> packets = engine.emitTasks(root, engine.loadRegistry(root));
        for (TaskPacket packet : packets) {
            ConsoleOutput.info(packet.tfId() + " " + packet.file() + ":" + packet.line() + ": " + packet.reason());
        }
        ConsoleOutput.success(packets.size() + " task packet(s) written");
        return ExitCodes.OK;
    }
}
