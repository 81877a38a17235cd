package com.lexgate.dispatch.cli;

import com.lexgate.core.engine.PolicyEngine;
import com.lexgate.core.model.AcceptancePredicate;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.Transform;
import com.lexgate.core.registry.SchemaViolation;
import com.lexgate.core.registry.TfRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CLI command: lexgate tf --list | --explain &lt;id&gt;
 * <p>
 * Renders the task function registry for humans.
 */
@Command(name = "tf", mixinStandardHelpOptions = true, description = "List or explain task functions")
@Component
public class TfCommand extends StageCommand {

    @Mixin
    TreeOptions tree;

    @ArgGroup(exclusive = true, multiplicity = "1")
    Mode mode;

    static class Mode {
        @Option(names = "--list", description = "List every task function with its status and tier")
        boolean list;

        @Option(names = "--explain", paramLabel = "<id>", description = "Show everything known about one task function")
        String explain;
    }

    private final PolicyEngine engine;

    public TfCommand(PolicyEngine engine) {
        this.engine = engine;
    }

    @Override
    protected int execute() {
        TfRegistry registry = engine.loadRegistry(tree.root());
        if (mode.list) {
            list(registry);
            return ExitCodes.OK;
        }
        Optional<TaskFunction> tf = registry.find(mode.explain);
        if (tf.isEmpty()) {
            ConsoleOutput.error("Unknown task function: " + mode.explain);
            return ExitCodes.FATAL;
        }
        explain(tf.get());
        return ExitCodes.OK;
    }

    private static void list(TfRegistry registry) {
        for (TaskFunction tf : registry.all()) {
            System.out.printf("%-8s %-3s %-8s %-14s %s%n", tf.id(), tf.tier(), tf.status().wireName(),
                    tf.kind(), tf.name());
        }
        for (SchemaViolation violation : registry.violations()) {
            ConsoleOutput.warn(violation.tfId() + " " + violation.field() + ": " + violation.reason());
        }
    }

    private static void explain(TaskFunction tf) {
        System.out.println(tf.id() + "  " + tf.name());
        System.out.println("  status:      " + tf.status().wireName());
        System.out.println("  tier:        " + tf.tier());
        System.out.println("  confidence:  " + tf.confidence());
        System.out.println("  detector:    " + tf.kind() + " " + tf.detector().params());
        System.out.println("  transforms:  " + tf.allowedTransforms().stream()
                .map(Transform::wireName).collect(Collectors.joining(", ")));
        System.out.println("  decision:    " + tf.decisionRule().mode().name().toLowerCase()
                + " (min confidence " + tf.decisionRule().minConfidence() + ")");
        if (tf.decisionRule().text() != null && !tf.decisionRule().text().isBlank()) {
            System.out.println("               " + tf.decisionRule().text());
        }
        System.out.println("  footprint:   include " + tf.footprint().include() + ", exclude " + tf.footprint().exclude());
        System.out.println("  verify:      " + tf.verify().stream()
                .map(AcceptancePredicate::wireName).collect(Collectors.joining(", ")));
        if (!tf.signals().isEmpty()) {
            System.out.println("  signals:     " + String.join("; ", tf.signals()));
        }
        if (!tf.hints().isEmpty()) {
            System.out.println("  hints:       " + String.join(", ", tf.hints()));
        }
        if (tf.scope() != null && !tf.scope().isBlank()) {
            System.out.println("  scope:       " + tf.scope());
        }
        System.out.println("  source:      " + tf.source());
    }
}
