package com.lexgate.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * The {@code --root} option shared by every subcommand that works on a tree.
 */
public class TreeOptions {

    @Option(names = {"--root", "-r"}, defaultValue = ".",
            description = "Root of the source tree (default: ${DEFAULT-VALUE})")
    Path root;

    Path root() {
        return root.toAbsolutePath().normalize();
    }
}
