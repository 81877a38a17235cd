package com.lexgate.dispatch.cli;

import com.lexgate.core.LexgateException;
import com.lexgate.core.model.ChangeContext;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Options describing the change under review: its id, its files and the evaluation instant.
 */
public class ChangeOptions {

    @Option(names = "--context", defaultValue = "*",
            description = "Change context id, e.g. PR-42 (default: any context)")
    String context;

    @Option(names = "--changed", description = "File listing the changed paths, one per line (default: every file)")
    Path changedList;

    @Option(names = "--now", description = "Evaluation instant, ISO-8601 (default: current time)")
    String now;

    Instant now() {
        if (now == null || now.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(now);
        } catch (DateTimeParseException e) {
            throw new LexgateException("Invalid --now value: " + now, e);
        }
    }

    /**
     * @param allFiles every file of the tree, used when no changed-file list is given
     */
    ChangeContext change(Supplier<List<String>> allFiles) {
        if (changedList == null) {
            return ChangeContext.of(context, allFiles.get());
        }
        try {
            return ChangeContext.fromList(context, Files.readString(changedList, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LexgateException("Cannot read changed-file list " + changedList + ": " + e.getMessage(), e);
        }
    }
}
