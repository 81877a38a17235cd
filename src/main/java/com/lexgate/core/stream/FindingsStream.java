package com.lexgate.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexgate.core.LexgateException;
import com.lexgate.core.model.Finding;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The findings stream: JSON Lines, one finding per line, in finding order.
 */
public final class FindingsStream {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private FindingsStream() {}

    public static String render(List<Finding> findings) {
        var sb = new StringBuilder();
        for (Finding finding : findings.stream().sorted(Finding.ORDER).toList()) {
            try {
                sb.append(OBJECT_MAPPER.writeValueAsString(FindingLine.of(finding))).append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return sb.toString();
    }

    public static void write(Path target, List<Finding> findings) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, render(findings), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LexgateException("Cannot write findings to " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a findings stream. Blank lines are skipped.
     *
     * @throws LexgateException naming the first line that is not a valid finding
     */
    public static List<Finding> parse(String text) {
        var findings = new ArrayList<Finding>();
        String[] lines = text.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            try {
                findings.add(OBJECT_MAPPER.readValue(line, FindingLine.class).toFinding());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new LexgateException("Invalid finding on line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return findings;
    }

    public static List<Finding> read(Path source) {
        try {
            return parse(Files.readString(source, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LexgateException("Cannot read findings from " + source + ": " + e.getMessage(), e);
        }
    }
}
