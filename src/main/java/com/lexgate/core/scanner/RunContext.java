package com.lexgate.core.scanner;

import com.lexgate.core.LexgateException;
import com.lexgate.core.detect.Detection;
import com.lexgate.core.detect.SourceUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * State shared by the stages of one run over one tree: parsed units and detections,
 * keyed by tree-relative path. Discarded when the run ends.
 */
public class RunContext {

    private final String runId;
    private final Path root;
    private final ConcurrentMap<String, SourceUnit> units = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Detection>> detections = new ConcurrentHashMap<>();

    public RunContext(String runId, Path root) {
        this.runId = runId;
        this.root = root.toAbsolutePath().normalize();
    }

    public String runId() {
        return runId;
    }

    public Path root() {
        return root;
    }

    public Path resolve(String file) {
        return root.resolve(file);
    }

    /**
     * Returns the parsed unit for {@code file}, reading it on first use.
     *
     * @throws LexgateException if the file cannot be read as UTF-8
     */
    public SourceUnit unit(String file) {
        return units.computeIfAbsent(file, f -> {
            try {
                return SourceUnit.parse(f, Files.readString(root.resolve(f), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new LexgateException("Cannot read " + f + ": " + e.getMessage(), e);
            }
        });
    }

    public List<Detection> detections(String tfId, String file, Supplier<List<Detection>> detector) {
        return detections.computeIfAbsent(tfId + '\u0000' + file, k -> List.copyOf(detector.get()));
    }

    /** Drops cached state for a file whose content changed on disk. */
    public void invalidate(String file) {
        units.remove(file);
        detections.keySet().removeIf(k -> k.endsWith('\u0000' + file));
    }
}
