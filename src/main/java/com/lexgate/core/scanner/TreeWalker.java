package com.lexgate.core.scanner;

import com.lexgate.core.config.LexgateProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lists the regular files of a tree as sorted, {@code /}-separated relative paths.
 * <p>
 * Version-control, build-output and IDE directories ({@code lexgate.scan.ignore-dirs}) are
 * skipped, as are OS metadata files.
 */
@Service
public class TreeWalker {

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(".DS_Store", "Thumbs.db");

    private final LexgateProperties properties;

    public TreeWalker(LexgateProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws IOException if the directory walk fails
     */
    public List<String> files(Path root) throws IOException {
        Set<String> ignoreDirs = Set.copyOf(properties.getScan().getIgnoreDirs());
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(root, p, ignoreDirs))
                    .map(p -> toRelative(root, p))
                    .sorted()
                    .toList();
        }
    }

    static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Returns {@code true} when any component of the path names an ignored directory or file.
     */
    private static boolean shouldIgnore(Path root, Path path, Set<String> ignoreDirs) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (ignoreDirs.contains(name) || IGNORE_FILES.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
