package com.lexgate.core.stream;

import com.lexgate.core.LexgateException;
import com.lexgate.core.apply.UnifiedDiff;
import com.lexgate.core.model.Patch;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The patch stream on disk: unified diff blocks, each preceded by its {@code # tf_id} header.
 */
public final class PatchStream {

    private PatchStream() {}

    public static void write(Path target, List<Patch> patches) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, UnifiedDiff.renderAll(patches), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LexgateException("Cannot write patches to " + target + ": " + e.getMessage(), e);
        }
    }

    public static List<Patch> read(Path source) {
        try {
            return UnifiedDiff.parse(Files.readString(source, StandardCharsets.UTF_8), null);
        } catch (IOException e) {
            throw new LexgateException("Cannot read patches from " + source + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new LexgateException("Malformed patch stream " + source + ": " + e.getMessage(), e);
        }
    }
}
