package com.lexgate.core.apply;

import com.lexgate.core.LexgateException;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.ContentHash;
import com.lexgate.core.model.Hunk;
import com.lexgate.core.model.Patch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Applies patches to a tree, one file at a time, all-or-nothing per patch.
 * <p>
 * Within a file, patches run in (start line, tier, TF id) order and each is re-validated
 * against the content left by the patches before it. When two patches touch overlapping
 * lines the earlier one wins and the other is reported as a conflict. A file whose content
 * no longer matches a patch's base hash is left alone. Distinct files are processed
 * concurrently; each rewritten file is replaced atomically.
 */
@Service
public class ApplyEngine {

    private static final Logger log = LoggerFactory.getLogger(ApplyEngine.class);

    static final Comparator<Patch> ORDER = Comparator
            .comparingInt(Patch::startLine)
            .thenComparingInt(Patch::tierRank)
            .thenComparing(Patch::tfId)
            .thenComparing(p -> String.valueOf(p.findingKey()));

    private final LexgateProperties properties;

    public ApplyEngine(LexgateProperties properties) {
        this.properties = properties;
    }

    public ApplyResult apply(Path root, List<Patch> patches) {
        Map<String, List<Patch>> byFile = new TreeMap<>();
        for (Patch patch : patches) {
            byFile.computeIfAbsent(patch.file(), k -> new ArrayList<>()).add(patch);
        }
        if (byFile.isEmpty()) {
            return ApplyResult.empty();
        }

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.max(1, Math.min(properties.getScan().getParallelism(), byFile.size())));
        try {
            var futures = new ArrayList<CompletableFuture<ApplyResult>>();
            byFile.forEach((file, filePatches) -> futures.add(
                    CompletableFuture.supplyAsync(() -> applyFile(root, file, filePatches), pool)));
            ApplyResult result = ApplyResult.empty();
            for (var future : futures) {
                result = result.merge(future.join());
            }
            log.info("Applied {} patch(es) to {} file(s), {} conflict(s), {} already applied",
                    result.applied().size(), result.changedFiles().size(),
                    result.conflicts().size(), result.alreadyApplied().size());
            return result;
        } catch (CompletionException e) {
            throw new LexgateException("Apply aborted: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * True when {@code file} is absolute or climbs above the directory it is resolved against.
     */
    public static boolean escapesTree(String file) {
        try {
            Path path = Path.of(file);
            return file.isBlank() || path.isAbsolute() || path.getRoot() != null
                    || path.normalize().startsWith("..");
        } catch (InvalidPathException e) {
            return true;
        }
    }

    private ApplyResult applyFile(Path root, String file, List<Patch> patches) {
        var ordered = patches.stream().sorted(ORDER).toList();
        var applied = new ArrayList<Patch>();
        var conflicts = new ArrayList<ApplyConflict>();
        var already = new ArrayList<Patch>();

        Path base = root.toAbsolutePath().normalize();
        Path path = escapesTree(file) ? base : base.resolve(file).normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            log.warn("Refusing to patch {}: path escapes the tree", file);
            ordered.forEach(p -> conflicts.add(new ApplyConflict(p, "path escapes the tree: " + file)));
            return new ApplyResult(applied, conflicts, already, List.of());
        }
        String content;
        try {
            content = Files.exists(path) ? Files.readString(path, StandardCharsets.UTF_8) : null;
        } catch (IOException e) {
            ordered.forEach(p -> conflicts.add(new ApplyConflict(p, "cannot read file: " + e.getMessage())));
            return new ApplyResult(applied, conflicts, already, List.of());
        }

        String baseSha = ContentHash.sha256(content == null ? "" : content);
        List<String> lines = content == null
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(content.split("\n", -1)));
        var taken = new ArrayList<Patch>();
        int shift = 0;

        for (Patch patch : ordered) {
            if (patch.baseSha256() != null && !patch.baseSha256().equals(baseSha)) {
                if (isPresent(lines, patch, 0)) {
                    already.add(patch);
                } else {
                    conflicts.add(new ApplyConflict(patch, "content drift: " + file + " changed since the patch was computed"));
                }
                continue;
            }
            Patch winner = taken.stream().filter(t -> overlaps(t, patch)).findFirst().orElse(null);
            if (winner != null) {
                conflicts.add(new ApplyConflict(patch, "overlaps patch from " + winner.tfId()
                        + " at line " + winner.startLine()));
                continue;
            }
            if (!matches(lines, patch, shift)) {
                if (isPresent(lines, patch, shift)) {
                    already.add(patch);
                } else {
                    conflicts.add(new ApplyConflict(patch, "hunk at line " + patch.startLine()
                            + " does not match the file content"));
                }
                continue;
            }
            shift += splice(lines, patch, shift);
            taken.add(patch);
            applied.add(patch);
        }

        if (applied.isEmpty()) {
            return new ApplyResult(applied, conflicts, already, List.of());
        }
        try {
            AtomicFiles.write(path, String.join("\n", lines));
        } catch (IOException e) {
            log.warn("Could not write {}: {}", file, e.getMessage());
            applied.forEach(p -> conflicts.add(new ApplyConflict(p, "cannot write file: " + e.getMessage())));
            return new ApplyResult(List.of(), conflicts, already, List.of());
        }
        log.debug("Rewrote {} with {} patch(es)", file, applied.size());
        return new ApplyResult(applied, conflicts, already, List.of(file));
    }

    /** Line ranges are compared in original coordinates; an insertion occupies its anchor line. */
    private static boolean overlaps(Patch a, Patch b) {
        int aStart = a.startLine();
        int aEnd = Math.max(a.startLine(), a.endLine());
        int bStart = b.startLine();
        int bEnd = Math.max(b.startLine(), b.endLine());
        return aStart <= bEnd && bStart <= aEnd;
    }

    private static boolean matches(List<String> lines, Patch patch, int shift) {
        int local = 0;
        for (Hunk hunk : patch.hunks()) {
            if (!regionEquals(lines, hunk.startLine() - 1 + shift + local, hunk.before())) {
                return false;
            }
            local += hunk.delta();
        }
        return true;
    }

    /** True when every hunk's replacement already sits where its original lines would be. */
    private static boolean isPresent(List<String> lines, Patch patch, int shift) {
        int local = 0;
        for (Hunk hunk : patch.hunks()) {
            if (hunk.after().isEmpty() || hunk.after().equals(hunk.before())
                    || !regionEquals(lines, hunk.startLine() - 1 + shift + local, hunk.after())) {
                return false;
            }
            local += hunk.delta();
        }
        return true;
    }

    private static boolean regionEquals(List<String> lines, int from, List<String> expected) {
        if (from < 0 || from + expected.size() > lines.size()) {
            return false;
        }
        return lines.subList(from, from + expected.size()).equals(expected);
    }

    /** Replaces the patch's hunks in place and returns the net change in line count. */
    private static int splice(List<String> lines, Patch patch, int shift) {
        int local = 0;
        for (Hunk hunk : patch.hunks()) {
            int from = hunk.startLine() - 1 + shift + local;
            var region = lines.subList(from, from + hunk.before().size());
            region.clear();
            region.addAll(hunk.after());
            local += hunk.delta();
        }
        return local;
    }
}
