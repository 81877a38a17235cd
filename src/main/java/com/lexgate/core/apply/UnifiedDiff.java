package com.lexgate.core.apply;

import com.lexgate.core.model.Hunk;
import com.lexgate.core.model.Patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders patches as unified diff text and reads unified diffs back into patches.
 * <p>
 * Rendered diffs carry no context lines. Parsed diffs may carry context; it becomes part of
 * both sides of the hunk, so the apply engine checks it like any other original line.
 * A {@code # tf_id: <ID>} line attributes the diffs that follow it to a task function.
 */
public final class UnifiedDiff {

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");
    private static final Pattern TF_HEADER = Pattern.compile("^#\\s*tf_id\\s*:\\s*(\\S+)\\s*$");
    private static final String DEV_NULL = "/dev/null";

    private UnifiedDiff() {}

    public static String render(Patch patch) {
        var sb = new StringBuilder();
        sb.append("--- a/").append(patch.file()).append('\n');
        sb.append("+++ b/").append(patch.file()).append('\n');
        int delta = 0;
        for (Hunk hunk : patch.hunks()) {
            int oldCount = hunk.before().size();
            int newCount = hunk.after().size();
            int oldStart = oldCount == 0 ? hunk.startLine() - 1 : hunk.startLine();
            int newStart = newCount == 0 ? hunk.startLine() - 1 + delta : hunk.startLine() + delta;
            sb.append("@@ -").append(oldStart).append(',').append(oldCount)
                    .append(" +").append(newStart).append(',').append(newCount).append(" @@\n");
            hunk.before().forEach(line -> sb.append('-').append(line).append('\n'));
            hunk.after().forEach(line -> sb.append('+').append(line).append('\n'));
            delta += hunk.delta();
        }
        return sb.toString();
    }

    /** The patch stream: each patch preceded by its {@code # tf_id} header. */
    public static String renderAll(List<Patch> patches) {
        var sb = new StringBuilder();
        for (Patch patch : patches) {
            sb.append("# tf_id: ").append(patch.tfId()).append('\n');
            if (patch.findingKey() != null) {
                sb.append("# finding: ").append(patch.file()).append(':').append(patch.findingKey().span()).append('\n');
            }
            sb.append(render(patch));
        }
        return sb.toString();
    }

    /**
     * Parses every file section of {@code text}.
     *
     * @param defaultTfId attribution for sections not preceded by a {@code # tf_id} line
     * @throws IllegalArgumentException if a hunk header is malformed or a hunk is truncated
     */
    public static List<Patch> parse(String text, String defaultTfId) {
        var patches = new ArrayList<Patch>();
        String tfId = defaultTfId;
        String oldPath = null;
        String file = null;
        boolean newFile = false;
        var hunks = new ArrayList<Hunk>();

        String[] lines = text.split("\r?\n", -1);
        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            Matcher tf = TF_HEADER.matcher(line);
            if (tf.matches()) {
                flush(patches, tfId, file, hunks);
                tfId = tf.group(1);
                i++;
            } else if (line.startsWith("--- ")) {
                flush(patches, tfId, file, hunks);
                oldPath = stripPath(line.substring(4));
                file = null;
                i++;
            } else if (line.startsWith("+++ ")) {
                String newPath = stripPath(line.substring(4));
                newFile = DEV_NULL.equals(oldPath);
                file = DEV_NULL.equals(newPath) ? oldPath : newPath;
                i++;
            } else if (line.startsWith("@@")) {
                if (file == null) {
                    throw new IllegalArgumentException("hunk without file header at line " + (i + 1));
                }
                i = readHunk(lines, i, newFile, hunks);
            } else {
                i++;
            }
        }
        flush(patches, tfId, file, hunks);
        return patches;
    }

    private static int readHunk(String[] lines, int headerIndex, boolean newFile, List<Hunk> hunks) {
        Matcher header = HUNK_HEADER.matcher(lines[headerIndex]);
        if (!header.matches()) {
            throw new IllegalArgumentException("malformed hunk header at line " + (headerIndex + 1)
                    + ": " + lines[headerIndex]);
        }
        int oldStart = Integer.parseInt(header.group(1));
        int oldCount = header.group(2) == null ? 1 : Integer.parseInt(header.group(2));
        int newCount = header.group(4) == null ? 1 : Integer.parseInt(header.group(4));

        var before = new ArrayList<String>();
        var after = new ArrayList<String>();
        boolean noNewlineAtEnd = false;
        int i = headerIndex + 1;
        while (i < lines.length && (before.size() < oldCount || after.size() < newCount)) {
            String line = lines[i];
            if (line.startsWith("\\")) {
                noNewlineAtEnd = true;
            } else if (line.isEmpty() || line.startsWith(" ")) {
                String body = line.isEmpty() ? "" : line.substring(1);
                before.add(body);
                after.add(body);
            } else if (line.startsWith("-")) {
                before.add(line.substring(1));
            } else if (line.startsWith("+")) {
                after.add(line.substring(1));
            } else {
                break;
            }
            i++;
        }
        if (before.size() != oldCount || after.size() != newCount) {
            throw new IllegalArgumentException("truncated hunk at line " + (headerIndex + 1));
        }
        if (i < lines.length && lines[i].startsWith("\\")) {
            noNewlineAtEnd = true;
            i++;
        }
        if (newFile && !noNewlineAtEnd) {
            after.add("");
        }
        hunks.add(new Hunk(oldCount == 0 ? oldStart + 1 : oldStart, before, after));
        return i;
    }

    private static void flush(List<Patch> patches, String tfId, String file, List<Hunk> hunks) {
        if (file != null && !hunks.isEmpty()) {
            patches.add(new Patch(tfId, null, null, file, null, hunks));
        }
        hunks.clear();
    }

    private static String stripPath(String raw) {
        String path = raw;
        int tab = path.indexOf('\t');
        if (tab >= 0) {
            path = path.substring(0, tab);
        }
        path = path.trim();
        if (path.startsWith("a/") || path.startsWith("b/")) {
            path = path.substring(2);
        }
        return path;
    }
}
