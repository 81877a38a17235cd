package com.lexgate.core.propose;

import com.lexgate.core.detect.SourceUnit;
import com.lexgate.core.detect.TextEdit;
import com.lexgate.core.model.FindingKey;
import com.lexgate.core.model.Hunk;
import com.lexgate.core.model.Patch;
import com.lexgate.core.model.TaskFunction;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Turns character-range edits on a unit into a single line hunk covering every affected line.
 */
final class PatchBuilder {

    private PatchBuilder() {}

    static Patch build(SourceUnit unit, TaskFunction tf, FindingKey key, List<TextEdit> edits) {
        String text = unit.text();
        var ordered = edits.stream()
                .sorted(Comparator.comparingInt(TextEdit::begin).reversed())
                .toList();

        var result = new StringBuilder(text);
        int limit = text.length();
        for (TextEdit edit : ordered) {
            if (edit.end() > limit) {
                throw new IllegalArgumentException("Overlapping or out-of-range edits for " + key);
            }
            result.replace(edit.begin(), edit.end(), edit.replacement());
            limit = edit.begin();
        }

        int begin = ordered.get(ordered.size() - 1).begin();
        int end = ordered.stream().mapToInt(e -> Math.max(e.begin(), e.end() - 1)).max().orElse(begin);
        int firstLine = lineOf(text, begin);
        int lastLine = lineOf(text, end);

        String[] before = text.split("\n", -1);
        String[] after = result.toString().split("\n", -1);
        int suffix = before.length - lastLine;

        var hunk = new Hunk(firstLine,
                Arrays.asList(before).subList(firstLine - 1, lastLine),
                Arrays.asList(after).subList(firstLine - 1, after.length - suffix));
        return new Patch(tf.id(), tf.tier(), key, unit.path(), unit.sha256(), List.of(hunk));
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
