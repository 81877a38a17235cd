package com.lexgate.core.apply;

import com.lexgate.core.model.Patch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of one apply batch.
 *
 * @param alreadyApplied patches whose replacement was already in place; nothing was written for them
 * @param changedFiles   files actually rewritten, sorted
 */
public record ApplyResult(
        List<Patch> applied,
        List<ApplyConflict> conflicts,
        List<Patch> alreadyApplied,
        List<String> changedFiles
) {

    public ApplyResult {
        applied = List.copyOf(applied);
        conflicts = List.copyOf(conflicts);
        alreadyApplied = List.copyOf(alreadyApplied);
        changedFiles = List.copyOf(changedFiles);
    }

    public static ApplyResult empty() {
        return new ApplyResult(List.of(), List.of(), List.of(), List.of());
    }

    /** Files each task function rewrote in this batch. */
    public Map<String, SortedSet<String>> touchedFilesByTf() {
        var touched = new TreeMap<String, SortedSet<String>>();
        for (Patch patch : applied) {
            touched.computeIfAbsent(patch.tfId(), k -> new TreeSet<>()).add(patch.file());
        }
        return touched;
    }

    public ApplyResult merge(ApplyResult other) {
        var mergedApplied = new ArrayList<>(applied);
        mergedApplied.addAll(other.applied);
        var mergedConflicts = new ArrayList<>(conflicts);
        mergedConflicts.addAll(other.conflicts);
        var mergedAlready = new ArrayList<>(alreadyApplied);
        mergedAlready.addAll(other.alreadyApplied);
        var files = new TreeSet<>(changedFiles);
        files.addAll(other.changedFiles);
        return new ApplyResult(mergedApplied, mergedConflicts, mergedAlready, new ArrayList<>(files));
    }
}
