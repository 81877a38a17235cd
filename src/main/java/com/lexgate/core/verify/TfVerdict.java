package com.lexgate.core.verify;

import java.util.List;

/**
 * Acceptance-predicate outcome for one applied task function.
 *
 * @param files    files the function touched
 * @param failures one line per failed predicate, empty when passed
 */
public record TfVerdict(String tfId, VerifyStatus status, List<String> files, List<String> failures) {

    public TfVerdict {
        files = List.copyOf(files);
        failures = List.copyOf(failures);
    }
}
