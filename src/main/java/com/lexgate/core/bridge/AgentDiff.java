package com.lexgate.core.bridge;

import com.lexgate.core.model.Patch;

import java.util.List;

/**
 * A unified diff returned by a reviewer, already parsed into patches.
 *
 * @param source file name the diff was read from
 * @param tfId   task function the diff answers, or null when neither the file name nor a
 *               {@code # tf_id} header names one
 * @param error  parse failure, or null when {@code patches} is usable
 */
public record AgentDiff(String source, String tfId, List<Patch> patches, String error) {

    public AgentDiff {
        patches = patches == null ? List.of() : List.copyOf(patches);
    }

    public static AgentDiff malformed(String source, String tfId, String error) {
        return new AgentDiff(source, tfId, List.of(), error);
    }

    public boolean isMalformed() {
        return error != null;
    }
}
