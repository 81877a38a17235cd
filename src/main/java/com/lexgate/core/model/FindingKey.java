package com.lexgate.core.model;

import java.io.Serializable;

/**
 * Identity of a finding. Two findings with equal keys are the same finding.
 */
public record FindingKey(String tfId, String file, Span span) implements Serializable {

    @Override
    public String toString() {
        return tfId + "@" + file + ":" + span;
    }
}
