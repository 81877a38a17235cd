package com.lexgate.core.apply;

import com.lexgate.core.model.Patch;

/**
 * A patch that was not applied, with a one-line reason.
 */
public record ApplyConflict(Patch patch, String reason) {

    public String tfId() {
        return patch.tfId();
    }

    public String file() {
        return patch.file();
    }

    @Override
    public String toString() {
        return patch.tfId() + " " + patch.file() + ":" + patch.startLine() + ": " + reason;
    }
}
