package com.lexgate.core.detect;

import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.DetectorSpec;

import java.util.List;

/**
 * A generic detector a task function selects by {@code detector.kind}.
 * Implementations are stateless and pure over the unit they are given.
 */
public interface DetectionStrategy {

    DetectorKind kind();

    /**
     * Reports every occurrence in {@code unit}. Called only with parsed units unless
     * {@link #requiresParse()} is false.
     */
    List<Detection> detect(SourceUnit unit, DetectorSpec spec);

    default boolean requiresParse() {
        return true;
    }
}
