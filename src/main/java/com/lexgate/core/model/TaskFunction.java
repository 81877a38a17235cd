package com.lexgate.core.model;

import java.util.List;

/**
 * A validated detection-and-repair rule loaded from a TF document.
 * Immutable for the duration of a run.
 */
public record TaskFunction(
        String id,
        String name,
        TfStatus status,
        PrecedenceTier tier,
        double confidence,
        List<String> signals,
        List<String> hints,
        List<String> entities,
        List<String> relations,
        String scope,
        List<String> constraints,
        List<Transform> allowedTransforms,
        DecisionRule decisionRule,
        DetectorSpec detector,
        Footprint footprint,
        List<AcceptancePredicate> verify,
        String source
) {

    public TaskFunction {
        signals = signals == null ? List.of() : List.copyOf(signals);
        hints = hints == null ? List.of() : List.copyOf(hints);
        entities = entities == null ? List.of() : List.copyOf(entities);
        relations = relations == null ? List.of() : List.copyOf(relations);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        allowedTransforms = allowedTransforms == null ? List.of() : List.copyOf(allowedTransforms);
        verify = verify == null ? List.of() : List.copyOf(verify);
    }

    public boolean isActive() {
        return status == TfStatus.ACTIVE;
    }

    public boolean allows(Transform transform) {
        return allowedTransforms.contains(transform);
    }

    public DetectorKind kind() {
        return detector.kind();
    }
}
