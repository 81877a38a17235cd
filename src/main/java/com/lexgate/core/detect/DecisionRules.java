package com.lexgate.core.detect;

import com.lexgate.core.model.DecisionMode;
import com.lexgate.core.model.TaskFunction;

import java.util.Optional;

/**
 * Applies a task function's decision rule to one detection.
 */
public final class DecisionRules {

    private DecisionRules() {}

    /**
     * Why the detection must go to a reviewer, or empty when it resolves to an allowed edit.
     */
    public static Optional<String> ambiguity(TaskFunction tf, Detection detection) {
        if (!detection.hasFix()) {
            return Optional.of(detection.ambiguity() != null ? detection.ambiguity() : "no mechanical fix");
        }
        if (tf.decisionRule().mode() == DecisionMode.ASK) {
            return Optional.of("decision rule of " + tf.id() + " requires review");
        }
        if (tf.confidence() < tf.decisionRule().minConfidence()) {
            return Optional.of("confidence " + tf.confidence() + " is below the decision threshold "
                    + tf.decisionRule().minConfidence());
        }
        if (!tf.allows(detection.transform())) {
            return Optional.of("transform " + detection.transform().wireName() + " is not allowed for " + tf.id());
        }
        return Optional.empty();
    }

    public static boolean resolves(TaskFunction tf, Detection detection) {
        return ambiguity(tf, detection).isEmpty();
    }
}
