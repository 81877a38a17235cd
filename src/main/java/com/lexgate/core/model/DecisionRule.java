package com.lexgate.core.model;

/**
 * When a task function may patch on its own.
 *
 * @param mode          {@code auto} or {@code ask}
 * @param minConfidence findings below this confidence are never auto-resolved
 * @param text          human guidance forwarded to reviewers in task packets
 */
public record DecisionRule(DecisionMode mode, double minConfidence, String text) {

    public static DecisionRule auto(String text) {
        return new DecisionRule(DecisionMode.AUTO, 0.0, text);
    }

    public static DecisionRule ask(String text) {
        return new DecisionRule(DecisionMode.ASK, 0.0, text);
    }
}
