package com.lexgate.core.registry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the TF registry cannot be built. Fatal to the run.
 */
public class RegistryException extends RuntimeException {

    private final List<SchemaViolation> violations;

    public RegistryException(String message) {
        super(message);
        this.violations = List.of();
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public RegistryException(List<SchemaViolation> violations) {
        super("TF registry invalid: " + violations.size() + " violation(s)\n" + violations.stream()
                .map(v -> "  " + v)
                .collect(Collectors.joining("\n")));
        this.violations = List.copyOf(violations);
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }
}
