package com.lexgate.core.registry;

import com.lexgate.core.model.TaskFunction;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The task functions loaded for one run. Immutable.
 * <p>
 * Stub and disabled functions stay visible through {@link #all()} and {@link #find(String)}
 * for introspection; only {@link #active()} functions execute.
 */
public class TfRegistry {

    private final List<TaskFunction> all;
    private final Map<String, TaskFunction> byId;
    private final List<SchemaViolation> violations;

    public TfRegistry(List<TaskFunction> taskFunctions, List<SchemaViolation> violations) {
        this.all = taskFunctions.stream()
                .sorted(Comparator.comparing(TaskFunction::id))
                .toList();
        var index = new LinkedHashMap<String, TaskFunction>();
        all.forEach(tf -> index.put(tf.id(), tf));
        this.byId = index;
        this.violations = List.copyOf(violations);
    }

    public static TfRegistry of(TaskFunction... taskFunctions) {
        return new TfRegistry(List.of(taskFunctions), List.of());
    }

    public List<TaskFunction> all() {
        return all;
    }

    public List<TaskFunction> active() {
        return all.stream().filter(TaskFunction::isActive).toList();
    }

    public Optional<TaskFunction> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /** Non-fatal violations reported while loading (invalid stub or disabled documents). */
    public List<SchemaViolation> violations() {
        return violations;
    }
}
