package com.lexgate.core.detect;

import com.lexgate.core.model.DetectorKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link DetectorKind} to its strategy. The set is closed: TF documents select
 * strategies, they never supply code.
 */
@Component
public class StrategyRegistry {

    private final Map<DetectorKind, DetectionStrategy> strategies = new EnumMap<>(DetectorKind.class);

    public StrategyRegistry() {
        for (DetectionStrategy strategy : List.of(
                new BroadCatchStrategy(),
                new EmptyCatchStrategy(),
                new CauseDroppedStrategy(),
                new ForbiddenTypeStrategy(),
                new ForbiddenCallStrategy(),
                new LongMethodStrategy(),
                new SqlConcatStrategy(),
                new SyntaxErrorStrategy())) {
            strategies.put(strategy.kind(), strategy);
        }
    }

    public DetectionStrategy strategyFor(DetectorKind kind) {
        DetectionStrategy strategy = strategies.get(kind);
        if (strategy == null) {
            throw new IllegalArgumentException("No detection strategy for " + kind);
        }
        return strategy;
    }
}
