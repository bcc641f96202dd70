package org.physlang.engine.runtime;

import org.physlang.dsl.definition.ConditionExpr.Comparison;
import org.physlang.engine.physics.World;

import java.util.Objects;

/**
 * Condition of a while loop with its threshold already evaluated.
 */
public record LoopCondition(Observation observation, Comparison comparison, double threshold) {

    public LoopCondition {
        Objects.requireNonNull(observation, "Observation cannot be null");
        Objects.requireNonNull(comparison, "Comparison cannot be null");
    }

    public boolean holds(World world) {
        return comparison.test(observation.measure(world), threshold);
    }
}
