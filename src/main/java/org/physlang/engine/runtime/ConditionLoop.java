package org.physlang.engine.runtime;

import org.physlang.engine.physics.World;

import java.util.List;
import java.util.Objects;

/**
 * Loop that fires on each phase wrap while its condition holds.
 * The first time the condition is found false the loop stops for good.
 */
public final class ConditionLoop extends LoopInstance {

    private final LoopCondition condition;

    public ConditionLoop(String label, int target, LoopCondition condition, double frequency, double damping,
                         List<Impulse> body) {
        super(label, target, frequency, damping, body);
        this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
    }

    @Override
    protected void onWrap(World world) {
        if (condition.holds(world)) {
            fire(world);
        } else {
            deactivate();
        }
    }

    /**
     * Stops the loop if the condition no longer holds.
     */
    public void recheck(World world) {
        if (isActive() && !condition.holds(world)) {
            deactivate();
        }
    }

    public LoopCondition condition() {
        return condition;
    }
}
