package org.physlang.engine.runtime;

import org.physlang.engine.physics.World;

import java.util.List;

/**
 * Per-step update of scripted loops and potential wells.
 */
public final class LoopRuntime {

    private LoopRuntime() {
    }

    public static void updateLoops(List<LoopInstance> loops, World world, double dt) {
        for (LoopInstance loop : loops) {
            loop.advance(world, dt);
        }
    }

    public static void applyWells(List<WellInstance> wells, World world, double dt) {
        for (WellInstance well : wells) {
            well.apply(world, dt);
        }
    }

    /**
     * Deactivates every while loop whose condition has become false.
     */
    public static void recheckConditions(List<LoopInstance> loops, World world) {
        for (LoopInstance loop : loops) {
            if (loop instanceof ConditionLoop conditionLoop) {
                conditionLoop.recheck(world);
            }
        }
    }
}
