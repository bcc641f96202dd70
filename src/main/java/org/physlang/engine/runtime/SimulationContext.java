package org.physlang.engine.runtime;

import org.physlang.engine.physics.Integrator;
import org.physlang.engine.physics.World;

import java.util.List;
import java.util.Objects;

/**
 * A running simulation: the world, its loops and wells, and the step clock.
 *
 * Each step integrates the physics, then advances loops, applies wells and
 * re-checks while conditions. Not thread-safe; one owner drives it.
 */
public final class SimulationContext {

    private final World world;
    private final List<LoopInstance> loops;
    private final List<WellInstance> wells;
    private final double dt;
    private final long maxSteps;
    private long currentStep;

    public SimulationContext(World world, List<LoopInstance> loops, List<WellInstance> wells, double dt, long maxSteps) {
        this.world = Objects.requireNonNull(world, "World cannot be null");
        this.loops = List.copyOf(Objects.requireNonNull(loops, "Loops cannot be null"));
        this.wells = List.copyOf(Objects.requireNonNull(wells, "Wells cannot be null"));
        this.dt = dt;
        this.maxSteps = maxSteps;
    }

    /**
     * Advances one step. Does nothing once the configured step count is reached.
     */
    public void step() {
        if (isFinished()) {
            return;
        }
        Integrator.step(world, dt);
        LoopRuntime.updateLoops(loops, world, dt);
        LoopRuntime.applyWells(wells, world, dt);
        LoopRuntime.recheckConditions(loops, world);
        currentStep++;
    }

    public void runToCompletion() {
        while (!isFinished()) {
            step();
        }
    }

    public boolean isFinished() {
        return currentStep >= maxSteps;
    }

    public World world() {
        return world;
    }

    public List<LoopInstance> loops() {
        return loops;
    }

    public List<WellInstance> wells() {
        return wells;
    }

    public double dt() {
        return dt;
    }

    public long maxSteps() {
        return maxSteps;
    }

    public long currentStep() {
        return currentStep;
    }
}
