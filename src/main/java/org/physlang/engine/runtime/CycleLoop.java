package org.physlang.engine.runtime;

import org.physlang.engine.physics.World;

import java.util.List;

/**
 * Loop that fires a fixed number of times and then stops.
 */
public final class CycleLoop extends LoopInstance {

    private long remainingCycles;

    public CycleLoop(String label, int target, long cycles, double frequency, double damping, List<Impulse> body) {
        super(label, target, frequency, damping, body);
        if (cycles < 0) {
            throw new IllegalArgumentException("Cycles cannot be negative: " + cycles);
        }
        this.remainingCycles = cycles;
        if (cycles == 0) {
            deactivate();
        }
    }

    @Override
    protected void onWrap(World world) {
        fire(world);
        remainingCycles--;
        if (remainingCycles <= 0) {
            deactivate();
        }
    }

    public long remainingCycles() {
        return remainingCycles;
    }
}
