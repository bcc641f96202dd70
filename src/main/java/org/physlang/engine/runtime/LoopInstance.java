package org.physlang.engine.runtime;

import org.physlang.engine.physics.World;

import java.util.List;
import java.util.Objects;

/**
 * Runtime state of a scripted loop.
 *
 * Each step the phase advances by 2&pi; &middot; frequency &middot; dt and is
 * then damped by {@code max(0, 1 - damping * dt)}. When it reaches 2&pi; it
 * wraps and the subclass decides whether the body fires.
 */
public abstract sealed class LoopInstance permits CycleLoop, ConditionLoop {

    private static final double TWO_PI = 2.0 * Math.PI;

    private final String label;
    private final int target;
    private final double frequency;
    private final double damping;
    private final List<Impulse> body;
    private double phase;
    private boolean active = true;
    private int fireCount;

    protected LoopInstance(String label, int target, double frequency, double damping, List<Impulse> body) {
        this.label = label;
        this.target = target;
        this.frequency = frequency;
        this.damping = damping;
        this.body = List.copyOf(Objects.requireNonNull(body, "Body cannot be null"));
    }

    /**
     * Advances the loop by one step. Inactive loops do nothing.
     */
    public final void advance(World world, double dt) {
        if (!active) {
            return;
        }
        phase += TWO_PI * frequency * dt;
        phase *= Math.max(0.0, 1.0 - damping * dt);
        if (phase >= TWO_PI) {
            phase -= TWO_PI;
            onWrap(world);
        }
    }

    /**
     * Called when the phase wraps around.
     */
    protected abstract void onWrap(World world);

    protected final void fire(World world) {
        for (Impulse impulse : body) {
            impulse.apply(world);
        }
        fireCount++;
    }

    protected final void deactivate() {
        active = false;
    }

    public String label() {
        return label;
    }

    public int target() {
        return target;
    }

    public double phase() {
        return phase;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Number of times the body has fired so far.
     */
    public int fireCount() {
        return fireCount;
    }
}
