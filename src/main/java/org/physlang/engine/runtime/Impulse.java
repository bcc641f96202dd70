package org.physlang.engine.runtime;

import org.physlang.engine.physics.Vec2;
import org.physlang.engine.physics.World;

import java.util.Objects;

/**
 * Velocity kick applied by a loop body when it fires.
 *
 * @param target    Index of the pushed particle
 * @param magnitude Velocity change along the direction
 * @param direction Direction, normalized on application; zero means no change
 */
public record Impulse(int target, double magnitude, Vec2 direction) {

    public Impulse {
        Objects.requireNonNull(direction, "Direction cannot be null");
    }

    public void apply(World world) {
        world.particle(target).addVelocity(direction.normalizeOrZero().multiply(magnitude));
    }
}
