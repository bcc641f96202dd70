package org.physlang.engine.runtime;

import org.physlang.engine.physics.Particle;
import org.physlang.engine.physics.Vec2;
import org.physlang.engine.physics.World;

import java.util.Objects;

/**
 * Potential well with all names resolved and expressions evaluated.
 *
 * While the observable is at or above the threshold the target is pulled back
 * along the observed axis by {@code -depth * (coordinate - threshold) / mass * dt}.
 * Distance wells have no axis and apply nothing.
 */
public record WellInstance(String name, int target, Observation observation, double threshold, double depth) {

    public WellInstance {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(observation, "Observation cannot be null");
    }

    public void apply(World world, double dt) {
        if (observation.measure(world) < threshold) {
            return;
        }
        Particle particle = world.particle(target);
        if (observation instanceof Observation.PositionX) {
            double dv = -depth * (particle.position().x() - threshold) / particle.mass() * dt;
            particle.addVelocity(new Vec2(dv, 0));
        } else if (observation instanceof Observation.PositionY) {
            double dv = -depth * (particle.position().y() - threshold) / particle.mass() * dt;
            particle.addVelocity(new Vec2(0, dv));
        }
    }
}
