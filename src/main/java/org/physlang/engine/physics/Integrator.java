package org.physlang.engine.physics;

/**
 * Semi-implicit (symplectic) Euler integration.
 *
 * All accelerations are computed from the positions at the start of the
 * step before any particle moves, so the result does not depend on the
 * order particles are stored in.
 */
public final class Integrator {

    private Integrator() {
    }

    public static void step(World world, double dt) {
        int n = world.size();
        Vec2[] accelerations = new Vec2[n];
        for (int i = 0; i < n; i++) {
            accelerations[i] = world.computeAcceleration(i);
        }
        for (int i = 0; i < n; i++) {
            Particle particle = world.particle(i);
            Vec2 velocity = particle.velocity().add(accelerations[i].multiply(dt));
            particle.setVelocity(velocity);
            particle.setPosition(particle.position().add(velocity.multiply(dt)));
        }
    }
}
