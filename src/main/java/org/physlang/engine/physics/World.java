package org.physlang.engine.physics;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The particles of a simulation and the forces acting between them.
 *
 * Particles are addressed by their dense index, assigned in declaration order.
 */
public final class World {

    private final List<Particle> particles;
    private final List<Force> forces;

    public World(List<Particle> particles, List<Force> forces) {
        this.particles = List.copyOf(Objects.requireNonNull(particles, "Particles cannot be null"));
        this.forces = List.copyOf(Objects.requireNonNull(forces, "Forces cannot be null"));
        for (Force force : this.forces) {
            checkIndex(force.first());
            checkIndex(force.second());
        }
    }

    public List<Particle> particles() {
        return particles;
    }

    public List<Force> forces() {
        return forces;
    }

    public Particle particle(int index) {
        return particles.get(index);
    }

    public int size() {
        return particles.size();
    }

    public Optional<Integer> indexOf(String name) {
        for (int i = 0; i < particles.size(); i++) {
            if (particles.get(i).name().equals(name)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    public double distance(int a, int b) {
        return particles.get(b).position().subtract(particles.get(a).position()).length();
    }

    /**
     * Net acceleration of particle {@code index} from every force it takes part in,
     * using current positions.
     */
    public Vec2 computeAcceleration(int index) {
        Particle self = particles.get(index);
        double ax = 0;
        double ay = 0;
        for (Force force : forces) {
            int otherIndex;
            if (force.first() == index) {
                otherIndex = force.second();
            } else if (force.second() == index) {
                otherIndex = force.first();
            } else {
                continue;
            }
            Particle other = particles.get(otherIndex);
            Vec2 r = other.position().subtract(self.position());
            double distSq = r.lengthSquared();

            if (force instanceof Force.Gravity gravity) {
                if (distSq == 0) {
                    continue;
                }
                double dist = Math.sqrt(distSq);
                double magnitude = gravity.g() * other.mass() / distSq;
                ax += magnitude * r.x() / dist;
                ay += magnitude * r.y() / dist;
            } else if (force instanceof Force.Spring spring) {
                double dist = Math.sqrt(distSq);
                if (dist == 0) {
                    continue;
                }
                double magnitude = spring.k() * (dist - spring.rest()) / self.mass();
                ax += magnitude * r.x() / dist;
                ay += magnitude * r.y() / dist;
            }
        }
        return new Vec2(ax, ay);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= particles.size()) {
            throw new IllegalArgumentException("Force references particle index " + index
                    + " but the world has " + particles.size() + " particle(s)");
        }
    }
}
