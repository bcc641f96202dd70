package org.physlang.engine.physics;

import java.util.Objects;

/**
 * Mutable simulation state of one particle.
 */
public final class Particle {

    private final String name;
    private final double mass;
    private Vec2 position;
    private Vec2 velocity;

    public Particle(String name, Vec2 position, Vec2 velocity, double mass) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        this.position = Objects.requireNonNull(position, "Position cannot be null");
        this.velocity = Objects.requireNonNull(velocity, "Velocity cannot be null");
        this.mass = mass;
    }

    public static Particle atRest(String name, Vec2 position, double mass) {
        return new Particle(name, position, Vec2.ZERO, mass);
    }

    public String name() {
        return name;
    }

    public double mass() {
        return mass;
    }

    public Vec2 position() {
        return position;
    }

    public Vec2 velocity() {
        return velocity;
    }

    public void setPosition(Vec2 position) {
        this.position = Objects.requireNonNull(position);
    }

    public void setVelocity(Vec2 velocity) {
        this.velocity = Objects.requireNonNull(velocity);
    }

    public void addVelocity(Vec2 delta) {
        this.velocity = velocity.add(delta);
    }

    @Override
    public String toString() {
        return "Particle[" + name + " pos=" + position + " vel=" + velocity + " mass=" + mass + "]";
    }
}
