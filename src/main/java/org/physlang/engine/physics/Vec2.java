package org.physlang.engine.physics;

/**
 * Immutable 2D vector used for positions, velocities and accelerations.
 */
public record Vec2(double x, double y) {

    public static final Vec2 ZERO = new Vec2(0, 0);

    public Vec2 add(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 subtract(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    public Vec2 multiply(double scalar) {
        return new Vec2(x * scalar, y * scalar);
    }

    public double lengthSquared() {
        return x * x + y * y;
    }

    public double length() {
        return Math.sqrt(lengthSquared());
    }

    /**
     * Unit vector in the same direction, or {@link #ZERO} for the zero vector.
     */
    public Vec2 normalizeOrZero() {
        double length = length();
        if (length == 0) {
            return ZERO;
        }
        return new Vec2(x / length, y / length);
    }
}
