package org.physlang.engine.physics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("World accelerations")
class WorldTest {

    private static final double EPS = 1e-12;

    @Test
    @DisplayName("Gravity pulls both particles together with equal and opposite momentum change")
    void testGravitySymmetry() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 1), Particle.atRest("B", new Vec2(2, 0), 3)),
                List.of(new Force.Gravity(0, 1, 1.0)));

        Vec2 a = world.computeAcceleration(0);
        Vec2 b = world.computeAcceleration(1);
        assertEquals(0.75, a.x(), EPS);
        assertEquals(-0.25, b.x(), EPS);
        assertEquals(0.0, a.y(), EPS);
        assertEquals(0.0, world.particle(0).mass() * a.x() + world.particle(1).mass() * b.x(), EPS);
    }

    @Test
    @DisplayName("Spring acceleration is divided by each particle's own mass")
    void testStretchedSpring() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 2), Particle.atRest("B", new Vec2(3, 0), 1)),
                List.of(new Force.Spring(0, 1, 2.0, 1.0)));

        assertEquals(2.0, world.computeAcceleration(0).x(), EPS);
        assertEquals(-4.0, world.computeAcceleration(1).x(), EPS);
    }

    @Test
    @DisplayName("A compressed spring pushes the particles apart")
    void testCompressedSpring() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 1), Particle.atRest("B", new Vec2(0, 1), 1)),
                List.of(new Force.Spring(0, 1, 1.0, 3.0)));

        assertEquals(-2.0, world.computeAcceleration(0).y(), EPS);
        assertEquals(2.0, world.computeAcceleration(1).y(), EPS);
    }

    @Test
    @DisplayName("A spring at its rest length exerts nothing")
    void testSpringAtRest() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 1), Particle.atRest("B", new Vec2(3, 4), 1)),
                List.of(new Force.Spring(0, 1, 10.0, 5.0)));

        assertEquals(Vec2.ZERO, world.computeAcceleration(0));
    }

    @Test
    @DisplayName("Coincident particles contribute no force")
    void testZeroSeparation() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(1, 1), 1), Particle.atRest("B", new Vec2(1, 1), 1)),
                List.of(new Force.Gravity(0, 1, 5.0), new Force.Spring(0, 1, 5.0, 1.0)));

        Vec2 a = world.computeAcceleration(0);
        assertEquals(0.0, a.x());
        assertEquals(0.0, a.y());
        assertTrue(Double.isFinite(a.x()));
    }

    @Test
    void testForcesSum() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 1),
                        Particle.atRest("L", new Vec2(-1, 0), 1),
                        Particle.atRest("R", new Vec2(1, 0), 1)),
                List.of(new Force.Gravity(0, 1, 1.0), new Force.Gravity(0, 2, 1.0)));

        assertEquals(0.0, world.computeAcceleration(0).x(), EPS);
    }

    @Test
    void testDistanceAndLookup() {
        World world = new World(
                List.of(Particle.atRest("A", new Vec2(0, 0), 1), Particle.atRest("B", new Vec2(3, 4), 1)),
                List.of());

        assertEquals(5.0, world.distance(0, 1), EPS);
        assertEquals(Optional.of(1), world.indexOf("B"));
        assertTrue(world.indexOf("C").isEmpty());
    }

    @Test
    @DisplayName("Forces must reference existing particles")
    void testInvalidIndex() {
        List<Particle> particles = List.of(Particle.atRest("A", Vec2.ZERO, 1));
        List<Force> forces = List.of(new Force.Gravity(0, 1, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new World(particles, forces));
    }
}
