package org.physlang.engine.runtime;

import org.physlang.dsl.definition.ConditionExpr.Comparison;
import org.physlang.engine.physics.Particle;
import org.physlang.engine.physics.Vec2;
import org.physlang.engine.physics.World;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Loops and wells")
class LoopRuntimeTest {

    private static final double DT = 0.01;

    private static World single(double x, double y, double mass) {
        return new World(List.of(Particle.atRest("A", new Vec2(x, y), mass)), List.of());
    }

    private static List<Impulse> kick(double magnitude, double dx, double dy) {
        return List.of(new Impulse(0, magnitude, new Vec2(dx, dy)));
    }

    private static void run(List<LoopInstance> loops, World world, int steps) {
        for (int i = 0; i < steps; i++) {
            LoopRuntime.updateLoops(loops, world, DT);
            LoopRuntime.recheckConditions(loops, world);
        }
    }

    @Nested
    @DisplayName("Cycle loops")
    class Cycles {

        @Test
        @DisplayName("Fires exactly the requested number of cycles, then stops")
        void testFiresCycles() {
            World world = single(0, 0, 1);
            CycleLoop loop = new CycleLoop(null, 0, 3, 10.0, 0.0, kick(1.0, 1, 0));

            run(List.of(loop), world, 100);

            assertEquals(3, loop.fireCount());
            assertEquals(0, loop.remainingCycles());
            assertFalse(loop.isActive());
            assertEquals(3.0, world.particle(0).velocity().x(), 1e-12);
        }

        @Test
        @DisplayName("Phase wraps once per period")
        void testWrapTiming() {
            World world = single(0, 0, 1);
            CycleLoop loop = new CycleLoop("beat", 0, 10, 10.0, 0.0, kick(1.0, 1, 0));

            run(List.of(loop), world, 5);
            assertEquals(0, loop.fireCount());
            assertEquals(Math.PI, loop.phase(), 1e-9);

            run(List.of(loop), world, 7);
            assertEquals(1, loop.fireCount());
            assertTrue(loop.phase() < 2 * Math.PI);
            assertEquals("beat", loop.label());
        }

        @Test
        @DisplayName("Zero cycles never fire")
        void testZeroCycles() {
            World world = single(0, 0, 1);
            CycleLoop loop = new CycleLoop(null, 0, 0, 10.0, 0.0, kick(1.0, 1, 0));

            assertFalse(loop.isActive());
            run(List.of(loop), world, 100);
            assertEquals(0, loop.fireCount());
            assertEquals(Vec2.ZERO, world.particle(0).velocity());
        }

        @Test
        void testNegativeCyclesRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> new CycleLoop(null, 0, -1, 1.0, 0.0, List.of()));
        }

        @Test
        @DisplayName("Damping of at least 1/dt pins the phase at zero")
        void testFullDamping() {
            World world = single(0, 0, 1);
            CycleLoop loop = new CycleLoop(null, 0, 3, 10.0, 200.0, kick(1.0, 1, 0));

            run(List.of(loop), world, 100);

            assertEquals(0.0, loop.phase());
            assertEquals(0, loop.fireCount());
            assertTrue(loop.isActive());
        }

        @Test
        @DisplayName("Partial damping delays the wrap")
        void testPartialDamping() {
            World world = single(0, 0, 1);
            CycleLoop undamped = new CycleLoop(null, 0, 1, 10.0, 0.0, kick(1.0, 1, 0));
            CycleLoop damped = new CycleLoop(null, 0, 1, 10.0, 5.0, kick(1.0, 1, 0));

            run(List.of(undamped, damped), world, 11);

            assertEquals(1, undamped.fireCount());
            assertEquals(0, damped.fireCount());
        }
    }

    @Nested
    @DisplayName("While loops")
    class Conditions {

        @Test
        @DisplayName("A false condition stops the loop before it ever fires")
        void testConditionFalse() {
            World world = single(7, 0, 1);
            LoopCondition condition = new LoopCondition(new Observation.PositionX(0), Comparison.LESS, 5.0);
            ConditionLoop loop = new ConditionLoop(null, 0, condition, 10.0, 0.0, kick(1.0, 1, 0));

            run(List.of(loop), world, 50);

            assertFalse(loop.isActive());
            assertEquals(0, loop.fireCount());
        }

        @Test
        @DisplayName("Fires on every wrap while the condition holds")
        void testConditionHolds() {
            World world = single(0, 0, 1);
            LoopCondition condition = new LoopCondition(new Observation.PositionX(0), Comparison.LESS, 5.0);
            ConditionLoop loop = new ConditionLoop(null, 0, condition, 10.0, 0.0, kick(1.0, 0, 1));

            run(List.of(loop), world, 100);

            assertTrue(loop.isActive());
            assertTrue(loop.fireCount() >= 9);
            assertEquals(loop.fireCount(), world.particle(0).velocity().y(), 1e-12);
        }

        @Test
        @DisplayName("Once stopped, a loop stays stopped even if the condition becomes true again")
        void testStopIsPermanent() {
            World world = single(7, 0, 1);
            LoopCondition condition = new LoopCondition(new Observation.PositionX(0), Comparison.LESS, 5.0);
            ConditionLoop loop = new ConditionLoop(null, 0, condition, 10.0, 0.0, kick(1.0, 1, 0));

            loop.recheck(world);
            world.particle(0).setPosition(Vec2.ZERO);
            run(List.of(loop), world, 50);

            assertFalse(loop.isActive());
            assertEquals(0, loop.fireCount());
        }

        @Test
        void testDistanceCondition() {
            World world = new World(List.of(Particle.atRest("A", Vec2.ZERO, 1),
                    Particle.atRest("B", new Vec2(3, 4), 1)), List.of());
            assertTrue(new LoopCondition(new Observation.Distance(0, 1), Comparison.GREATER, 4.5).holds(world));
            assertFalse(new LoopCondition(new Observation.Distance(0, 1), Comparison.LESS, 5.0).holds(world));
        }
    }

    @Nested
    @DisplayName("Impulses")
    class Impulses {

        @Test
        @DisplayName("Direction is normalized before scaling")
        void testNormalized() {
            World world = single(0, 0, 1);
            new Impulse(0, 10.0, new Vec2(3, 4)).apply(world);
            assertEquals(6.0, world.particle(0).velocity().x(), 1e-12);
            assertEquals(8.0, world.particle(0).velocity().y(), 1e-12);
        }

        @Test
        @DisplayName("A zero direction changes nothing")
        void testZeroDirection() {
            World world = single(0, 0, 1);
            new Impulse(0, 10.0, Vec2.ZERO).apply(world);
            assertEquals(0.0, world.particle(0).velocity().x());
            assertEquals(0.0, world.particle(0).velocity().y());
        }
    }

    @Nested
    @DisplayName("Wells")
    class Wells {

        @Test
        @DisplayName("Pulls the target back along x above the threshold")
        void testWellX() {
            World world = single(7, 0, 1);
            WellInstance well = new WellInstance("wall", 0, new Observation.PositionX(0), 5.0, 10.0);

            LoopRuntime.applyWells(List.of(well), world, DT);

            assertEquals(-0.2, world.particle(0).velocity().x(), 1e-12);
            assertEquals(0.0, world.particle(0).velocity().y());
        }

        @Test
        @DisplayName("Heavier particles are pulled less")
        void testWellMass() {
            World world = single(7, 0, 4);
            new WellInstance("wall", 0, new Observation.PositionX(0), 5.0, 10.0).apply(world, DT);
            assertEquals(-0.05, world.particle(0).velocity().x(), 1e-12);
        }

        @Test
        void testWellY() {
            World world = single(0, 6, 1);
            new WellInstance("floor", 0, new Observation.PositionY(0), 5.0, 10.0).apply(world, DT);
            assertEquals(0.0, world.particle(0).velocity().x());
            assertEquals(-0.1, world.particle(0).velocity().y(), 1e-12);
        }

        @Test
        @DisplayName("Below the threshold nothing happens")
        void testBelowThreshold() {
            World world = single(4, 0, 1);
            new WellInstance("wall", 0, new Observation.PositionX(0), 5.0, 10.0).apply(world, DT);
            assertEquals(Vec2.ZERO, world.particle(0).velocity());
        }

        @Test
        @DisplayName("Distance wells apply nothing")
        void testDistanceWell() {
            World world = new World(List.of(Particle.atRest("A", Vec2.ZERO, 1),
                    Particle.atRest("B", new Vec2(10, 0), 1)), List.of());
            new WellInstance("far", 0, new Observation.Distance(0, 1), 1.0, 10.0).apply(world, DT);
            assertEquals(Vec2.ZERO, world.particle(0).velocity());
        }
    }
}
