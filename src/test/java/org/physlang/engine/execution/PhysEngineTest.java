package org.physlang.engine.execution;

import org.physlang.dsl.analysis.Diagnostic;
import org.physlang.engine.physics.Force;
import org.physlang.engine.physics.Vec2;
import org.physlang.engine.runtime.CycleLoop;
import org.physlang.engine.runtime.ParticleState;
import org.physlang.engine.runtime.SimulationContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PhysEngine end to end")
class PhysEngineTest {

    private final PhysEngine engine = new PhysEngine();

    static String loadProgram(String name) {
        try (InputStream in = PhysEngineTest.class.getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "Missing test program " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Nested
    @DisplayName("Complete runs")
    class Runs {

        @Test
        @DisplayName("Two bodies under gravity end up closer than they started")
        void testTwoBodyGravity() {
            SimulationResult result = engine.run(loadProgram("two_body.phys"));

            double gap = result.detector("gap").orElseThrow();
            assertTrue(gap > 0.0 && gap < 5.0, "gap = " + gap);
            assertTrue(result.detector("ax").orElseThrow() > 0.0);
            assertEquals(100, result.steps());
            assertTrue(result.diagnostics().isEmpty());
        }

        @Test
        @DisplayName("Identical programs give bit-identical detector values")
        void testDeterminism() {
            String source = loadProgram("chain.phys");
            SimulationResult first = engine.run(source);
            SimulationResult second = new PhysEngine().run(source);

            assertEquals(first.detectors().size(), second.detectors().size());
            for (int i = 0; i < first.detectors().size(); i++) {
                assertEquals(first.detectors().get(i).name(), second.detectors().get(i).name());
                assertEquals(Double.doubleToLongBits(first.detectors().get(i).value()),
                        Double.doubleToLongBits(second.detectors().get(i).value()));
            }
        }

        @Test
        @DisplayName("Functions and control flow generate the expected forces")
        void testGeneratedChain() {
            ContextBuild build = engine.buildContext(loadProgram("chain.phys"));
            List<Force> forces = build.context().world().forces();

            assertEquals(4, forces.size());
            assertEquals(new Force.Spring(0, 1, 40.0, 1.0), forces.get(0));
            assertEquals(new Force.Spring(1, 2, 20.0, 1.0), forces.get(1));
            assertEquals(new Force.Spring(2, 3, 20.0, 1.0), forces.get(2));
            assertEquals(new Force.Gravity(0, 3, 0.5), forces.get(3));

            SimulationResult result = engine.run(loadProgram("chain.phys"));
            assertTrue(Double.isFinite(result.detector("span").orElseThrow()));
        }

        @Test
        @DisplayName("Detector results keep declaration order")
        void testDetectorOrder() {
            SimulationResult result = engine.run("""
                    particle A at (0, 0) mass 1
                    particle B at (0, 2) mass 1
                    detect second = distance(B, A)
                    detect first = position(A)
                    simulate dt = 0.1 steps = 1
                    """);
            assertEquals(List.of("second", "first"),
                    result.detectors().stream().map(d -> d.name()).toList());
            assertEquals(2.0, result.detector("second").orElseThrow());
            assertTrue(result.detector("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Loops and wells")
    class Scripted {

        @Test
        @DisplayName("A well pulls the particle back by depth * overshoot / mass * dt")
        void testWellImpulse() {
            ContextBuild build = engine.buildContext("""
                    particle A at (7.0, 0) mass 1.0
                    well wall on A if position(A).x >= 5.0 depth 10.0
                    simulate dt = 0.01 steps = 10
                    """);
            engine.advanceOneStep(build.context());

            assertEquals(-0.2, build.context().world().particle(0).velocity().x(), 1e-12);
        }

        @Test
        @DisplayName("A three cycle loop fires three times and then stops")
        void testCycleLoop() {
            ContextBuild build = engine.buildContext(loadProgram("pulse.phys"));
            SimulationContext context = build.context();
            while (!engine.advanceOneStep(context)) {
                // run to the end
            }

            CycleLoop loop = assertInstanceOf(CycleLoop.class, context.loops().get(0));
            assertEquals(3, loop.fireCount());
            assertFalse(loop.isActive());
            assertEquals(3.0, context.world().particle(0).velocity().x(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Stepping")
    class Stepping {

        @Test
        @DisplayName("A built context starts at step zero and reports completion")
        void testAdvanceOneStep() {
            ContextBuild build = engine.buildContext("""
                    particle A at (0, 0) mass 1
                    simulate dt = 0.1 steps = 2
                    """);
            SimulationContext context = build.context();

            assertEquals(0, context.currentStep());
            assertFalse(engine.advanceOneStep(context));
            assertTrue(engine.advanceOneStep(context));
            assertTrue(engine.advanceOneStep(context));
            assertEquals(2, context.currentStep());
        }

        @Test
        @DisplayName("Snapshots list particles in index order with current positions")
        void testSnapshot() {
            ContextBuild build = engine.buildContext("""
                    particle heavy at (0, 0) mass 100
                    particle light at (10, 0) mass 1
                    force gravity(heavy, light) G = 1
                    simulate dt = 0.1 steps = 10
                    """);
            List<ParticleState> before = engine.snapshotParticles(build.context());
            assertEquals(List.of(new ParticleState("heavy", new Vec2(0, 0), 100),
                    new ParticleState("light", new Vec2(10, 0), 1)), before);

            engine.advanceOneStep(build.context());
            List<ParticleState> after = engine.snapshotParticles(build.context());
            assertTrue(after.get(1).position().x() < 10.0);
            assertTrue(after.get(0).position().x() > 0.0);
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class Reporting {

        @Test
        @DisplayName("Warnings do not stop the run and are reported once")
        void testWarningsReported() {
            SimulationResult result = engine.run("""
                    let a = 1
                    particle A at (0, 0) mass 1
                    if a > 0 {
                        let a = 2
                    }
                    simulate dt = 0.1 steps = 1
                    """);
            List<Diagnostic> warnings = result.diagnostics().warnings();
            assertEquals(1, warnings.size());
            assertEquals("'a' shadows an outer binding", warnings.get(0).message());
            assertFalse(result.diagnostics().hasErrors());
        }

        @Test
        void testAnalyzeWithoutRunning() {
            PhysEngine tracing = new PhysEngine(EngineOptions.defaults().withTraceParsing(true));
            var diagnostics = tracing.analyze(tracing.parse("""
                    particle a at (0, 0) mass 1
                    force gravity(a, b) G = 1
                    simulate dt = 0.1 steps = 1
                    """));
            assertTrue(diagnostics.hasErrors());
            assertTrue(diagnostics.errors().get(0).message().contains("'b'"));
        }
    }
}
