package org.physlang.engine.runtime;

import org.physlang.dsl.PhysParser;
import org.physlang.dsl.definition.Program;
import org.physlang.engine.physics.Particle;
import org.physlang.engine.physics.Vec2;
import org.physlang.engine.physics.World;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetectorEvaluatorTest {

    private static final World WORLD = new World(List.of(
            Particle.atRest("A", new Vec2(1, 2), 1),
            Particle.atRest("B", new Vec2(4, 6), 1)), List.of());

    @Test
    void testDetectorsInDeclarationOrder() {
        Program program = PhysParser.parse("""
                detect gap = distance(A, B)
                detect bx = position(B)
                detect ax = position("A")
                simulate dt = 0.1 steps = 1
                """);

        List<DetectorResult> results = DetectorEvaluator.evaluate(program, WORLD);

        assertEquals(List.of(new DetectorResult("gap", 5.0), new DetectorResult("bx", 4.0),
                new DetectorResult("ax", 1.0)), results);
    }

    @Test
    void testNoDetectors() {
        Program program = PhysParser.parse("simulate dt = 0.1 steps = 1");
        assertTrue(DetectorEvaluator.evaluate(program, WORLD).isEmpty());
    }

    @Test
    void testMissingParticle() {
        Program program = PhysParser.parse("""
                detect cx = position(C)
                simulate dt = 0.1 steps = 1
                """);
        assertThrows(IllegalStateException.class, () -> DetectorEvaluator.evaluate(program, WORLD));
    }
}
