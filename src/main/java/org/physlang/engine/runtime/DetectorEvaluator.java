package org.physlang.engine.runtime;

import org.physlang.dsl.definition.DetectorDecl;
import org.physlang.dsl.definition.DetectorKind;
import org.physlang.dsl.definition.Program;
import org.physlang.engine.physics.World;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the program's detectors from the final world state.
 *
 * A position detector reports the x coordinate only; a distance detector
 * reports the Euclidean distance between its two particles.
 */
public final class DetectorEvaluator {

    private DetectorEvaluator() {
    }

    public static List<DetectorResult> evaluate(Program program, World world) {
        List<DetectorResult> results = new ArrayList<>(program.detectors().size());
        for (DetectorDecl detector : program.detectors()) {
            double value;
            if (detector.kind() instanceof DetectorKind.Position position) {
                value = world.particle(index(world, position.particle().name())).position().x();
            } else {
                DetectorKind.Distance distance = (DetectorKind.Distance) detector.kind();
                value = world.distance(index(world, distance.first().name()), index(world, distance.second().name()));
            }
            results.add(new DetectorResult(detector.name(), value));
        }
        return results;
    }

    private static int index(World world, String name) {
        return world.indexOf(name).orElseThrow(() ->
                new IllegalStateException("Detector references particle '" + name + "' missing from the world"));
    }
}
