package org.physlang.engine.runtime;

import org.physlang.engine.physics.World;

/**
 * Index-resolved scalar read from the world by loop conditions and wells.
 */
public sealed interface Observation permits Observation.PositionX, Observation.PositionY, Observation.Distance {

    double measure(World world);

    record PositionX(int particle) implements Observation {
        @Override
        public double measure(World world) {
            return world.particle(particle).position().x();
        }
    }

    record PositionY(int particle) implements Observation {
        @Override
        public double measure(World world) {
            return world.particle(particle).position().y();
        }
    }

    record Distance(int first, int second) implements Observation {
        @Override
        public double measure(World world) {
            return world.distance(first, second);
        }
    }
}
