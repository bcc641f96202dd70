package org.physlang.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * Scalar quantity read from the scene by loop conditions and wells.
 */
public sealed interface Observable permits Observable.PositionX, Observable.PositionY, Observable.Distance {

    /**
     * Particles this observable reads.
     */
    List<NameRef> particles();

    /** position(A).x */
    record PositionX(NameRef particle) implements Observable {
        public PositionX {
            Objects.requireNonNull(particle, "Particle cannot be null");
        }

        @Override
        public List<NameRef> particles() {
            return List.of(particle);
        }
    }

    /** position(A).y */
    record PositionY(NameRef particle) implements Observable {
        public PositionY {
            Objects.requireNonNull(particle, "Particle cannot be null");
        }

        @Override
        public List<NameRef> particles() {
            return List.of(particle);
        }
    }

    /** distance(A, B) */
    record Distance(NameRef first, NameRef second) implements Observable {
        public Distance {
            Objects.requireNonNull(first, "First particle cannot be null");
            Objects.requireNonNull(second, "Second particle cannot be null");
        }

        @Override
        public List<NameRef> particles() {
            return List.of(first, second);
        }
    }
}
