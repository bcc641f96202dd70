package org.physlang.dsl.definition;

import java.util.List;
import java.util.Objects;

/**
 * What a detector measures at the end of the run.
 */
public sealed interface DetectorKind permits DetectorKind.Position, DetectorKind.Distance {

    List<NameRef> particles();

    /** position(A): reports the x coordinate. */
    record Position(NameRef particle) implements DetectorKind {
        public Position {
            Objects.requireNonNull(particle, "Particle cannot be null");
        }

        @Override
        public List<NameRef> particles() {
            return List.of(particle);
        }
    }

    /** distance(A, B): reports the Euclidean distance. */
    record Distance(NameRef first, NameRef second) implements DetectorKind {
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
