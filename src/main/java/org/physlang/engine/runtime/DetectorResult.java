package org.physlang.engine.runtime;

import java.util.Objects;

/**
 * Final value of a named detector.
 */
public record DetectorResult(String name, double value) {

    public DetectorResult {
        Objects.requireNonNull(name, "Name cannot be null");
    }
}
