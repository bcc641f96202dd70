package org.physlang.engine.execution;

import org.physlang.dsl.analysis.Diagnostics;
import org.physlang.engine.runtime.DetectorResult;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a complete run.
 *
 * @param detectors   Detector values in declaration order
 * @param steps       Number of steps executed
 * @param diagnostics Warnings collected on the way
 */
public record SimulationResult(List<DetectorResult> detectors, long steps, Diagnostics diagnostics) {

    public SimulationResult {
        detectors = List.copyOf(Objects.requireNonNull(detectors, "Detectors cannot be null"));
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
    }

    public Optional<Double> detector(String name) {
        return detectors.stream().filter(d -> d.name().equals(name)).map(DetectorResult::value).findFirst();
    }
}
