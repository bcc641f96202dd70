package org.physlang.engine.execution;

import org.physlang.dsl.analysis.Diagnostics;
import org.physlang.dsl.definition.Program;
import org.physlang.engine.runtime.SimulationContext;

import java.util.Objects;

/**
 * A ready-to-step simulation together with the elaborated program it came from
 * and the warnings collected while building it.
 */
public record ContextBuild(Program program, SimulationContext context, Diagnostics diagnostics) {

    public ContextBuild {
        Objects.requireNonNull(program, "Program cannot be null");
        Objects.requireNonNull(context, "Context cannot be null");
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
    }
}
