package org.physlang.engine.execution;

import org.physlang.dsl.PhysLangException;
import org.physlang.dsl.analysis.Diagnostics;

import java.util.Objects;

/**
 * A pipeline stage reported one or more error diagnostics.
 */
public class DiagnosticsException extends PhysLangException {

    public enum Stage {
        ANALYSIS,
        LET_EVALUATION,
        POST_ELABORATION_ANALYSIS
    }

    private final Stage stage;
    private final Diagnostics diagnostics;

    public DiagnosticsException(Stage stage, Diagnostics diagnostics) {
        super(describe(stage, diagnostics));
        this.stage = Objects.requireNonNull(stage);
        this.diagnostics = Objects.requireNonNull(diagnostics);
    }

    public Stage getStage() {
        return stage;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    private static String describe(Stage stage, Diagnostics diagnostics) {
        StringBuilder sb = new StringBuilder();
        sb.append(stage).append(" failed with ").append(diagnostics.errors().size()).append(" error(s)");
        diagnostics.errors().forEach(d -> sb.append("\n  ").append(d.message()));
        return sb.toString();
    }
}
