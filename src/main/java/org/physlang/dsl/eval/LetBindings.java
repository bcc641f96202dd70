package org.physlang.dsl.eval;

import org.physlang.dsl.analysis.Diagnostics;

import java.util.Objects;

/**
 * Result of evaluating the global let bindings.
 *
 * @param scope       Every binding that evaluated to a finite number
 * @param diagnostics One error per binding that failed
 */
public record LetBindings(GlobalScope scope, Diagnostics diagnostics) {

    public LetBindings {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
