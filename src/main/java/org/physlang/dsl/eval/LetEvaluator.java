package org.physlang.dsl.eval;

import org.physlang.dsl.analysis.Diagnostics;
import org.physlang.dsl.definition.LetStmt;

import java.util.List;

/**
 * Evaluates top-level let bindings once, in declaration order.
 *
 * Each binding sees only the bindings before it. A binding that fails or
 * yields NaN or infinity is reported and left unbound; later bindings are
 * still evaluated.
 */
public final class LetEvaluator {

    private LetEvaluator() {
    }

    public static LetBindings evaluate(List<LetStmt> lets) {
        GlobalScope scope = new GlobalScope();
        Diagnostics diagnostics = new Diagnostics();
        for (LetStmt let : lets) {
            try {
                double value = ExprEvaluator.evaluate(let.value(), scope);
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    diagnostics.error("Let '" + let.name() + "' evaluated to a non-finite value", let.span());
                } else {
                    scope.define(let.name(), value);
                }
            } catch (EvaluationException e) {
                diagnostics.error("Cannot evaluate let '" + let.name() + "': " + e.getMessage(), let.span());
            }
        }
        return new LetBindings(scope, diagnostics);
    }
}
