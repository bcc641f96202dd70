package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * simulate dt = 0.01 steps = 1000
 */
public record SimulateDecl(Expr dt, Expr steps, Span span) {

    public SimulateDecl {
        Objects.requireNonNull(dt, "dt cannot be null");
        Objects.requireNonNull(steps, "Steps cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }
}
