package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * Loop body action: force push(A) magnitude 1.0 direction (1.0, 0.0)
 *
 * Adds {@code magnitude} along the normalized direction to the target's velocity.
 */
public record PushAction(NameRef target, Expr magnitude, Expr directionX, Expr directionY, Span span) {

    public PushAction {
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(magnitude, "Magnitude cannot be null");
        Objects.requireNonNull(directionX, "Direction x cannot be null");
        Objects.requireNonNull(directionY, "Direction y cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }
}
