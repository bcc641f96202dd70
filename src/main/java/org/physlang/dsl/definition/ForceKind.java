package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;

import java.util.Objects;

/**
 * Pairwise force law with its parameter expressions.
 */
public sealed interface ForceKind permits ForceKind.Gravity, ForceKind.Spring {

    /**
     * Newtonian attraction with constant G.
     */
    record Gravity(Expr g) implements ForceKind {
        public Gravity {
            Objects.requireNonNull(g, "G cannot be null");
        }
    }

    /**
     * Hookean spring with stiffness k and rest length.
     */
    record Spring(Expr k, Expr rest) implements ForceKind {
        public Spring {
            Objects.requireNonNull(k, "k cannot be null");
            Objects.requireNonNull(rest, "Rest length cannot be null");
        }
    }
}
