package org.physlang.dsl;

import java.util.Objects;

/**
 * Unary negation: -x
 */
public record UnaryMinus(Expr operand) implements Expr {

    public UnaryMinus {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUnaryMinus(this);
    }

    @Override
    public String toString() {
        return "-(" + operand + ")";
    }
}
