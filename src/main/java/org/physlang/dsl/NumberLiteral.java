package org.physlang.dsl;

/**
 * Numeric literal: 42, 0.5, 1e-3
 */
public record NumberLiteral(double value) implements Expr {

    public static NumberLiteral of(double value) {
        return new NumberLiteral(value);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
