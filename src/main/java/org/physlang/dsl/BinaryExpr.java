package org.physlang.dsl;

import java.util.Objects;
import java.util.Optional;

/**
 * Binary arithmetic or comparison.
 *
 * Examples:
 * <pre>
 * base + i * 2.0
 * position_index &lt;= 3
 * </pre>
 *
 * Comparisons evaluate to exactly 1.0 (true) or 0.0 (false).
 *
 * @param left     The left operand
 * @param operator The operator
 * @param right    The right operand
 */
public record BinaryExpr(
        Expr left,
        Operator operator,
        Expr right
) implements Expr {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        LESS("<"),
        GREATER(">"),
        LESS_EQUAL("<="),
        GREATER_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return ordinal() >= LESS.ordinal();
        }

        public static Optional<Operator> fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return Optional.of(op);
                }
            }
            return Optional.empty();
        }
    }

    public BinaryExpr {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryExpr add(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.ADD, right);
    }

    public static BinaryExpr subtract(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpr multiply(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpr divide(Expr left, Expr right) {
        return new BinaryExpr(left, Operator.DIVIDE, right);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
