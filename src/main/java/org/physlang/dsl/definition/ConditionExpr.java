package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;

import java.util.Objects;

/**
 * Loop condition: an observable compared against a threshold.
 *
 * <pre>
 * position(A).x &lt; 5.0
 * distance(A, B) &gt; 2.0
 * </pre>
 */
public record ConditionExpr(Observable observable, Comparison comparison, Expr threshold) {

    public enum Comparison {
        LESS("<"),
        GREATER(">");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(double value, double threshold) {
            return this == LESS ? value < threshold : value > threshold;
        }

        public static Comparison fromSymbol(String symbol) {
            return switch (symbol) {
                case "<" -> LESS;
                case ">" -> GREATER;
                default -> throw new IllegalArgumentException("Unsupported comparison: " + symbol);
            };
        }
    }

    public ConditionExpr {
        Objects.requireNonNull(observable, "Observable cannot be null");
        Objects.requireNonNull(comparison, "Comparison cannot be null");
        Objects.requireNonNull(threshold, "Threshold cannot be null");
    }
}
