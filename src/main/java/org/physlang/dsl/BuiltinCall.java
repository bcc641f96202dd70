package org.physlang.dsl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Call to one of the built-in math functions: sin(x), cos(x), sqrt(x), clamp(x, lo, hi)
 */
public record BuiltinCall(Builtin function, List<Expr> arguments) implements Expr {

    public enum Builtin {
        SIN("sin", 1),
        COS("cos", 1),
        SQRT("sqrt", 1),
        CLAMP("clamp", 3);

        private final String functionName;
        private final int arity;

        Builtin(String functionName, int arity) {
            this.functionName = functionName;
            this.arity = arity;
        }

        public String functionName() {
            return functionName;
        }

        public int arity() {
            return arity;
        }

        public static Optional<Builtin> fromName(String name) {
            for (Builtin builtin : values()) {
                if (builtin.functionName.equals(name)) {
                    return Optional.of(builtin);
                }
            }
            return Optional.empty();
        }
    }

    public BuiltinCall {
        Objects.requireNonNull(function, "Function cannot be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "Arguments cannot be null"));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitBuiltinCall(this);
    }

    @Override
    public String toString() {
        return function.functionName() + arguments.toString().replace('[', '(').replace(']', ')');
    }
}
