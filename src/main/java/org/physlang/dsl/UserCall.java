package org.physlang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Call to a user-defined function in expression position: offset(i, 2.0)
 *
 * The callee must execute a {@code return}; its value is the value of the call.
 */
public record UserCall(String functionName, List<Expr> arguments) implements Expr {

    public UserCall {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "Arguments cannot be null"));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitUserCall(this);
    }

    @Override
    public String toString() {
        return functionName + arguments.toString().replace('[', '(').replace(']', ')');
    }
}
