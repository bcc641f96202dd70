package org.physlang.dsl;

import java.util.Objects;

/**
 * Reference to a let binding, function parameter or loop variable.
 */
public record VariableRef(String name) implements Expr {

    public VariableRef {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
