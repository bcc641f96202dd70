package org.physlang.dsl;

import java.util.Objects;

/**
 * String literal: "A"
 */
public record StringLiteral(String value) implements Expr {

    public StringLiteral {
        Objects.requireNonNull(value, "Value cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
