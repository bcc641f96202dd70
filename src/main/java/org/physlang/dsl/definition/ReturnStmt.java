package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * return expr
 */
public record ReturnStmt(Expr value, Span span) implements Stmt {

    public ReturnStmt {
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitReturn(this);
    }
}
