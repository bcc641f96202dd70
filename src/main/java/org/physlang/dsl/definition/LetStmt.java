package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * Let binding: let spacing = 2.0
 *
 * At top level this is a global binding evaluated once before elaboration;
 * inside a block it binds a local for the statements that follow it.
 */
public record LetStmt(String name, Expr value, Span span) implements Stmt {

    public LetStmt {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitLet(this);
    }
}
