package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * if cond { ... } else { ... }
 *
 * A non-zero condition selects the then branch. {@code elseBody} is empty
 * when no else branch was written.
 */
public record IfStmt(Expr condition, List<Stmt> thenBody, List<Stmt> elseBody, Span span) implements Stmt {

    public IfStmt {
        Objects.requireNonNull(condition, "Condition cannot be null");
        thenBody = List.copyOf(Objects.requireNonNull(thenBody, "Then body cannot be null"));
        elseBody = List.copyOf(Objects.requireNonNull(elseBody, "Else body cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitIf(this);
    }
}
