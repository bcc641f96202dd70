package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * for i in start..end { ... }
 *
 * Bounds are floored to integers and the range is half-open.
 */
public record ForStmt(String variable, Expr start, Expr end, List<Stmt> body, Span span) implements Stmt {

    public ForStmt {
        Objects.requireNonNull(variable, "Variable cannot be null");
        Objects.requireNonNull(start, "Start cannot be null");
        Objects.requireNonNull(end, "End cannot be null");
        body = List.copyOf(Objects.requireNonNull(body, "Body cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitFor(this);
    }
}
