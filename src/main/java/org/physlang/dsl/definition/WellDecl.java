package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.Objects;

/**
 * Potential well: well trap on A if position(A).x &gt;= 5.0 depth 10.0
 */
public record WellDecl(
        String name,
        NameRef target,
        Observable observable,
        Expr threshold,
        Expr depth,
        Span span) implements Stmt {

    public WellDecl {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(target, "Target cannot be null");
        Objects.requireNonNull(observable, "Observable cannot be null");
        Objects.requireNonNull(threshold, "Threshold cannot be null");
        Objects.requireNonNull(depth, "Depth cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitWell(this);
    }
}
