package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * match expr { 0 => { ... } 1 => { ... } _ => { ... } }
 *
 * The scrutinee is rounded to the nearest integer and the first arm that
 * matches runs. No matching arm is a no-op.
 */
public record MatchStmt(Expr scrutinee, List<MatchArm> arms, Span span) implements Stmt {

    public MatchStmt {
        Objects.requireNonNull(scrutinee, "Scrutinee cannot be null");
        arms = List.copyOf(Objects.requireNonNull(arms, "Arms cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitMatch(this);
    }
}
