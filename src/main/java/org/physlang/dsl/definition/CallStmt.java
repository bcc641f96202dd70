package org.physlang.dsl.definition;

import org.physlang.dsl.Expr;
import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * Function call used as a statement: make_pair("A", "B", 2.0)
 */
public record CallStmt(String functionName, List<Expr> arguments, Span span) implements Stmt {

    public CallStmt {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "Arguments cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    @Override
    public <T> T accept(StmtVisitor<T> visitor) {
        return visitor.visitCall(this);
    }
}
