package org.physlang.dsl.definition;

import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * User function: fn name(p1, p2) { body }
 *
 * Parameters are untyped. Each call binds them either to numbers or, when
 * the caller passes a string literal, to a particle name.
 */
public record FunctionDecl(String name, List<String> parameters, List<Stmt> body, Span span) {

    public FunctionDecl {
        Objects.requireNonNull(name, "Name cannot be null");
        parameters = List.copyOf(Objects.requireNonNull(parameters, "Parameters cannot be null"));
        body = List.copyOf(Objects.requireNonNull(body, "Body cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    public int arity() {
        return parameters.size();
    }
}
