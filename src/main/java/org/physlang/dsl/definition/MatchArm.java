package org.physlang.dsl.definition;

import org.physlang.dsl.Span;

import java.util.List;
import java.util.Objects;

/**
 * One arm of a match statement.
 */
public record MatchArm(MatchPattern pattern, List<Stmt> body, Span span) {

    public MatchArm {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        body = List.copyOf(Objects.requireNonNull(body, "Body cannot be null"));
        Objects.requireNonNull(span, "Span cannot be null");
    }

    public boolean isWildcard() {
        return pattern instanceof MatchPattern.Wildcard;
    }
}
